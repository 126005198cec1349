package com.civic.realtime.service.api.controller;

import com.civic.realtime.service.api.dto.ApiResponse;
import com.civic.realtime.service.api.dto.ChangeEventRequest;
import com.civic.realtime.service.api.dto.PublishResult;
import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.transport.InMemoryRealtimeTransport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

/**
 * Controller feeding changes into the loopback transport.
 *
 * Only available while the in-memory transport is the active one.
 */
@Slf4j
@RestController
@RequestMapping("/realtime/changes")
@Tag(name = "Change Feed", description = "Publish row changes into the in-memory transport")
@RequiredArgsConstructor
public class ChangeFeedController {

    private final ObjectProvider<InMemoryRealtimeTransport> transportProvider;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Publish a change",
            description = "Fans the change out to every open channel whose table and row filter match.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Change published"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid change"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Loopback transport not active")
    })
    public ResponseEntity<ApiResponse<PublishResult>> publish(@Valid @RequestBody ChangeEventRequest request) {
        InMemoryRealtimeTransport transport = transportProvider.getIfAvailable();
        if (transport == null) {
            throw new IllegalStateException("Change feed requires the in-memory transport");
        }

        ChangeEvent<Map<String, Object>> event = ChangeEvent.ofRows(
                request.getKind(),
                request.getTable(),
                request.getNewRecord(),
                request.getOldRecord(),
                request.getCommitTimestamp() != null ? request.getCommitTimestamp() : clock.instant());

        int deliveries = transport.publish(event);
        log.debug("Published {} on {} via API, {} deliveries", event.kind(), event.table(), deliveries);

        return ResponseEntity.accepted()
                .body(ApiResponse.success(new PublishResult(event.table(), deliveries)));
    }
}
