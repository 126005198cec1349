package com.civic.realtime.service.api.controller;

import com.civic.realtime.service.api.dto.ApiResponse;
import com.civic.realtime.service.api.dto.ConnectionStatusResponse;
import com.civic.realtime.service.connection.ConnectionManager;
import com.civic.realtime.service.model.MetricsView;
import com.civic.realtime.service.model.SubscriptionKey;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller exposing connection state, metrics and recovery.
 */
@Slf4j
@RestController
@RequestMapping("/realtime")
@Tag(name = "Realtime Connection", description = "Connection status, metrics and recovery")
@RequiredArgsConstructor
public class RealtimeStatusController {

    private final ConnectionManager connectionManager;

    @GetMapping("/status")
    @Operation(summary = "Get connection status",
            description = "Returns the connection state, registered subscriptions and heartbeat liveness")
    public ResponseEntity<ApiResponse<ConnectionStatusResponse>> getStatus() {
        MetricsView metrics = connectionManager.getMetricsSnapshot();
        List<String> keys = connectionManager.getActiveSubscriptions().stream()
                .map(SubscriptionKey::channelName)
                .toList();

        ConnectionStatusResponse response = ConnectionStatusResponse.builder()
                .state(connectionManager.getConnectionStatus())
                .subscriptions(keys)
                .subscriptionCount(keys.size())
                .heartbeatStale(connectionManager.isHeartbeatStale())
                .lastHeartbeat(metrics.lastHeartbeat())
                .connectedSince(metrics.connectedSince())
                .build();

        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Get metrics snapshot")
    public ResponseEntity<ApiResponse<MetricsView>> getMetrics() {
        return ResponseEntity.ok(ApiResponse.success(connectionManager.getMetricsSnapshot()));
    }

    /**
     * Resets the in-memory counters. Micrometer meters are not affected.
     *
     * @return the snapshot taken before the reset
     */
    @PostMapping("/metrics/reset")
    @Operation(summary = "Reset metrics", description = "Resets counters and returns the values they had")
    public ResponseEntity<ApiResponse<MetricsView>> resetMetrics() {
        MetricsView previous = connectionManager.resetMetrics();
        log.info("Metrics reset via API, previous totalEvents={}", previous.totalEvents());
        return ResponseEntity.ok(ApiResponse.success(previous));
    }

    @PostMapping("/reinitialize")
    @Operation(summary = "Reinitialize the connection",
            description = "Cancels any reconnection and reopens every registered subscription. The only way out of ERROR.")
    public ResponseEntity<ApiResponse<String>> reinitialize() {
        log.info("Reinitialize requested via API from state {}", connectionManager.getConnectionStatus());
        connectionManager.reinitialize();
        return ResponseEntity.accepted()
                .body(ApiResponse.success(connectionManager.getConnectionStatus().name()));
    }
}
