package com.civic.realtime.service.api.dto;

import com.civic.realtime.service.model.ConnectionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Current connection state as reported to operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStatusResponse {

    private ConnectionState state;

    /**
     * Registered subscriptions rendered as {@code scopeId:table}.
     */
    private List<String> subscriptions;

    private int subscriptionCount;

    private boolean heartbeatStale;

    private Instant lastHeartbeat;

    private Instant connectedSince;
}
