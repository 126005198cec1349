package com.civic.realtime.service.api.health;

import com.civic.realtime.service.connection.ConnectionManager;
import com.civic.realtime.service.model.ConnectionState;
import com.civic.realtime.service.model.MetricsView;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the realtime connection.
 *
 * DOWN in ERROR, OUT_OF_SERVICE while disconnected, otherwise UP with the
 * heartbeat flagged when stale.
 */
@Component("realtimeConnection")
@RequiredArgsConstructor
public class RealtimeConnectionHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;

    @Override
    public Health health() {
        ConnectionState state = connectionManager.getConnectionStatus();
        MetricsView metrics = connectionManager.getMetricsSnapshot();

        Health.Builder builder = switch (state) {
            case ERROR -> Health.down();
            case DISCONNECTED -> Health.outOfService();
            default -> Health.up();
        };

        builder.withDetail("state", state)
                .withDetail("subscriptions", connectionManager.getActiveSubscriptions().size())
                .withDetail("heartbeatStale", connectionManager.isHeartbeatStale())
                .withDetail("reconnectAttempts", metrics.reconnectAttempts())
                .withDetail("uptimeMs", metrics.uptimeMs());
        if (metrics.lastHeartbeat() != null) {
            builder.withDetail("lastHeartbeat", metrics.lastHeartbeat());
        }
        return builder.build();
    }
}
