package com.civic.realtime.service.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the realtime metrics. Never a live reference.
 */
public record MetricsView(
        long totalEvents,
        Map<ChangeEventKind, Long> eventsByKind,
        Map<String, Long> eventsByTable,
        long reconnectAttempts,
        long successfulReconnects,
        long rateLimitedEvents,
        long deduplicatedEvents,
        long droppedEvents,
        long callbackErrors,
        double avgProcessingTimeMs,
        Instant lastHeartbeat,
        Instant connectedSince,
        long uptimeMs,
        Instant capturedAt
) {

    public MetricsView {
        eventsByKind = Map.copyOf(eventsByKind);
        eventsByTable = Map.copyOf(eventsByTable);
    }

    public long eventsOfKind(ChangeEventKind kind) {
        return eventsByKind.getOrDefault(kind, 0L);
    }

    public long eventsForTable(String table) {
        return eventsByTable.getOrDefault(table, 0L);
    }
}
