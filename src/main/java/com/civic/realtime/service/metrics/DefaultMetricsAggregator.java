package com.civic.realtime.service.metrics;

import com.civic.realtime.service.config.MetricsConfig;
import com.civic.realtime.service.model.ChangeEventKind;
import com.civic.realtime.service.model.MetricsView;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Default implementation of MetricsAggregator.
 *
 * Keeps resettable in-memory counters for snapshots and mirrors every
 * increment into Micrometer. Average latency is maintained incrementally.
 */
@Slf4j
public class DefaultMetricsAggregator implements MetricsAggregator {

    private final MetricsConfig meters;
    private final Clock clock;

    private long totalEvents;
    private final Map<ChangeEventKind, Long> eventsByKind = new EnumMap<>(ChangeEventKind.class);
    private final Map<String, Long> eventsByTable = new HashMap<>();
    private long reconnectAttempts;
    private long successfulReconnects;
    private long rateLimitedEvents;
    private long deduplicatedEvents;
    private long droppedEvents;
    private long callbackErrors;
    private double avgProcessingTimeMs;
    private Instant lastHeartbeat;
    private Instant connectedSince;

    public DefaultMetricsAggregator(MetricsConfig meters, Clock clock) {
        this.meters = meters;
        this.clock = clock;
    }

    @Override
    public synchronized void record(ChangeEventKind kind, String table, double processingTimeMs) {
        totalEvents++;
        eventsByKind.merge(kind, 1L, Long::sum);
        eventsByTable.merge(table, 1L, Long::sum);
        avgProcessingTimeMs = (avgProcessingTimeMs * (totalEvents - 1) + processingTimeMs) / totalEvents;

        meters.countEvent(kind, table);
        meters.recordProcessingTime(processingTimeMs);
    }

    @Override
    public synchronized void recordReconnectAttempt() {
        reconnectAttempts++;
        meters.getReconnectAttempts().increment();
    }

    @Override
    public synchronized void recordReconnectSuccess() {
        successfulReconnects++;
        meters.getSuccessfulReconnects().increment();
    }

    @Override
    public synchronized void recordRateLimited() {
        rateLimitedEvents++;
        meters.getRateLimitedEvents().increment();
    }

    @Override
    public synchronized void recordDeduplicated() {
        deduplicatedEvents++;
        meters.getDeduplicatedEvents().increment();
    }

    @Override
    public synchronized void recordDropped() {
        droppedEvents++;
        meters.getDroppedEvents().increment();
    }

    @Override
    public synchronized void recordCallbackError() {
        callbackErrors++;
        meters.getCallbackErrors().increment();
    }

    @Override
    public synchronized void recordHeartbeat(Instant at) {
        lastHeartbeat = at;
        meters.getHeartbeats().increment();
    }

    @Override
    public synchronized void markConnected(Instant since) {
        if (connectedSince == null) {
            connectedSince = since;
        }
    }

    @Override
    public synchronized void markDisconnected() {
        connectedSince = null;
    }

    @Override
    public synchronized Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    @Override
    public synchronized MetricsView snapshot() {
        Instant now = clock.instant();
        long uptimeMs = connectedSince != null
                ? Math.max(0, Duration.between(connectedSince, now).toMillis())
                : 0;

        return new MetricsView(
                totalEvents,
                eventsByKind,
                eventsByTable,
                reconnectAttempts,
                successfulReconnects,
                rateLimitedEvents,
                deduplicatedEvents,
                droppedEvents,
                callbackErrors,
                avgProcessingTimeMs,
                lastHeartbeat,
                connectedSince,
                uptimeMs,
                now
        );
    }

    @Override
    public synchronized MetricsView reset() {
        MetricsView before = snapshot();

        totalEvents = 0;
        eventsByKind.clear();
        eventsByTable.clear();
        reconnectAttempts = 0;
        successfulReconnects = 0;
        rateLimitedEvents = 0;
        deduplicatedEvents = 0;
        droppedEvents = 0;
        callbackErrors = 0;
        avgProcessingTimeMs = 0;
        lastHeartbeat = null;
        // connectedSince describes the live connection, not an accumulated counter

        log.info("Realtime metrics reset after {} events", before.totalEvents());
        return before;
    }
}
