package com.civic.realtime.service.metrics;

import com.civic.realtime.service.model.ChangeEventKind;
import com.civic.realtime.service.model.MetricsView;

import java.time.Instant;

/**
 * Accumulates operational metrics for one connection manager.
 *
 * Counters are monotonic except on {@link #reset()}. Each counter is mutated
 * only by the component owning the corresponding operation.
 */
public interface MetricsAggregator {

    /**
     * Records an event admitted for delivery.
     *
     * @param kind the change kind
     * @param table the source table
     * @param processingTimeMs time spent in the admission pipeline
     */
    void record(ChangeEventKind kind, String table, double processingTimeMs);

    void recordReconnectAttempt();

    void recordReconnectSuccess();

    void recordRateLimited();

    void recordDeduplicated();

    /**
     * Records an event dropped because the subscriber mailbox was full.
     */
    void recordDropped();

    /**
     * Records a consumer callback that threw.
     */
    void recordCallbackError();

    void recordHeartbeat(Instant at);

    /**
     * Starts the uptime clock.
     */
    void markConnected(Instant since);

    /**
     * Stops the uptime clock.
     */
    void markDisconnected();

    /**
     * Gets the last recorded heartbeat, or null if none.
     */
    Instant lastHeartbeat();

    /**
     * Takes a snapshot copy of the current metrics.
     */
    MetricsView snapshot();

    /**
     * Resets every counter.
     *
     * @return the snapshot taken just before the reset
     */
    MetricsView reset();
}
