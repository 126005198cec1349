package com.civic.realtime.service.connection;

import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives reconnection with exponential backoff after the transport reports a drop.
 *
 * Each attempt releases and recreates every registry channel. An attempt
 * succeeds when a resubscribed channel acknowledges (or immediately when there
 * is nothing to resubscribe) and fails when the transport throws, reports
 * another drop, or stays silent past the acknowledgment timeout. An
 * unrecoverable transport fault ends the cycle at once. Delays are scheduled
 * on the task scheduler, never slept.
 *
 * All state is guarded by the owning manager's monitor, shared with every
 * callback the controller makes into it.
 */
@Slf4j
public class ReconnectionController {

    /**
     * Callbacks into the connection owner. Invoked with the shared monitor held.
     */
    public interface Target {

        /**
         * An attempt has been scheduled.
         */
        void onReconnecting(int attempt, long delayMs);

        /**
         * Releases and reopens every subscription channel.
         *
         * @return number of channels opened and awaiting acknowledgment
         */
        int resubscribeAll();

        void onReconnected(int attempts);

        void onReconnectExhausted(RealtimeException error);

        /**
         * The transport raised an unrecoverable fault mid-attempt; no further attempt is scheduled.
         */
        void onFatal(RealtimeException error);
    }

    private enum Phase {
        IDLE,
        WAITING,
        AWAITING_ACK
    }

    private final Object monitor;
    private final Target target;
    private final BackoffPolicy backoff;
    private final TaskScheduler scheduler;
    private final MetricsAggregator metrics;
    private final int maxAttempts;
    private final long ackTimeoutMs;

    private Phase phase = Phase.IDLE;
    private int attempt;
    private long generation;
    private ScheduledFuture<?> pending;

    public ReconnectionController(Object monitor,
                                  Target target,
                                  BackoffPolicy backoff,
                                  RealtimeConfig.Reconnect config,
                                  TaskScheduler scheduler,
                                  MetricsAggregator metrics) {
        config.validate();
        this.monitor = monitor;
        this.target = target;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.maxAttempts = config.getMaxAttempts();
        this.ackTimeoutMs = config.getAckTimeoutMs();
    }

    // ==================== Signals ====================

    /**
     * The transport reported a timeout, drop or recoverable channel error.
     */
    public void onConnectionLost(Throwable cause) {
        synchronized (monitor) {
            switch (phase) {
                case IDLE -> {
                    log.warn("Connection lost ({}), starting reconnection", describe(cause));
                    attempt = 0;
                    scheduleNextAttempt();
                }
                case WAITING -> log.debug("Reconnection already scheduled, ignoring: {}", describe(cause));
                case AWAITING_ACK -> attemptFailed(cause);
            }
        }
    }

    /**
     * A resubscribed channel acknowledged.
     */
    public void onAcknowledged() {
        synchronized (monitor) {
            if (phase == Phase.AWAITING_ACK) {
                succeed();
            }
        }
    }

    /**
     * Stops any cycle in progress and forgets the attempt count.
     */
    public void cancel() {
        synchronized (monitor) {
            cancelPending();
            phase = Phase.IDLE;
            attempt = 0;
            generation++;
        }
    }

    public int getAttempt() {
        synchronized (monitor) {
            return attempt;
        }
    }

    // ==================== Attempt Cycle ====================

    private void scheduleNextAttempt() {
        cancelPending();
        if (attempt >= maxAttempts) {
            phase = Phase.IDLE;
            generation++;
            log.error("Giving up after {} reconnection attempts", attempt);
            target.onReconnectExhausted(new RealtimeException(
                    "Failed to reconnect after " + attempt + " attempts",
                    RealtimeException.RECONNECT_EXHAUSTED));
            return;
        }

        long delayMs = backoff.delayFor(attempt);
        attempt++;
        long scheduledGeneration = ++generation;
        phase = Phase.WAITING;

        metrics.recordReconnectAttempt();
        log.info("Reconnection attempt {}/{} in {} ms", attempt, maxAttempts, delayMs);
        target.onReconnecting(attempt, delayMs);

        pending = scheduler.schedule(() -> runAttempt(scheduledGeneration), in(delayMs));
    }

    private void runAttempt(long scheduledGeneration) {
        synchronized (monitor) {
            if (scheduledGeneration != generation || phase != Phase.WAITING) {
                return;
            }
            pending = null;
            // acknowledgments may arrive synchronously while resubscribing
            phase = Phase.AWAITING_ACK;

            int opened;
            try {
                opened = target.resubscribeAll();
            } catch (TransportException e) {
                if (scheduledGeneration == generation) {
                    if (e.isRecoverable()) {
                        attemptFailed(e);
                    } else {
                        abort(e);
                    }
                }
                return;
            } catch (Exception e) {
                if (scheduledGeneration == generation) {
                    attemptFailed(e);
                }
                return;
            }

            if (scheduledGeneration != generation) {
                return;
            }
            if (opened == 0) {
                succeed();
                return;
            }
            pending = scheduler.schedule(() -> onAckTimeout(scheduledGeneration), in(ackTimeoutMs));
        }
    }

    private void onAckTimeout(long scheduledGeneration) {
        synchronized (monitor) {
            if (scheduledGeneration == generation && phase == Phase.AWAITING_ACK) {
                attemptFailed(new RealtimeException(
                        "No acknowledgment within " + ackTimeoutMs + " ms",
                        RealtimeException.TRANSPORT_ERROR));
            }
        }
    }

    private void attemptFailed(Throwable cause) {
        log.warn("Reconnection attempt {}/{} failed: {}", attempt, maxAttempts, describe(cause));
        scheduleNextAttempt();
    }

    private void abort(TransportException cause) {
        int used = attempt;
        cancelPending();
        phase = Phase.IDLE;
        attempt = 0;
        generation++;
        log.error("Unrecoverable transport fault on reconnection attempt {}/{}: {}", used, maxAttempts, cause.getMessage());
        target.onFatal(new RealtimeException(
                "Unrecoverable transport fault during reconnection attempt " + used,
                RealtimeException.TRANSPORT_ERROR, cause));
    }

    private void succeed() {
        int used = attempt;
        cancelPending();
        phase = Phase.IDLE;
        attempt = 0;
        generation++;
        metrics.recordReconnectSuccess();
        log.info("Reconnected after {} attempt(s)", used);
        target.onReconnected(used);
    }

    // ==================== Helpers ====================

    private Instant in(long delayMs) {
        return scheduler.getClock().instant().plusMillis(delayMs);
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown cause" : cause.getMessage();
    }
}
