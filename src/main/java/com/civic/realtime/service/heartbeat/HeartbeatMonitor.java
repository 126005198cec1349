package com.civic.realtime.service.heartbeat;

import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.transport.BroadcastPayload;
import com.civic.realtime.service.transport.ChannelHandle;
import com.civic.realtime.service.transport.ChannelStatus;
import com.civic.realtime.service.transport.RealtimeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically broadcasts a liveness ping on a dedicated channel.
 *
 * Purely diagnostic: a stale heartbeat is reported through {@link #isStale(Instant)}
 * but never triggers reconnection, which stays driven by transport status.
 * A channel that fails a send or reports a drop is released and reopened on
 * the next beat.
 */
@Slf4j
public class HeartbeatMonitor {

    static final String HEARTBEAT_EVENT = "heartbeat";

    private final RealtimeTransport transport;
    private final TaskScheduler scheduler;
    private final MetricsAggregator metrics;
    private final Clock clock;
    private final String channelName;
    private final Duration interval;

    private ChannelHandle channel;
    private ScheduledFuture<?> task;
    private Instant startedAt;

    public HeartbeatMonitor(RealtimeConfig.Heartbeat config,
                            RealtimeTransport transport,
                            TaskScheduler scheduler,
                            MetricsAggregator metrics,
                            Clock clock) {
        config.validate();
        this.transport = transport;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.channelName = config.getChannelName();
        this.interval = Duration.ofMillis(config.getIntervalMs());
    }

    public synchronized void start() {
        if (task != null) return;
        startedAt = clock.instant();
        openChannel();
        task = scheduler.scheduleAtFixedRate(this::beat, scheduler.getClock().instant().plus(interval), interval);
        log.info("Heartbeat started on channel '{}' every {} ms", channelName, interval.toMillis());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        releaseChannel();
        startedAt = null;
        log.info("Heartbeat stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Sends one heartbeat now.
     *
     * @return true if the ping went out
     */
    public synchronized boolean beat() {
        if (channel == null && !openChannel()) {
            return false;
        }
        Instant now = clock.instant();
        try {
            channel.send(BroadcastPayload.broadcast(HEARTBEAT_EVENT, Map.of("timestamp", now.toEpochMilli())));
            metrics.recordHeartbeat(now);
            log.debug("Heartbeat sent at {}", now);
            return true;
        } catch (Exception e) {
            log.warn("Heartbeat send failed on '{}', releasing channel: {}", channelName, e.getMessage());
            releaseChannel();
            return false;
        }
    }

    /**
     * Whether no heartbeat was recorded for more than two intervals.
     */
    public synchronized boolean isStale(Instant now) {
        if (startedAt == null) return false;
        Instant last = metrics.lastHeartbeat();
        Instant reference = last != null && last.isAfter(startedAt) ? last : startedAt;
        return Duration.between(reference, now).compareTo(interval.multipliedBy(2)) > 0;
    }

    private boolean openChannel() {
        try {
            ChannelHandle opened = transport.channel(channelName);
            channel = opened;
            opened.subscribe((status, error) -> onStatus(opened, status, error));
            return true;
        } catch (Exception e) {
            log.warn("Could not open heartbeat channel '{}': {}", channelName, e.getMessage());
            channel = null;
            return false;
        }
    }

    private synchronized void onStatus(ChannelHandle source, ChannelStatus status, Throwable error) {
        if (source != channel) {
            return;
        }
        switch (status) {
            case SUBSCRIBED -> metrics.recordHeartbeat(clock.instant());
            // already gone on the transport side
            case CLOSED -> channel = null;
            case CHANNEL_ERROR, TIMED_OUT -> {
                log.warn("Heartbeat channel reported {}: {}", status, error != null ? error.getMessage() : "-");
                releaseChannel();
            }
        }
    }

    private void releaseChannel() {
        ChannelHandle released = channel;
        channel = null;
        if (released == null) {
            return;
        }
        try {
            transport.removeChannel(released);
        } catch (Exception e) {
            log.warn("Failed to release heartbeat channel: {}", e.getMessage());
        }
    }
}
