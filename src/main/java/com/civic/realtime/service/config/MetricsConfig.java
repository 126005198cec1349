package com.civic.realtime.service.config;

import com.civic.realtime.service.model.ChangeEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for the realtime layer.
 *
 * These mirror the in-memory aggregator and stay monotonic across metric resets.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter reconnectAttempts;
    private final Counter successfulReconnects;
    private final Counter rateLimitedEvents;
    private final Counter deduplicatedEvents;
    private final Counter droppedEvents;
    private final Counter callbackErrors;
    private final Counter heartbeats;

    // Timers
    private final Timer processingTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.reconnectAttempts = Counter.builder("realtime.reconnect.attempts")
                .description("Number of reconnection attempts scheduled")
                .register(registry);

        this.successfulReconnects = Counter.builder("realtime.reconnect.success")
                .description("Number of successful reconnections")
                .register(registry);

        this.rateLimitedEvents = Counter.builder("realtime.ratelimit.count")
                .description("Number of events rejected by the rate limiter")
                .register(registry);

        this.deduplicatedEvents = Counter.builder("realtime.dedup.count")
                .description("Number of events dropped as duplicates")
                .register(registry);

        this.droppedEvents = Counter.builder("realtime.dispatch.dropped")
                .description("Number of events dropped because a subscriber mailbox was full")
                .register(registry);

        this.callbackErrors = Counter.builder("realtime.callback.errors")
                .description("Number of consumer callbacks that threw")
                .register(registry);

        this.heartbeats = Counter.builder("realtime.heartbeat.count")
                .description("Number of heartbeats recorded")
                .register(registry);

        this.processingTimer = Timer.builder("realtime.event.processing")
                .description("Time taken to admit an event before dispatch")
                .register(registry);
    }

    /**
     * Increments the per-kind, per-table event counter.
     */
    public void countEvent(ChangeEventKind kind, String table) {
        Counter.builder("realtime.events.count")
                .description("Number of change events admitted for delivery")
                .tag("kind", kind.name())
                .tag("table", table)
                .register(registry)
                .increment();
    }

    public void recordProcessingTime(double processingTimeMs) {
        processingTimer.record(Duration.ofNanos((long) (processingTimeMs * 1_000_000)));
    }

    /**
     * Registers a gauge backed by a supplier.
     *
     * @param name the metric name
     * @param description the metric description
     * @param supplier supplier for the current value
     */
    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
                .description(description)
                .register(registry);
    }
}
