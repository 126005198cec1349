package com.civic.realtime.service.subscription;

import com.civic.realtime.service.config.MetricsConfig;
import com.civic.realtime.service.metrics.DefaultMetricsAggregator;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ChangeEventKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionTest {

    private MetricsAggregator metrics;

    @BeforeEach
    void setUp() {
        metrics = new DefaultMetricsAggregator(new MetricsConfig(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    @Test
    void consumerFailureIsCountedAndForwarded() {
        List<Throwable> errors = new ArrayList<>();
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .recordType(rawType())
                        .onEvent(e -> {
                            throw new IllegalStateException("consumer bug");
                        })
                        .onError(errors::add)
                        .build(),
                Function.identity(), 4, Runnable::run, metrics, s -> { });

        assertThat(subscription.enqueue(insert("v1"))).isTrue();

        assertThat(errors).singleElement().isInstanceOf(IllegalStateException.class);
        assertThat(metrics.snapshot().callbackErrors()).isEqualTo(1);
    }

    @Test
    void fullMailboxRejectsEvents() {
        List<Runnable> pending = new ArrayList<>();
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .recordType(rawType())
                        .onEvent(e -> { })
                        .build(),
                Function.identity(), 2, pending::add, metrics, s -> { });

        assertThat(subscription.enqueue(insert("v1"))).isTrue();
        assertThat(subscription.enqueue(insert("v2"))).isTrue();
        assertThat(subscription.enqueue(insert("v3"))).isFalse();
        assertThat(subscription.pendingEvents()).isEqualTo(2);
        assertThat(pending).hasSize(1);
        assertThat(metrics.snapshot().droppedEvents()).isEqualTo(1);
    }

    @Test
    void rejectedDrainDropsPendingEvents() {
        List<String> ids = new ArrayList<>();
        List<Runnable> accepted = new ArrayList<>();
        boolean[] saturated = {true};
        Executor executor = task -> {
            if (saturated[0]) {
                throw new RejectedExecutionException("dispatch queue full");
            }
            accepted.add(task);
        };
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .recordType(rawType())
                        .onEvent(e -> ids.add((String) e.newRecord().get("id")))
                        .build(),
                Function.identity(), 8, executor, metrics, s -> { });

        assertThat(subscription.enqueue(insert("v1"))).isFalse();
        assertThat(subscription.pendingEvents()).isZero();
        assertThat(metrics.snapshot().droppedEvents()).isEqualTo(1);

        saturated[0] = false;
        assertThat(subscription.enqueue(insert("v2"))).isTrue();
        accepted.forEach(Runnable::run);

        assertThat(ids).containsExactly("v2");
        assertThat(metrics.snapshot().droppedEvents()).isEqualTo(1);
    }

    @Test
    void eventsAreDeliveredInOrder() {
        List<String> ids = new ArrayList<>();
        List<Runnable> pending = new ArrayList<>();
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .recordType(rawType())
                        .onEvent(e -> ids.add((String) e.newRecord().get("id")))
                        .build(),
                Function.identity(), 8, pending::add, metrics, s -> { });

        subscription.enqueue(insert("v1"));
        subscription.enqueue(insert("v2"));
        subscription.enqueue(insert("v3"));
        pending.get(0).run();

        assertThat(ids).containsExactly("v1", "v2", "v3");
    }

    @Test
    void kindFilter() {
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .kinds(Set.of(ChangeEventKind.DELETE))
                        .recordType(rawType())
                        .onEvent(e -> { })
                        .build(),
                Function.identity(), 2, Runnable::run, metrics, s -> { });

        assertThat(subscription.accepts(ChangeEventKind.DELETE)).isTrue();
        assertThat(subscription.accepts(ChangeEventKind.INSERT)).isFalse();
    }

    @Test
    void unsubscribeDelegatesToOwner() {
        List<Subscription<?>> unsubscribed = new ArrayList<>();
        Subscription<Map<String, Object>> subscription = new Subscription<>(
                SubscriptionRequest.<Map<String, Object>>builder()
                        .scopeId("s1")
                        .table("votes")
                        .recordType(rawType())
                        .onEvent(e -> { })
                        .build(),
                Function.identity(), 2, Runnable::run, metrics, unsubscribed::add);

        subscription.close();

        assertThat(unsubscribed).containsExactly(subscription);
    }

    private static ChangeEvent<Map<String, Object>> insert(String id) {
        return ChangeEvent.ofRows(ChangeEventKind.INSERT, "votes", Map.of("id", id), null, Instant.now());
    }

    @SuppressWarnings("unchecked")
    private static Class<Map<String, Object>> rawType() {
        return (Class<Map<String, Object>>) (Class<?>) Map.class;
    }
}
