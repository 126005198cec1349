package com.civic.realtime.service.subscription;

import com.civic.realtime.service.config.MetricsConfig;
import com.civic.realtime.service.metrics.DefaultMetricsAggregator;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ChangeEventKind;
import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.transport.ChannelHandle;
import com.civic.realtime.service.transport.InMemoryRealtimeTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySubscriptionRegistryTest {

    private InMemoryRealtimeTransport transport;
    private InMemorySubscriptionRegistry registry;
    private MetricsAggregator metrics;

    @BeforeEach
    void setUp() {
        transport = new InMemoryRealtimeTransport();
        transport.setAutoAcknowledge(false);
        registry = new InMemorySubscriptionRegistry(transport);
        metrics = new DefaultMetricsAggregator(new MetricsConfig(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    @Test
    @DisplayName("Registering the same key twice keeps one entry and closes the first channel")
    void replacementClosesPreviousChannel() {
        Subscription<Map<String, Object>> first = subscription("s1", "votes", new ArrayList<>());
        ChannelHandle firstChannel = open(first);
        Subscription<Map<String, Object>> second = subscription("s1", "votes", new ArrayList<>());

        var replaced = registry.register(second);

        assertThat(replaced).containsSame(first);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(first.isActive()).isFalse();
        assertThat(transport.openChannelNames()).isEmpty();
        assertThat(registry.isCurrent(first, firstChannel)).isFalse();
    }

    @Test
    @DisplayName("A stale handle cannot remove its replacement")
    void staleRemoveIsIgnored() {
        Subscription<Map<String, Object>> first = subscription("s1", "votes", new ArrayList<>());
        registry.register(first);
        Subscription<Map<String, Object>> second = subscription("s1", "votes", new ArrayList<>());
        registry.register(second);

        assertThat(registry.remove(first.key(), first)).isFalse();
        assertThat(registry.get(second.key())).containsSame(second);
        assertThat(second.isActive()).isTrue();
    }

    @Test
    void closeAllOnlyTouchesTheGivenScope() {
        Subscription<Map<String, Object>> a = subscription("s1", "votes", new ArrayList<>());
        Subscription<Map<String, Object>> b = subscription("s1", "comments", new ArrayList<>());
        Subscription<Map<String, Object>> c = subscription("s2", "votes", new ArrayList<>());
        open(a);
        open(b);
        open(c);

        int closed = registry.closeAll("s1");

        assertThat(closed).isEqualTo(2);
        assertThat(registry.keys()).containsExactly(new SubscriptionKey("s2", "votes"));
        assertThat(c.isActive()).isTrue();
        assertThat(transport.openChannelNames()).containsExactly("s2:votes");
    }

    @Test
    void closeAllForUnknownScopeIsANoOp() {
        open(subscription("s1", "votes", new ArrayList<>()));

        assertThat(registry.closeAll("nobody")).isZero();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Bookkeeping is removed even when the transport fails to close")
    void closeFailureStillRemovesEntry() {
        Subscription<Map<String, Object>> a = subscription("s1", "votes", new ArrayList<>());
        open(a);
        transport.setFailOnRemove(true);

        assertThat(registry.remove(a.key(), a)).isTrue();
        assertThat(registry.size()).isZero();
        assertThat(a.isActive()).isFalse();
        assertThat(a.hasChannel()).isFalse();
    }

    @Test
    void releaseAllChannelsKeepsSubscriptions() {
        Subscription<Map<String, Object>> a = subscription("s1", "votes", new ArrayList<>());
        ChannelHandle channel = open(a);

        assertThat(registry.releaseAllChannels()).isEqualTo(1);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(a.isActive()).isTrue();
        assertThat(a.hasChannel()).isFalse();
        assertThat(registry.isCurrent(a, channel)).isFalse();
    }

    @Test
    void channelForUnregisteredSubscriptionIsReleased() {
        Subscription<Map<String, Object>> a = subscription("s1", "votes", new ArrayList<>());

        boolean attached = registry.attachChannel(a, transport.channel(a.key().channelName()));

        assertThat(attached).isFalse();
        assertThat(transport.openChannelNames()).isEmpty();
    }

    @Test
    void closedSubscriptionDropsQueuedEvents() {
        List<ChangeEvent<Map<String, Object>>> received = new ArrayList<>();
        List<Runnable> pending = new ArrayList<>();
        Subscription<Map<String, Object>> a = new Subscription<>(
                request("s1", "votes", received), Function.identity(), 8, pending::add, metrics, s -> { });
        registry.register(a);

        assertThat(a.enqueue(ChangeEvent.ofRows(ChangeEventKind.INSERT, "votes", Map.of("id", "v1"), null, Instant.now())))
                .isTrue();
        registry.closeAll("s1");
        pending.forEach(Runnable::run);

        assertThat(received).isEmpty();
    }

    private ChannelHandle open(Subscription<?> subscription) {
        registry.register(subscription);
        ChannelHandle channel = transport.channel(subscription.key().channelName());
        registry.attachChannel(subscription, channel);
        return channel;
    }

    private Subscription<Map<String, Object>> subscription(String scope, String table,
                                                           List<ChangeEvent<Map<String, Object>>> sink) {
        return new Subscription<>(request(scope, table, sink), Function.identity(), 8, Runnable::run, metrics, s -> { });
    }

    @SuppressWarnings("unchecked")
    private static SubscriptionRequest<Map<String, Object>> request(String scope, String table,
                                                                   List<ChangeEvent<Map<String, Object>>> sink) {
        return SubscriptionRequest.<Map<String, Object>>builder()
                .scopeId(scope)
                .table(table)
                .recordType((Class<Map<String, Object>>) (Class<?>) Map.class)
                .onEvent(sink::add)
                .build();
    }
}
