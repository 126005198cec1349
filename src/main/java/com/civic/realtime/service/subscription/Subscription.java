package com.civic.realtime.service.subscription;

import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ChangeEventKind;
import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.transport.ChannelHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A live (scope, table) subscription.
 *
 * The channel handle is owned by the {@link SubscriptionRegistry}; it is null
 * while the subscription waits for the connection to be reinitialized.
 *
 * @param <T> record type delivered to the consumer
 */
@Slf4j
public class Subscription<T> implements RealtimeSubscription {

    private final SubscriptionKey key;
    private final String filter;
    private final Set<ChangeEventKind> kinds;
    private final Function<Map<String, Object>, T> converter;
    private final Consumer<ChangeEvent<T>> onEvent;
    private final Consumer<Throwable> onError;
    private final MetricsAggregator metrics;
    private final Consumer<Subscription<?>> unsubscriber;
    private final EventMailbox mailbox;

    private volatile ChannelHandle channel;
    private volatile boolean active = true;

    public Subscription(SubscriptionRequest<T> request,
                        Function<Map<String, Object>, T> converter,
                        int mailboxCapacity,
                        Executor dispatchExecutor,
                        MetricsAggregator metrics,
                        Consumer<Subscription<?>> unsubscriber) {
        this.key = new SubscriptionKey(request.getScopeId(), request.getTable());
        this.filter = request.getFilter();
        this.kinds = Set.copyOf(request.getKinds());
        this.converter = converter;
        this.onEvent = request.getOnEvent();
        this.onError = request.getOnError();
        this.metrics = metrics;
        this.unsubscriber = unsubscriber;
        this.mailbox = new EventMailbox(key.channelName(), mailboxCapacity, dispatchExecutor, this::deliver,
                metrics::recordDropped);
    }

    @Override
    public SubscriptionKey key() {
        return key;
    }

    public String getFilter() {
        return filter;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public boolean hasChannel() {
        return channel != null;
    }

    public int pendingEvents() {
        return mailbox.size();
    }

    @Override
    public void unsubscribe() {
        unsubscriber.accept(this);
    }

    /**
     * Whether events of this kind are wanted at all.
     */
    public boolean accepts(ChangeEventKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    /**
     * Hands an admitted event to the mailbox. Dropped events are counted by the mailbox.
     *
     * @return false if the subscription is closed or the event was dropped
     */
    public boolean enqueue(ChangeEvent<Map<String, Object>> event) {
        return active && mailbox.offer(event);
    }

    /**
     * Forwards a failure to the subscription's error callback, isolating callback failures.
     */
    public void notifyError(Throwable error) {
        if (onError == null) return;
        try {
            onError.accept(error);
        } catch (Exception e) {
            log.error("Error callback failed for {}", key, e);
        }
    }

    ChannelHandle channel() {
        return channel;
    }

    void attachChannel(ChannelHandle handle) {
        this.channel = handle;
    }

    ChannelHandle detachChannel() {
        ChannelHandle detached = channel;
        channel = null;
        return detached;
    }

    void deactivate() {
        active = false;
        mailbox.clear();
    }

    private void deliver(ChangeEvent<Map<String, Object>> event) {
        // closeAll may have run after the event was queued
        if (!active) {
            log.debug("Discarding {} event for closed subscription {}", event.kind(), key);
            return;
        }
        try {
            onEvent.accept(event.map(converter));
        } catch (Exception e) {
            log.error("Consumer callback failed for {} on {} event", key, event.kind(), e);
            metrics.recordCallbackError();
            notifyError(e);
        }
    }

    @Override
    public String toString() {
        return "Subscription[" + key + (filter != null ? ", filter=" + filter : "") + "]";
    }
}
