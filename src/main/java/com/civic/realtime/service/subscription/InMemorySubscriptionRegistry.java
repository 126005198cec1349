package com.civic.realtime.service.subscription;

import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.transport.ChannelHandle;
import com.civic.realtime.service.transport.RealtimeTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of SubscriptionRegistry.
 *
 * Bookkeeping is always updated before the transport is asked to release a
 * channel, so an in-flight callback never finds an entry pointing at a closed handle.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemorySubscriptionRegistry implements SubscriptionRegistry {

    private final RealtimeTransport transport;

    private final Map<SubscriptionKey, Subscription<?>> entries = new LinkedHashMap<>();

    // ==================== Registration ====================

    @Override
    public synchronized Optional<Subscription<?>> register(Subscription<?> subscription) {
        Subscription<?> previous = entries.remove(subscription.key());
        if (previous != null) {
            log.info("Replacing existing subscription for {}", subscription.key());
            close(previous);
        }
        entries.put(subscription.key(), subscription);
        log.debug("Registered {}", subscription);
        return Optional.ofNullable(previous);
    }

    @Override
    public synchronized boolean attachChannel(Subscription<?> subscription, ChannelHandle channel) {
        if (entries.get(subscription.key()) != subscription || !subscription.isActive()) {
            log.debug("Subscription {} went away while its channel opened, releasing it", subscription.key());
            release(subscription.key(), channel);
            return false;
        }
        ChannelHandle previous = subscription.detachChannel();
        subscription.attachChannel(channel);
        if (previous != null && previous != channel) {
            release(subscription.key(), previous);
        }
        return true;
    }

    @Override
    public synchronized boolean remove(SubscriptionKey key, Subscription<?> expected) {
        if (entries.get(key) != expected) {
            log.debug("Ignoring unsubscribe for {}: not the registered subscription", key);
            return false;
        }
        entries.remove(key);
        close(expected);
        log.debug("Unsubscribed {}", key);
        return true;
    }

    // ==================== Bulk Teardown ====================

    @Override
    public synchronized int closeAll(String scopeId) {
        List<Subscription<?>> removed = new ArrayList<>();
        Iterator<Map.Entry<SubscriptionKey, Subscription<?>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<SubscriptionKey, Subscription<?>> entry = it.next();
            if (entry.getKey().belongsTo(scopeId)) {
                it.remove();
                removed.add(entry.getValue());
            }
        }
        removed.forEach(this::close);
        if (!removed.isEmpty()) {
            log.info("Closed {} subscriptions for scope {}", removed.size(), scopeId);
        }
        return removed.size();
    }

    @Override
    public synchronized int releaseAllChannels() {
        int released = 0;
        for (Subscription<?> subscription : entries.values()) {
            ChannelHandle channel = subscription.detachChannel();
            if (channel != null) {
                release(subscription.key(), channel);
                released++;
            }
        }
        log.debug("Released {} channels", released);
        return released;
    }

    @Override
    public synchronized int closeEverything() {
        List<Subscription<?>> all = new ArrayList<>(entries.values());
        entries.clear();
        all.forEach(this::close);
        log.info("Closed all {} subscriptions", all.size());
        return all.size();
    }

    // ==================== Queries ====================

    @Override
    public synchronized boolean isCurrent(Subscription<?> subscription, ChannelHandle channel) {
        return entries.get(subscription.key()) == subscription
                && subscription.isActive()
                && subscription.channel() == channel;
    }

    @Override
    public synchronized Optional<Subscription<?>> get(SubscriptionKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized List<Subscription<?>> subscriptions() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public synchronized Set<SubscriptionKey> keys() {
        return new LinkedHashSet<>(entries.keySet());
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    // ==================== Helpers ====================

    private void close(Subscription<?> subscription) {
        subscription.deactivate();
        ChannelHandle channel = subscription.detachChannel();
        if (channel != null) {
            release(subscription.key(), channel);
        }
    }

    private void release(SubscriptionKey key, ChannelHandle channel) {
        try {
            transport.removeChannel(channel);
        } catch (Exception e) {
            log.warn("Failed to release channel for {}, entry removed anyway: {}", key, e.getMessage());
        }
    }
}
