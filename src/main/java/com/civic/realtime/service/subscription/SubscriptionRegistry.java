package com.civic.realtime.service.subscription;

import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.transport.ChannelHandle;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks live subscriptions and owns their channel handles.
 *
 * At most one subscription is registered per key. Closing a channel is
 * best-effort: the bookkeeping entry is removed even if the transport fails.
 */
public interface SubscriptionRegistry {

    /**
     * Registers a subscription, closing any prior one for the same key first.
     *
     * @param subscription the new subscription
     * @return the subscription that was replaced, if any
     */
    Optional<Subscription<?>> register(Subscription<?> subscription);

    /**
     * Attaches a freshly opened channel to a subscription.
     *
     * If the subscription is no longer registered the channel is released
     * immediately.
     *
     * @return true if attached
     */
    boolean attachChannel(Subscription<?> subscription, ChannelHandle channel);

    /**
     * Removes and closes a subscription, but only if it is the registered one for its key.
     *
     * @return true if removed
     */
    boolean remove(SubscriptionKey key, Subscription<?> expected);

    /**
     * Closes and removes every subscription owned by a scope.
     *
     * @param scopeId the owning scope
     * @return number of subscriptions closed
     */
    int closeAll(String scopeId);

    /**
     * Releases every channel but keeps the subscriptions registered, ready to be resubscribed.
     *
     * @return number of channels released
     */
    int releaseAllChannels();

    /**
     * Closes and removes everything.
     *
     * @return number of subscriptions closed
     */
    int closeEverything();

    /**
     * Whether a callback bound to this subscription and channel may still act.
     */
    boolean isCurrent(Subscription<?> subscription, ChannelHandle channel);

    Optional<Subscription<?>> get(SubscriptionKey key);

    List<Subscription<?>> subscriptions();

    Set<SubscriptionKey> keys();

    int size();
}
