package com.civic.realtime.service.subscription;

import com.civic.realtime.service.model.SubscriptionKey;

/**
 * Handle returned by subscribe. Closing it unsubscribes.
 */
public interface RealtimeSubscription extends AutoCloseable {

    SubscriptionKey key();

    /**
     * Whether the subscription is still registered and may receive events.
     */
    boolean isActive();

    /**
     * Removes this subscription. Idempotent, and never removes a later
     * subscription that replaced this one under the same key.
     */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
