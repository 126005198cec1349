package com.civic.realtime.service.connection;

import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ConnectionState;
import com.civic.realtime.service.model.MetricsView;
import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.subscription.RealtimeSubscription;
import com.civic.realtime.service.subscription.SubscriptionRequest;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Entry point for consumers of realtime change events.
 *
 * Owns the single transport connection and turns it into independent,
 * de-duplicated, rate-limited subscriptions.
 */
public interface ConnectionManager {

    /**
     * Subscribes a scope to a table. A second call for the same (scope, table)
     * replaces the first registration instead of stacking deliveries.
     *
     * @param request the subscription request
     * @return handle whose {@code unsubscribe()} removes exactly this registration
     * @throws RealtimeException with code SUBSCRIPTION_FAILED if the request is rejected
     */
    <T> RealtimeSubscription subscribe(SubscriptionRequest<T> request);

    /**
     * Subscribes with raw row maps.
     */
    RealtimeSubscription subscribe(String scopeId,
                                   String table,
                                   String filter,
                                   Consumer<ChangeEvent<Map<String, Object>>> onEvent,
                                   Consumer<Throwable> onError);

    /**
     * Subscribes with rows converted to {@code recordType}.
     */
    <T> RealtimeSubscription subscribe(String scopeId,
                                       String table,
                                       String filter,
                                       Class<T> recordType,
                                       Consumer<ChangeEvent<T>> onEvent,
                                       Consumer<Throwable> onError);

    /**
     * Closes every subscription owned by a scope. Unknown scopes are a no-op.
     */
    void unsubscribeAll(String scopeId);

    /**
     * Opens a scope whose close tears down all of its subscriptions.
     */
    RealtimeScope openScope(String scopeId);

    ConnectionState getConnectionStatus();

    /**
     * Adds a listener called synchronously on every state transition.
     */
    ListenerRegistration onConnectionStatusChange(Consumer<ConnectionState> listener);

    /**
     * Adds a listener called when the connection enters ERROR.
     */
    ListenerRegistration onError(Consumer<Throwable> listener);

    MetricsView getMetricsSnapshot();

    /**
     * Resets metrics.
     *
     * @return the snapshot taken before the reset
     */
    MetricsView resetMetrics();

    Set<SubscriptionKey> getActiveSubscriptions();

    /**
     * Whether the heartbeat has been silent for more than two intervals.
     */
    boolean isHeartbeatStale();

    /**
     * Leaves ERROR (or any other state) by reopening every registered subscription.
     */
    void reinitialize();
}
