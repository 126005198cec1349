package com.civic.realtime.service.connection;

import com.civic.realtime.service.config.MetricsConfig;
import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.heartbeat.HeartbeatMonitor;
import com.civic.realtime.service.metrics.DefaultMetricsAggregator;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ConnectionState;
import com.civic.realtime.service.model.MetricsView;
import com.civic.realtime.service.model.SubscriptionKey;
import com.civic.realtime.service.pipeline.DefaultEventDeduplicator;
import com.civic.realtime.service.pipeline.EventDeduplicator;
import com.civic.realtime.service.pipeline.FixedWindowRateLimiter;
import com.civic.realtime.service.pipeline.RateLimiter;
import com.civic.realtime.service.subscription.InMemorySubscriptionRegistry;
import com.civic.realtime.service.subscription.RealtimeSubscription;
import com.civic.realtime.service.subscription.Subscription;
import com.civic.realtime.service.subscription.SubscriptionRegistry;
import com.civic.realtime.service.subscription.SubscriptionRequest;
import com.civic.realtime.service.transport.ChannelHandle;
import com.civic.realtime.service.transport.ChannelStatus;
import com.civic.realtime.service.transport.RealtimeTransport;
import com.civic.realtime.service.transport.TransportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns the transport connection, the connection state machine, and the
 * per-subscription pipeline: stale-handle check, rate limiting,
 * deduplication, metrics, then the subscriber's mailbox.
 *
 * Every piece of shared state is mutated under this instance's monitor, which
 * the reconnection controller shares. Components are created per instance, so
 * two managers never share registry, dedup or metrics state.
 */
@Slf4j
@Service
public class RealtimeConnectionManager implements ConnectionManager {

    @SuppressWarnings("unchecked")
    private static final Class<Map<String, Object>> RAW_ROW = (Class<Map<String, Object>>) (Class<?>) Map.class;
    private static final String GLOBAL_RATE_SCOPE = "*";

    private final RealtimeConfig config;
    private final RealtimeTransport transport;
    private final MetricsConfig meters;
    private final Executor dispatchExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final MetricsAggregator metrics;
    private final EventDeduplicator deduplicator;
    private final RateLimiter rateLimiter;
    private final SubscriptionRegistry registry;
    private final ConnectionStateMachine stateMachine;
    private final ReconnectionController reconnection;
    private final HeartbeatMonitor heartbeat;

    private boolean started;
    private boolean gaugesRegistered;

    public RealtimeConnectionManager(RealtimeConfig config,
                                     RealtimeTransport transport,
                                     MetricsConfig meters,
                                     @Qualifier("realtimeScheduler") TaskScheduler scheduler,
                                     @Qualifier("realtimeDispatchExecutor") Executor dispatchExecutor,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        config.validate();
        this.config = config;
        this.transport = transport;
        this.meters = meters;
        this.dispatchExecutor = dispatchExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;

        this.metrics = new DefaultMetricsAggregator(meters, clock);
        this.deduplicator = new DefaultEventDeduplicator(config.getDedup(), metrics, clock);
        this.rateLimiter = new FixedWindowRateLimiter(config.getRateLimit(), metrics, clock);
        this.registry = new InMemorySubscriptionRegistry(transport);
        this.stateMachine = new ConnectionStateMachine(ConnectionState.CONNECTING);
        this.reconnection = new ReconnectionController(
                this,
                new ReconnectionTarget(),
                BackoffPolicy.from(config.getReconnect(), new SecureRandom()),
                config.getReconnect(),
                scheduler,
                metrics);
        this.heartbeat = new HeartbeatMonitor(config.getHeartbeat(), transport, scheduler, metrics, clock);
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    public synchronized void start() {
        if (started) return;
        started = true;
        stateMachine.transitionTo(ConnectionState.CONNECTING);
        registerGauges();
        if (config.getHeartbeat().isEnabled()) {
            heartbeat.start();
        }
        log.info("RealtimeConnectionManager started: dedup={} ({} ms), rateLimit={}/{} ms, maxReconnectAttempts={}",
                config.getDedup().isEnabled(), config.getDedup().getWindowMs(),
                config.getRateLimit().getEventsPerSecond(), config.getRateLimit().getWindowMs(),
                config.getReconnect().getMaxAttempts());
    }

    @PreDestroy
    public synchronized void shutdown() {
        reconnection.cancel();
        heartbeat.stop();
        int closed = registry.closeEverything();
        deduplicator.clearAll();
        stateMachine.transitionTo(ConnectionState.DISCONNECTED);
        metrics.markDisconnected();
        started = false;
        log.info("RealtimeConnectionManager stopped, closed {} subscriptions", closed);
    }

    // ==================== Subscriptions ====================

    @Override
    public synchronized <T> RealtimeSubscription subscribe(SubscriptionRequest<T> request) {
        Subscription<T> subscription;
        try {
            subscription = new Subscription<>(
                    request,
                    converterFor(request.getRecordType()),
                    config.getDispatch().getQueueCapacity(),
                    dispatchExecutor,
                    metrics,
                    this::unsubscribe);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new RealtimeException("Invalid subscription request: " + e.getMessage(),
                    request.getScopeId(), RealtimeException.SUBSCRIPTION_FAILED, e);
        }

        registry.register(subscription);

        ConnectionState state = stateMachine.current();
        if (state == ConnectionState.ERROR || state == ConnectionState.DISCONNECTED) {
            log.warn("Connection is {}, {} registered but not opened until reinitialize", state, subscription.key());
            return subscription;
        }

        try {
            openChannel(subscription);
        } catch (TransportException e) {
            handleOpenFailure(subscription, e);
        } catch (RuntimeException e) {
            registry.remove(subscription.key(), subscription);
            throw new RealtimeException(
                    "Failed to subscribe " + subscription.key() + ": " + e.getMessage(),
                    request.getScopeId(),
                    RealtimeException.SUBSCRIPTION_FAILED,
                    e);
        }
        return subscription;
    }

    @Override
    public RealtimeSubscription subscribe(String scopeId,
                                          String table,
                                          String filter,
                                          Consumer<ChangeEvent<Map<String, Object>>> onEvent,
                                          Consumer<Throwable> onError) {
        return subscribe(scopeId, table, filter, RAW_ROW, onEvent, onError);
    }

    @Override
    public <T> RealtimeSubscription subscribe(String scopeId,
                                              String table,
                                              String filter,
                                              Class<T> recordType,
                                              Consumer<ChangeEvent<T>> onEvent,
                                              Consumer<Throwable> onError) {
        return subscribe(SubscriptionRequest.<T>builder()
                .scopeId(scopeId)
                .table(table)
                .filter(filter)
                .recordType(recordType)
                .onEvent(onEvent)
                .onError(onError)
                .build());
    }

    @Override
    public synchronized void unsubscribeAll(String scopeId) {
        int closed = registry.closeAll(scopeId);
        deduplicator.clearScope(scopeId);
        rateLimiter.clear(scopeId);
        log.debug("unsubscribeAll({}) closed {} subscriptions", scopeId, closed);
    }

    @Override
    public RealtimeScope openScope(String scopeId) {
        return new RealtimeScope(this, scopeId);
    }

    private synchronized void unsubscribe(Subscription<?> subscription) {
        registry.remove(subscription.key(), subscription);
    }

    // ==================== Status & Metrics ====================

    @Override
    public ConnectionState getConnectionStatus() {
        return stateMachine.current();
    }

    @Override
    public ListenerRegistration onConnectionStatusChange(Consumer<ConnectionState> listener) {
        return stateMachine.addStatusListener(listener);
    }

    @Override
    public ListenerRegistration onError(Consumer<Throwable> listener) {
        return stateMachine.addErrorListener(listener);
    }

    @Override
    public MetricsView getMetricsSnapshot() {
        return metrics.snapshot();
    }

    @Override
    public MetricsView resetMetrics() {
        return metrics.reset();
    }

    @Override
    public Set<SubscriptionKey> getActiveSubscriptions() {
        return registry.keys();
    }

    @Override
    public boolean isHeartbeatStale() {
        return heartbeat.isStale(clock.instant());
    }

    public int getReconnectAttempt() {
        return reconnection.getAttempt();
    }

    @Override
    public synchronized void reinitialize() {
        log.info("Reinitializing realtime connection from {}", stateMachine.current());
        reconnection.cancel();
        registry.releaseAllChannels();
        metrics.markDisconnected();
        stateMachine.reinitialize();

        for (Subscription<?> subscription : registry.subscriptions()) {
            try {
                openChannel(subscription);
            } catch (TransportException e) {
                handleOpenFailure(subscription, e);
                return;
            }
        }
    }

    // ==================== Transport Callbacks ====================

    private void onTransportEvent(Subscription<?> subscription,
                                  ChannelHandle channel,
                                  ChangeEvent<Map<String, Object>> event) {
        long startNanos = System.nanoTime();
        synchronized (this) {
            if (!registry.isCurrent(subscription, channel)) {
                log.debug("Dropping {} event from stale channel {}", event.kind(), channel.name());
                return;
            }
            if (!subscription.accepts(event.kind())) {
                return;
            }

            String scopeId = subscription.key().scopeId();
            String rateScope = config.getRateLimit().isPerScope() ? scopeId : GLOBAL_RATE_SCOPE;
            if (!rateLimiter.shouldAdmit(rateScope, config.getRateLimit().getEventsPerSecond())) {
                return;
            }

            if (config.getDedup().isEnabled()) {
                Optional<String> recordId = ChangeEvent.recordId(event, config.getDedup().getIdField());
                if (recordId.isPresent()
                        && deduplicator.isDuplicate(scopeId, event.table(), event.kind(), recordId.get())) {
                    return;
                }
            }

            if (!subscription.enqueue(event)) {
                return;
            }
            metrics.record(event.kind(), event.table(), (System.nanoTime() - startNanos) / 1_000_000.0);
        }
    }

    private synchronized void onChannelStatus(Subscription<?> subscription,
                                              ChannelHandle channel,
                                              ChannelStatus status,
                                              Throwable error) {
        if (!registry.isCurrent(subscription, channel)) {
            log.debug("Ignoring {} from stale channel {}", status, channel.name());
            return;
        }

        switch (status) {
            case SUBSCRIBED -> onAcknowledged(subscription);
            case TIMED_OUT -> onConnectionLost(new TransportException("Channel timed out: " + channel.name()));
            case CLOSED -> onConnectionLost(new TransportException("Channel closed unexpectedly: " + channel.name()));
            case CHANNEL_ERROR -> {
                Throwable cause = error != null
                        ? error
                        : new TransportException("Channel error for " + subscription.key());
                subscription.notifyError(cause);
                if (cause instanceof TransportException te && !te.isRecoverable()) {
                    fail(new RealtimeException("Unrecoverable transport fault on " + subscription.key(),
                            subscription.key().scopeId(), RealtimeException.TRANSPORT_ERROR, te));
                } else {
                    onConnectionLost(cause);
                }
            }
        }
    }

    private void onAcknowledged(Subscription<?> subscription) {
        switch (stateMachine.current()) {
            case CONNECTING -> {
                log.debug("First acknowledgment from {}", subscription.key());
                markConnected();
            }
            case RECONNECTING -> reconnection.onAcknowledged();
            default -> log.debug("Acknowledgment from {} in state {}", subscription.key(), stateMachine.current());
        }
    }

    private void onConnectionLost(Throwable cause) {
        ConnectionState state = stateMachine.current();
        if (state == ConnectionState.ERROR || state == ConnectionState.DISCONNECTED) {
            log.debug("Ignoring connection loss in state {}: {}", state, cause.getMessage());
            return;
        }
        reconnection.onConnectionLost(cause);
    }

    // ==================== Helpers ====================

    private void openChannel(Subscription<?> subscription) {
        SubscriptionKey key = subscription.key();
        ChannelHandle channel = transport.channel(key.channelName());
        try {
            channel.onChange(key.table(), subscription.getFilter(),
                    event -> onTransportEvent(subscription, channel, event));
        } catch (RuntimeException e) {
            transport.removeChannel(channel);
            throw e;
        }
        if (registry.attachChannel(subscription, channel)) {
            channel.subscribe((status, error) -> onChannelStatus(subscription, channel, status, error));
        }
    }

    private void handleOpenFailure(Subscription<?> subscription, TransportException e) {
        log.error("Transport failed to open channel for {}: {}", subscription.key(), e.getMessage());
        subscription.notifyError(e);
        if (e.isRecoverable()) {
            onConnectionLost(e);
        } else {
            fail(new RealtimeException("Unrecoverable transport fault opening " + subscription.key(),
                    subscription.key().scopeId(), RealtimeException.TRANSPORT_ERROR, e));
        }
    }

    private void markConnected() {
        if (stateMachine.transitionTo(ConnectionState.CONNECTED)) {
            metrics.markConnected(clock.instant());
        }
    }

    private void fail(RealtimeException error) {
        log.error("Realtime connection failed: {} [{}]", error.getMessage(), error.getErrorCode());
        reconnection.cancel();
        registry.releaseAllChannels();
        metrics.markDisconnected();
        stateMachine.transitionTo(ConnectionState.ERROR, error);
    }

    private <T> Function<Map<String, Object>, T> converterFor(Class<T> recordType) {
        if (recordType.isAssignableFrom(Map.class)) {
            return recordType::cast;
        }
        return row -> objectMapper.convertValue(row, recordType);
    }

    private void registerGauges() {
        if (gaugesRegistered) return;
        gaugesRegistered = true;
        meters.registerGauge("realtime.subscriptions.active",
                "Number of registered subscriptions", registry::size);
        meters.registerGauge("realtime.dedup.entries",
                "Number of tracked deduplication keys", deduplicator::size);
        meters.registerGauge("realtime.connection.state",
                "Ordinal of the current connection state", () -> stateMachine.current().ordinal());
    }

    /**
     * Reconnection callbacks, run with this manager's monitor held.
     */
    private class ReconnectionTarget implements ReconnectionController.Target {

        @Override
        public void onReconnecting(int attempt, long delayMs) {
            metrics.markDisconnected();
            stateMachine.transitionTo(ConnectionState.RECONNECTING);
        }

        @Override
        public int resubscribeAll() {
            registry.releaseAllChannels();
            int opened = 0;
            for (Subscription<?> subscription : registry.subscriptions()) {
                openChannel(subscription);
                opened++;
            }
            log.info("Resubscribed {} channels", opened);
            return opened;
        }

        @Override
        public void onReconnected(int attempts) {
            markConnected();
        }

        @Override
        public void onReconnectExhausted(RealtimeException error) {
            fail(error);
        }

        @Override
        public void onFatal(RealtimeException error) {
            fail(error);
        }
    }
}
