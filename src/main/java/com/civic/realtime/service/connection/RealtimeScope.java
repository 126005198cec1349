package com.civic.realtime.service.connection;

import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.subscription.RealtimeSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Subscriptions owned by one component, page or request.
 *
 * Closing the scope tears all of them down exactly once.
 */
@Slf4j
public class RealtimeScope implements AutoCloseable {

    private final ConnectionManager manager;
    private final String scopeId;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RealtimeScope(ConnectionManager manager, String scopeId) {
        this.manager = manager;
        this.scopeId = scopeId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public RealtimeSubscription subscribe(String table, String filter,
                                          Consumer<ChangeEvent<Map<String, Object>>> onEvent) {
        return subscribe(table, filter, onEvent, null);
    }

    public RealtimeSubscription subscribe(String table, String filter,
                                          Consumer<ChangeEvent<Map<String, Object>>> onEvent,
                                          Consumer<Throwable> onError) {
        ensureOpen();
        return manager.subscribe(scopeId, table, filter, onEvent, onError);
    }

    public <T> RealtimeSubscription subscribe(String table, String filter, Class<T> recordType,
                                              Consumer<ChangeEvent<T>> onEvent,
                                              Consumer<Throwable> onError) {
        ensureOpen();
        return manager.subscribe(scopeId, table, filter, recordType, onEvent, onError);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            manager.unsubscribeAll(scopeId);
            log.debug("Scope {} closed", scopeId);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Scope already closed: " + scopeId);
        }
    }
}
