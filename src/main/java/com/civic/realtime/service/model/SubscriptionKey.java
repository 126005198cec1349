package com.civic.realtime.service.model;

import java.util.Objects;

/**
 * Identity of a subscription: one live channel per (scope, table).
 *
 * The rendered form {@code scopeId:table} doubles as the transport channel name.
 */
public record SubscriptionKey(String scopeId, String table) {

    public SubscriptionKey {
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(table, "table");
        if (scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId must not be blank");
        }
        if (table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
    }

    public boolean belongsTo(String scope) {
        return scopeId.equals(scope);
    }

    public String channelName() {
        return scopeId + ":" + table;
    }

    @Override
    public String toString() {
        return channelName();
    }
}
