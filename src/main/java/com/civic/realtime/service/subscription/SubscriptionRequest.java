package com.civic.realtime.service.subscription;

import com.civic.realtime.service.model.ChangeEvent;
import com.civic.realtime.service.model.ChangeEventKind;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Everything needed to subscribe one scope to one table.
 *
 * @param <T> record type delivered to the consumer
 */
@Getter
@Builder
public class SubscriptionRequest<T> {

    /**
     * Owner whose subscriptions are torn down together.
     */
    @NonNull
    private final String scopeId;

    @NonNull
    private final String table;

    /**
     * Row-level filter expression passed to the transport, e.g. {@code campaign_id=eq.42}.
     */
    private final String filter;

    /**
     * Change kinds to deliver; empty means all kinds.
     */
    @Builder.Default
    private final Set<ChangeEventKind> kinds = Set.of();

    /**
     * Record class rows are converted to.
     */
    @NonNull
    private final Class<T> recordType;

    @NonNull
    private final Consumer<ChangeEvent<T>> onEvent;

    /**
     * Receives consumer and channel failures; optional.
     */
    private final Consumer<Throwable> onError;
}
