package com.civic.realtime.service.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One change notification delivered by the transport.
 *
 * Immutable once received. {@code newRecord} is absent for deletes and
 * {@code oldRecord} is usually absent for inserts.
 *
 * @param <T> the record representation
 */
public record ChangeEvent<T>(
        ChangeEventKind kind,
        String table,
        T newRecord,
        T oldRecord,
        Instant commitTimestamp
) {

    public static final String DEFAULT_ID_FIELD = "id";

    public ChangeEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(commitTimestamp, "commitTimestamp");
    }

    /**
     * Creates a raw event, copying the row images.
     */
    public static ChangeEvent<Map<String, Object>> ofRows(ChangeEventKind kind,
                                                          String table,
                                                          Map<String, Object> newRow,
                                                          Map<String, Object> oldRow,
                                                          Instant commitTimestamp) {
        return new ChangeEvent<>(kind, table, freeze(newRow), freeze(oldRow), commitTimestamp);
    }

    /**
     * Reads the record id from a raw event, preferring the post-image.
     */
    public static Optional<String> recordId(ChangeEvent<Map<String, Object>> event, String idField) {
        Object id = null;
        if (event.newRecord() != null) {
            id = event.newRecord().get(idField);
        }
        if (id == null && event.oldRecord() != null) {
            id = event.oldRecord().get(idField);
        }
        return Optional.ofNullable(id).map(String::valueOf);
    }

    /**
     * Returns the post-image when present, otherwise the pre-image.
     */
    public T latestRecord() {
        return newRecord != null ? newRecord : oldRecord;
    }

    public <R> ChangeEvent<R> map(Function<? super T, ? extends R> mapper) {
        return new ChangeEvent<>(
                kind,
                table,
                newRecord != null ? mapper.apply(newRecord) : null,
                oldRecord != null ? mapper.apply(oldRecord) : null,
                commitTimestamp
        );
    }

    private static Map<String, Object> freeze(Map<String, Object> row) {
        if (row == null) return null;
        // LinkedHashMap copy: row images may legitimately contain null column values
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }
}
