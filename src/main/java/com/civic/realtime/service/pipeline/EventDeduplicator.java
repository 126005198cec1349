package com.civic.realtime.service.pipeline;

import com.civic.realtime.service.model.ChangeEventKind;

/**
 * Interface for event deduplication.
 *
 * Collapses identical (table, kind, record id) sightings that arrive within a
 * short window, which is how at-least-once transport redeliveries show up.
 */
public interface EventDeduplicator {

    /**
     * Scope shared by callers that do not partition deduplication.
     */
    String GLOBAL_SCOPE = "*";

    /**
     * Checks if an event is a duplicate, marking it as seen when it is not.
     *
     * @param table the source table
     * @param kind the change kind
     * @param recordId the record identifier
     * @return true if the event was already seen within the window
     */
    default boolean isDuplicate(String table, ChangeEventKind kind, String recordId) {
        return isDuplicate(GLOBAL_SCOPE, table, kind, recordId);
    }

    /**
     * Checks if an event is a duplicate within one scope's stream.
     *
     * @param scopeId the subscriber scope
     * @param table the source table
     * @param kind the change kind
     * @param recordId the record identifier
     * @return true if the event was already seen within the window
     */
    boolean isDuplicate(String scopeId, String table, ChangeEventKind kind, String recordId);

    /**
     * Clears deduplication state for a scope.
     *
     * @param scopeId the scope
     */
    void clearScope(String scopeId);

    /**
     * Clears all deduplication state.
     */
    void clearAll();

    /**
     * Gets the number of tracked event keys.
     *
     * @return count of tracked keys
     */
    int size();
}
