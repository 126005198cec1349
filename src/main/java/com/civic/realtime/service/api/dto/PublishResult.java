package com.civic.realtime.service.api.dto;

/**
 * Outcome of publishing a change.
 *
 * @param table      the changed table
 * @param deliveries number of channel listeners the change reached
 */
public record PublishResult(String table, int deliveries) {
}
