package com.civic.realtime.service.api.dto;

import com.civic.realtime.service.model.ChangeEventKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * DTO for publishing a change into the loopback transport.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEventRequest {

    @NotNull(message = "kind is required")
    private ChangeEventKind kind;

    @NotBlank(message = "table is required")
    private String table;

    /**
     * Post-image of the row. Required for INSERT and UPDATE.
     */
    private Map<String, Object> newRecord;

    /**
     * Pre-image of the row. Required for DELETE.
     */
    private Map<String, Object> oldRecord;

    /**
     * Commit time; defaults to the time of publication.
     */
    private Instant commitTimestamp;

    @JsonIgnore
    @AssertTrue(message = "newRecord is required for INSERT and UPDATE, oldRecord for DELETE")
    public boolean isRowImagePresent() {
        if (kind == null) return true;
        return kind == ChangeEventKind.DELETE ? oldRecord != null : newRecord != null;
    }
}
