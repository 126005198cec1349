package com.civic.realtime.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every {@code /realtime} endpoint.
 *
 * Successful calls carry {@code data}; failures mapped by the global exception
 * handler carry {@code error} with a stable code such as {@code TRANSPORT_ERROR}
 * or {@code VALIDATION_ERROR}.
 *
 * @param <T> the type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * True when the operation completed, false when {@link #error} is set.
     */
    private boolean success;

    /**
     * Payload, such as a connection status or metrics snapshot (null on error).
     */
    private T data;

    /**
     * Failure description (null on success).
     */
    private ErrorInfo error;

    /**
     * When the envelope was built, in UTC.
     */
    @Builder.Default
    private Instant timestamp = Instant.now();

    /**
     * Wraps a successful result.
     */
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    /**
     * Builds a failure envelope without details.
     *
     * @param code machine-readable error code, e.g. a {@code RealtimeException} code
     */
    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    /**
     * Builds a failure envelope.
     *
     * @param details extra context such as the offending scope or field errors; omitted when null
     */
    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(ErrorInfo.builder()
                        .message(message)
                        .code(code)
                        .details(details)
                        .build())
                .build();
    }

    /**
     * Error body of a failed call.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {

        /**
         * Human-readable message.
         */
        private String message;

        /**
         * Stable code clients can switch on.
         */
        private String code;

        private String details;
    }
}
