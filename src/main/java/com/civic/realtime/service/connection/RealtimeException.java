package com.civic.realtime.service.connection;

/**
 * Exception raised by the realtime distribution layer.
 */
public class RealtimeException extends RuntimeException {

    public static final String TRANSPORT_ERROR = "TRANSPORT_ERROR";
    public static final String RECONNECT_EXHAUSTED = "RECONNECT_EXHAUSTED";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String SUBSCRIPTION_FAILED = "SUBSCRIPTION_FAILED";

    private final String scopeId;
    private final String errorCode;

    public RealtimeException(String message, String errorCode) {
        this(message, null, errorCode, null);
    }

    public RealtimeException(String message, String errorCode, Throwable cause) {
        this(message, null, errorCode, cause);
    }

    public RealtimeException(String message, String scopeId, String errorCode, Throwable cause) {
        super(message, cause);
        this.scopeId = scopeId;
        this.errorCode = errorCode;
    }

    public static RealtimeException invalidConfiguration(String message) {
        return new RealtimeException(message, INVALID_CONFIGURATION);
    }

    public String getScopeId() {
        return scopeId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
