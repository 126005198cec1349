package com.civic.realtime.service.transport;

/**
 * Failure raised or reported by a transport.
 *
 * Recoverable failures are retried by reconnection; unrecoverable ones move the
 * connection straight to ERROR.
 */
public class TransportException extends RuntimeException {

    private final boolean recoverable;

    public TransportException(String message) {
        this(message, true);
    }

    public TransportException(String message, boolean recoverable) {
        super(message);
        this.recoverable = recoverable;
    }

    public TransportException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
