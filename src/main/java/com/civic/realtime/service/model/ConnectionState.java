package com.civic.realtime.service.model;

/**
 * Lifecycle state of the shared realtime connection.
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    ERROR;

    /**
     * Whether the state describes a connection that is expected to recover on its own.
     */
    public boolean isTransient() {
        return this == CONNECTING || this == RECONNECTING;
    }
}
