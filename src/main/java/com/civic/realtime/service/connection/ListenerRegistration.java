package com.civic.realtime.service.connection;

/**
 * Detaches a previously added listener.
 */
@FunctionalInterface
public interface ListenerRegistration {

    /**
     * Removes the listener. Calling it more than once has no further effect.
     */
    void remove();
}
