package com.civic.realtime.service.connection;

import com.civic.realtime.service.model.ConnectionState;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static com.civic.realtime.service.model.ConnectionState.*;

/**
 * The connection state and its listeners.
 *
 * Transitions are the only way to change the state. Leaving ERROR requires an
 * explicit {@link #reinitialize()}. Every listener is isolated: one that
 * throws is logged and the others still run.
 */
@Slf4j
public class ConnectionStateMachine {

    private static final Map<ConnectionState, Set<ConnectionState>> ALLOWED = new EnumMap<>(ConnectionState.class);

    static {
        ALLOWED.put(CONNECTING, EnumSet.of(CONNECTED, RECONNECTING, DISCONNECTED, ERROR));
        ALLOWED.put(CONNECTED, EnumSet.of(RECONNECTING, DISCONNECTED, ERROR));
        ALLOWED.put(RECONNECTING, EnumSet.of(CONNECTED, DISCONNECTED, ERROR));
        ALLOWED.put(DISCONNECTED, EnumSet.of(CONNECTING, RECONNECTING, ERROR));
        ALLOWED.put(ERROR, EnumSet.of(DISCONNECTED));
    }

    private final List<Consumer<ConnectionState>> statusListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state;

    public ConnectionStateMachine(ConnectionState initial) {
        this.state = initial;
    }

    public ConnectionState current() {
        return state;
    }

    public static boolean isAllowed(ConnectionState from, ConnectionState to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Moves to the target state and notifies status listeners.
     *
     * @return false if already in the target state or the transition is not allowed
     */
    public boolean transitionTo(ConnectionState target) {
        return transitionTo(target, null);
    }

    /**
     * Moves to the target state; when the target is ERROR the error also goes to error listeners.
     *
     * @return false if already in the target state or the transition is not allowed
     */
    public boolean transitionTo(ConnectionState target, Throwable error) {
        ConnectionState from;
        synchronized (this) {
            from = state;
            if (from == target) {
                return false;
            }
            if (!isAllowed(from, target)) {
                log.debug("Ignoring transition {} -> {}", from, target);
                return false;
            }
            state = target;
        }
        log.info("Connection state {} -> {}", from, target);
        notifyStatus(target);
        if (target == ERROR && error != null) {
            notifyError(error);
        }
        return true;
    }

    /**
     * Forces the state back to CONNECTING, the only way out of ERROR.
     */
    public void reinitialize() {
        ConnectionState from;
        synchronized (this) {
            from = state;
            state = CONNECTING;
        }
        log.info("Connection state {} -> {} (reinitialized)", from, CONNECTING);
        if (from != CONNECTING) {
            notifyStatus(CONNECTING);
        }
    }

    public ListenerRegistration addStatusListener(Consumer<ConnectionState> listener) {
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    public ListenerRegistration addErrorListener(Consumer<Throwable> listener) {
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    private void notifyStatus(ConnectionState status) {
        for (Consumer<ConnectionState> listener : statusListeners) {
            try {
                listener.accept(status);
            } catch (Exception e) {
                log.error("Error in connection status listener", e);
            }
        }
    }

    private void notifyError(Throwable error) {
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (Exception e) {
                log.error("Error in connection error listener", e);
            }
        }
    }
}
