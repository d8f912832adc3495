package express.mvp.conduit.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State machine for the event-stream connection lifecycle.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes. The
 * connection manager is its only writer; anyone may read the current state.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * DISCONNECTED → CONNECTING
 * CONNECTING   → CONNECTED, DISCONNECTED, RECONNECTING, CLOSING
 * CONNECTED    → RECONNECTING, CLOSING, DISCONNECTED
 * RECONNECTING → CONNECTING, DISCONNECTED, CLOSING
 * CLOSING      → DISCONNECTED
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionStateMachine state = new ConnectionStateMachine();
 * state.addListener((prev, curr, cause) -> LOGGER.fine(prev + " -> " + curr));
 *
 * state.transitionTo(ConnectionState.CONNECTING);
 * state.transitionTo(ConnectionState.CONNECTED);
 * state.transitionTo(ConnectionState.CLOSING);
 * state.transitionTo(ConnectionState.DISCONNECTED);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. State transitions use atomic operations, so readers on other
 * threads always see a state that was actually entered.
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    // Valid transitions from each state
    private static final Set<ConnectionState> FROM_DISCONNECTED =
            EnumSet.of(ConnectionState.CONNECTING);

    private static final Set<ConnectionState> FROM_CONNECTING =
            EnumSet.of(
                    ConnectionState.CONNECTED,
                    ConnectionState.DISCONNECTED,
                    ConnectionState.RECONNECTING,
                    ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_CONNECTED =
            EnumSet.of(
                    ConnectionState.RECONNECTING,
                    ConnectionState.CLOSING,
                    ConnectionState.DISCONNECTED);

    private static final Set<ConnectionState> FROM_RECONNECTING =
            EnumSet.of(
                    ConnectionState.CONNECTING,
                    ConnectionState.DISCONNECTED,
                    ConnectionState.CLOSING);

    private static final Set<ConnectionState> FROM_CLOSING =
            EnumSet.of(ConnectionState.DISCONNECTED);

    /** Current connection state. */
    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);

    /** Registered state change listeners. */
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Optional label for this connection (for logging). */
    private final String name;

    /** Creates a new state machine in {@link ConnectionState#DISCONNECTED} state. */
    public ConnectionStateMachine() {
        this(null);
    }

    /**
     * Creates a new state machine with a label used in log records.
     *
     * @param name the label
     */
    public ConnectionStateMachine(String name) {
        this.name = name;
    }

    /**
     * Returns the current state.
     *
     * @return the current connection state
     */
    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Checks if the connection is active.
     *
     * @return true if in {@link ConnectionState#CONNECTED} state
     */
    public boolean isActive() {
        return state.get().isActive();
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired new state
     * @return true if the transition was successful
     */
    public boolean transitionTo(ConnectionState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * <p>The transition succeeds only if it's a valid transition from the current state. The cause
     * is passed to listeners and is typically used for failure transitions.
     *
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was successful
     */
    public boolean transitionTo(ConnectionState newState, Throwable cause) {
        while (true) {
            ConnectionState current = state.get();

            if (!isValidTransition(current, newState)) {
                LOGGER.fine(() -> this + ": rejected transition " + current + " -> " + newState);
                return false;
            }

            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return true;
            }
            // CAS failed, retry with new current state
        }
    }

    /**
     * Attempts to transition from a specific expected state.
     *
     * @param expectedState the expected current state
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if transition successful, false if current state doesn't match
     */
    public boolean transitionFrom(
            ConnectionState expectedState, ConnectionState newState, Throwable cause) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            notifyListeners(expectedState, newState, cause);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        if (from == to) {
            return false; // No self-transitions
        }
        return validTransitions(from).contains(to);
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return set of valid target states
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        return EnumSet.copyOf(validTransitions(from));
    }

    private static Set<ConnectionState> validTransitions(ConnectionState from) {
        return switch (from) {
            case DISCONNECTED -> FROM_DISCONNECTED;
            case CONNECTING -> FROM_CONNECTING;
            case CONNECTED -> FROM_CONNECTED;
            case RECONNECTING -> FROM_RECONNECTING;
            case CLOSING -> FROM_CLOSING;
        };
    }

    /** Notifies all listeners of a state change. */
    private void notifyListeners(
            ConnectionState previous, ConnectionState current, Throwable cause) {
        LOGGER.fine(() -> this + ": " + previous + " -> " + current);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return name != null
                ? "ConnectionStateMachine[" + name + ":" + state.get() + "]"
                : "ConnectionStateMachine[" + state.get() + "]";
    }
}
