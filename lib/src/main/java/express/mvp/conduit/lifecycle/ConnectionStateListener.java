package express.mvp.conduit.lifecycle;

/**
 * Callback interface for connection state change events.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * stream.addStateListener((previous, current, cause) -> {
 *     switch (current) {
 *         case CONNECTED -> LOGGER.info("Event stream up");
 *         case RECONNECTING -> LOGGER.warning("Event stream lost: " + cause);
 *         default -> { }
 *     }
 * });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks run on the event loop that owns the connection. Implementations should be quick
 * and non-blocking to avoid stalling event dispatch.
 *
 * @see ConnectionStateMachine
 * @see ConnectionState
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called when the connection state changes.
     *
     * <p>This callback is invoked synchronously during the state transition.
     *
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     * @param cause the reason for the transition (may be null for normal transitions)
     */
    void onStateChanged(
            ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
