package express.mvp.conduit.stream;

import express.mvp.conduit.error.ConnectionException;

/**
 * Lifecycle notifications of a {@link ConnectionManager} beyond plain state changes.
 *
 * <p>All methods run on the event loop and default to doing nothing.
 */
public interface ConnectionObserver {

    /**
     * A reconnect attempt has been scheduled.
     *
     * @param attempt the attempt number, starting at 1 after each successful connect
     * @param delayMillis the backoff delay before the attempt starts
     */
    default void onReconnecting(int attempt, long delayMillis) {}

    /** An automatic reconnect succeeded; subscriptions have been replayed. */
    default void onReconnected() {}

    /**
     * The connection closed.
     *
     * @param code the close code
     * @param reason the close reason
     */
    default void onClosed(int code, String reason) {}

    /**
     * A stream error occurred.
     *
     * @param error the error
     */
    default void onError(ConnectionException error) {}
}
