package express.mvp.conduit.stream;

/**
 * Receives the inbound side of one {@link StreamSession}.
 *
 * <p>Callbacks may arrive on a transport thread. {@link #onClose(int, String)} is called exactly
 * once per opened session, whoever closed it.
 */
public interface StreamListener {

    /**
     * Called for each inbound text frame, in arrival order.
     *
     * @param text the frame content
     */
    void onMessage(String text);

    /**
     * Called when the session has closed.
     *
     * @param code the close code, {@code 1006} when the connection dropped without one
     * @param reason the close reason, possibly empty
     */
    void onClose(int code, String reason);

    /**
     * Called when the transport reports an error on an open session.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
