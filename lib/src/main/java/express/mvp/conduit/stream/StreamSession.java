package express.mvp.conduit.stream;

/** Outbound side of one open event-stream connection. */
public interface StreamSession {

    /** Close code of a normal, caller-initiated close. */
    int NORMAL_CLOSURE = 1000;

    /** Close code reported when the connection dropped without a close frame. */
    int ABNORMAL_CLOSURE = 1006;

    /**
     * Sends one text frame. Frames are written in call order.
     *
     * @param text the frame content
     */
    void send(String text);

    /**
     * Starts closing the session. The listener's {@code onClose} follows.
     *
     * @param code the close code
     * @param reason the close reason
     */
    void close(int code, String reason);
}
