package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;

/**
 * Event-stream failure delivered to error listeners.
 *
 * <p>Stream errors are reported rather than thrown because the stream has no single caller
 * waiting on it. {@link Reason#isSoft()} tells whether the connection recovers on its own.
 */
public class ConnectionException extends ConduitException {

    /** Close code reported when the transport supplied none. */
    public static final int NO_CLOSE_CODE = -1;

    private final Reason reason;
    private final int closeCode;
    private final String closeReason;

    /**
     * Constructs a new connection exception.
     *
     * @param reason the failure reason
     * @param message the detail message
     * @param closeCode the close code, or {@link #NO_CLOSE_CODE}
     * @param closeReason the close reason text, may be null
     * @param cause the underlying cause, may be null
     */
    public ConnectionException(
            Reason reason, String message, int closeCode, String closeReason, Throwable cause) {
        super(ErrorKind.CONNECTION, null, message, null, cause);
        this.reason = reason;
        this.closeCode = closeCode;
        this.closeReason = closeReason;
    }

    /**
     * Constructs a new connection exception without close information.
     *
     * @param reason the failure reason
     * @param message the detail message
     * @param cause the underlying cause, may be null
     */
    public ConnectionException(Reason reason, String message, Throwable cause) {
        this(reason, message, NO_CLOSE_CODE, null, cause);
    }

    public Reason reason() {
        return reason;
    }

    public int closeCode() {
        return closeCode;
    }

    public String closeReason() {
        return closeReason;
    }

    /** Why the stream reported an error. */
    public enum Reason {
        /** The transport could not be opened. */
        CONNECT_FAILED(false),
        /** The connection dropped without the caller asking. */
        ABNORMAL_CLOSE(true),
        /** The transport reported an error on an open connection. */
        TRANSPORT_ERROR(true),
        /** No inbound traffic arrived within the heartbeat timeout after a ping. */
        HEARTBEAT_TIMEOUT(true),
        /** An inbound frame could not be parsed as an envelope. */
        MALFORMED_FRAME(true),
        /** Automatic reconnection gave up after the configured number of attempts. */
        RECONNECT_EXHAUSTED(false),
        /** The stream was closed by the caller while an operation was pending. */
        CLOSED(false);

        private final boolean soft;

        Reason(boolean soft) {
            this.soft = soft;
        }

        /**
         * Checks if the stream keeps working (or recovers by itself) after this error.
         *
         * @return true for soft errors
         */
        public boolean isSoft() {
            return soft;
        }
    }
}
