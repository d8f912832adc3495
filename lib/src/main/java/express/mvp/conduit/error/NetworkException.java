package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;

/**
 * Thrown when a call failed before any response reached the client.
 *
 * <p>Typical causes are connection refused, DNS resolution failure and connection reset. The
 * original transport exception is kept as the cause.
 */
public class NetworkException extends ConduitException {

    /**
     * Constructs a new network exception.
     *
     * @param message the detail message
     * @param cause the transport failure
     */
    public NetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, null, message, null, cause);
    }
}
