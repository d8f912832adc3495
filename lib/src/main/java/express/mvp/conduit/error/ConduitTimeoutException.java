package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.time.Duration;
import java.util.Map;

/**
 * Thrown when a call, a connection attempt or an event wait exceeded its timeout.
 *
 * <p>Produced for transport-level timeouts, HTTP 408 responses, and {@code waitFor} deadlines.
 */
public class ConduitTimeoutException extends ConduitException {

    private final Duration timeout;

    /**
     * Constructs a new timeout exception.
     *
     * @param message the detail message
     * @param timeout the timeout that elapsed
     * @param details structured details, may be null
     * @param cause the underlying cause, may be null
     */
    public ConduitTimeoutException(
            String message, Duration timeout, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.TIMEOUT, null, message, details, cause);
        this.timeout = timeout != null ? timeout : Duration.ZERO;
    }

    /**
     * Constructs a new timeout exception without details.
     *
     * @param message the detail message
     * @param timeout the timeout that elapsed
     */
    public ConduitTimeoutException(String message, Duration timeout) {
        this(message, timeout, null, null);
    }

    /**
     * Returns the timeout that elapsed.
     *
     * @return the timeout, {@link Duration#ZERO} if unknown
     */
    public Duration timeout() {
        return timeout;
    }
}
