package express.mvp.conduit.error;

/**
 * Kinds of failures surfaced by the communication layer.
 *
 * <p>Kinds are split into two propagation classes:
 *
 * <ul>
 *   <li><b>Transient:</b> {@link #NETWORK}, {@link #TIMEOUT}, {@link #SERVER}, {@link
 *       #RATE_LIMITED}. Retried locally by the request executor up to the configured ceiling.
 *   <li><b>Permanent:</b> {@link #AUTHENTICATION}, {@link #AUTHORIZATION}, {@link #NOT_FOUND},
 *       {@link #VALIDATION}. Surfaced on first occurrence; retrying cannot change the outcome.
 * </ul>
 *
 * <p>The remaining kinds are terminal outcomes produced by the layer itself.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * switch (error.kind()) {
 *     case RATE_LIMITED:
 *         // show a countdown from retryAfter()
 *         break;
 *     case AUTHENTICATION:
 *         // prompt for a new credential
 *         break;
 *     default:
 *         // report
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 * @see RetryPolicy
 */
public enum ErrorKind {

    /**
     * No response reached the client.
     *
     * <p>Examples: connection refused, DNS resolution failure, connection reset.
     */
    NETWORK(true, "NETWORK_ERROR", "Network error - no response received"),

    /** The call or wait exceeded its configured timeout (transport timeout or HTTP 408). */
    TIMEOUT(true, "TIMEOUT", "Timed out"),

    /** The credential was missing or rejected (HTTP 401). */
    AUTHENTICATION(false, "AUTHENTICATION_ERROR", "Authentication failed"),

    /** The credential is valid but not allowed to perform the action (HTTP 403). */
    AUTHORIZATION(false, "AUTHORIZATION_ERROR", "Authorization denied"),

    /** The addressed resource does not exist (HTTP 404). */
    NOT_FOUND(false, "NOT_FOUND", "Resource not found"),

    /** The request body failed server-side validation (validation-shaped HTTP 400). */
    VALIDATION(false, "VALIDATION_ERROR", "Validation failed"),

    /** The server throttled the client (HTTP 429). */
    RATE_LIMITED(true, "RATE_LIMIT_EXCEEDED", "Rate limit exceeded"),

    /**
     * Any other status, including server errors.
     *
     * <p>Only 5xx or unknown statuses are retried; see {@link ServerException#isRetryable()}.
     */
    SERVER(true, "API_REQUEST_ERROR", "Server or unknown error"),

    /** A transient failure persisted past the retry ceiling. */
    MAX_RETRIES_EXCEEDED(false, "MAX_RETRIES_EXCEEDED", "Maximum retries exceeded"),

    /** The caller cancelled the operation. */
    CANCELLED(false, "CANCELLED", "Operation cancelled"),

    /** Event-stream failure: abnormal close, heartbeat timeout, malformed frame, exhaustion. */
    CONNECTION(false, "WEBSOCKET_ERROR", "Event stream error"),

    /** A remote task or DAG execution reached a failed terminal state. */
    EXECUTION_FAILED(false, "EXECUTION_FAILED", "Remote execution failed");

    private final boolean retryable;
    private final String defaultCode;
    private final String description;

    ErrorKind(boolean retryable, String defaultCode, String description) {
        this.retryable = retryable;
        this.defaultCode = defaultCode;
        this.description = description;
    }

    /**
     * Checks if failures of this kind are generally retryable.
     *
     * @return true for the transient kinds
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns the code used when the server supplied none.
     *
     * @return the default error code
     */
    public String defaultCode() {
        return defaultCode;
    }

    /**
     * Returns a human-readable description of this kind.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
