package express.mvp.conduit;

import express.mvp.conduit.error.ErrorKind;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base unchecked exception for every failure surfaced by the communication layer.
 *
 * <p>Each instance carries an {@link ErrorKind} discriminant so callers can branch on the kind of
 * failure without {@code instanceof} chains. Subclasses add the structured fields of their kind
 * (retry-after for rate limits, field errors for validation, and so on).
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * client.getTask(taskId).whenComplete((task, error) -> {
 *     if (error == null) {
 *         return;
 *     }
 *     ConduitException failure = ConduitException.unwrap(error);
 *     switch (failure.kind()) {
 *         case RATE_LIMITED -> showCountdown(((RateLimitedException) failure).retryAfter());
 *         case AUTHENTICATION -> promptLogin();
 *         default -> log(failure);
 *     }
 * });
 * }</pre>
 *
 * @see ErrorKind
 */
public class ConduitException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> details;
    private final Instant timestamp;

    /**
     * Constructs a new exception.
     *
     * @param kind the error kind
     * @param code the stable error code (e.g. {@code NOT_FOUND})
     * @param message the detail message
     * @param details structured details from the server, may be null
     * @param cause the underlying cause, may be null
     */
    public ConduitException(
            ErrorKind kind,
            String code,
            String message,
            Map<String, Object> details,
            Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = code != null ? code : kind.defaultCode();
        this.details =
                details == null || details.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.timestamp = Instant.now();
    }

    /**
     * Constructs a new exception without details or cause.
     *
     * @param kind the error kind
     * @param message the detail message
     */
    public ConduitException(ErrorKind kind, String message) {
        this(kind, null, message, null, null);
    }

    /**
     * Returns the kind of this failure.
     *
     * @return the error kind (never null)
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the stable error code reported by the server or assigned locally.
     *
     * @return the error code
     */
    public String code() {
        return code;
    }

    /**
     * Returns structured details attached to the failure.
     *
     * @return an unmodifiable map, empty when no details were supplied
     */
    public Map<String, Object> details() {
        return details;
    }

    /**
     * Returns the time this exception was created.
     *
     * @return the creation instant
     */
    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Checks whether retrying the failed operation could succeed.
     *
     * <p>Defaults to {@link ErrorKind#isRetryable()}; subclasses may narrow it further.
     *
     * @return true if the failure is transient
     */
    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Extracts the {@code ConduitException} from a throwable produced by a future.
     *
     * <p>{@link CompletionException} and {@link ExecutionException} wrappers are stripped. Any
     * other throwable is wrapped as a {@link ErrorKind#NETWORK} failure.
     *
     * @param throwable the throwable to unwrap
     * @return the conduit exception
     */
    public static ConduitException unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof ConduitException conduit) {
            return conduit;
        }
        return new ConduitException(
                ErrorKind.NETWORK,
                null,
                current != null && current.getMessage() != null
                        ? current.getMessage()
                        : "Network error",
                null,
                current);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "/" + code + "]: " + getMessage();
    }
}
