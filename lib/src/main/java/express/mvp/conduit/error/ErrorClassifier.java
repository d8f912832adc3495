package express.mvp.conduit.error;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.conduit.ConduitException;
import express.mvp.conduit.json.Json;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failed call to exactly one {@link ErrorKind} and its structured exception.
 *
 * <p>Two entry points mirror the two ways a call can fail:
 *
 * <ul>
 *   <li>{@link #classify(int, String, String, String, Duration)} - a response arrived with an
 *       error status. The status selects the kind; the body's {@code error} object supplies the
 *       structured fields.
 *   <li>{@link #classifyTransportFailure(Throwable, Duration)} - no response arrived. Timeouts map
 *       to {@link ErrorKind#TIMEOUT}, everything else to {@link ErrorKind#NETWORK}.
 * </ul>
 *
 * <h2>Status Mapping</h2>
 *
 * <pre>
 * 400 (VALIDATION_ERROR body) → VALIDATION
 * 401                         → AUTHENTICATION
 * 403                         → AUTHORIZATION
 * 404                         → NOT_FOUND
 * 408                         → TIMEOUT
 * 422 (VALIDATION_ERROR body) → VALIDATION
 * 429                         → RATE_LIMITED
 * anything else               → SERVER
 * </pre>
 *
 * <p>The classifier has no side effects. The same input always yields an equal result.
 *
 * @see ErrorKind
 */
public final class ErrorClassifier {

    /** Message used when the server did not supply one. */
    public static final String UNKNOWN_MESSAGE = "Unknown error";

    /** Code used when the server did not supply one. */
    public static final String UNKNOWN_CODE = "UNKNOWN_ERROR";

    private static final String VALIDATION_CODE = "VALIDATION_ERROR";

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a response that carried an error status.
     *
     * @param status the HTTP status
     * @param body the raw response body, may be null
     * @param method the HTTP method of the call
     * @param url the target of the call
     * @param configuredTimeout the timeout in force for the call, used for 408 without details
     * @return the classified exception
     */
    public static ConduitException classify(
            int status, String body, String method, String url, Duration configuredTimeout) {
        JsonNode error = Json.readLenient(body).path("error");
        String message = orDefault(Json.text(error, "message"), UNKNOWN_MESSAGE);
        String code = orDefault(Json.text(error, "code"), UNKNOWN_CODE);
        Map<String, Object> details = Json.toMap(error.path("details"));

        switch (status) {
            case 400:
            case 422:
                if (VALIDATION_CODE.equals(code)) {
                    return new ValidationException(
                            message, fieldErrors(error.path("validationErrors")), details);
                }
                return new ServerException(status, code, message, method, url, body, details);
            case 401:
                return new AuthenticationException(message, details);
            case 403:
                return new AuthorizationException(
                        message, Json.text(error, "resource"), Json.text(error, "action"), details);
            case 404:
                return new NotFoundException(
                        Json.text(error, "resourceType"),
                        Json.text(error, "resourceId"),
                        message,
                        details);
            case 408:
                Long timeoutMs = Json.number(error, "timeoutMs");
                return new ConduitTimeoutException(
                        message,
                        timeoutMs != null ? Duration.ofMillis(timeoutMs) : configuredTimeout,
                        details,
                        null);
            case 429:
                return new RateLimitedException(
                        message,
                        Json.number(error, "retryAfter"),
                        Json.number(error, "limit"),
                        Json.number(error, "remaining"),
                        details);
            default:
                return new ServerException(status, code, message, method, url, body, details);
        }
    }

    /**
     * Classifies a failure where no response reached the client.
     *
     * @param throwable the transport failure
     * @param configuredTimeout the timeout in force for the call
     * @return a {@link ConduitTimeoutException} or {@link NetworkException}
     */
    public static ConduitException classifyTransportFailure(
            Throwable throwable, Duration configuredTimeout) {
        Throwable failure = unwrap(throwable);
        if (failure instanceof ConduitException conduit) {
            return conduit;
        }
        if (isTimeoutError(failure)) {
            return new ConduitTimeoutException(
                    "Request timed out after " + configuredTimeout.toMillis() + "ms",
                    configuredTimeout,
                    null,
                    failure);
        }
        String message = failure != null ? failure.getMessage() : null;
        return new NetworkException(
                message != null && !message.isEmpty() ? message : "Network error", failure);
    }

    /**
     * Checks if a transport failure is a timeout.
     *
     * @param t the failure
     * @return true for timeout exceptions or timeout messages
     */
    public static boolean isTimeoutError(Throwable t) {
        if (t == null) {
            return false;
        }
        if (t instanceof HttpTimeoutException) return true;
        if (t instanceof TimeoutException) return true;
        if (t instanceof SocketTimeoutException) return true;

        String msg = t.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (lower.contains("timeout") || lower.contains("timed out")) {
                return true;
            }
        }
        return false;
    }

    private static List<ValidationException.FieldError> fieldErrors(JsonNode node) {
        List<ValidationException.FieldError> errors = new ArrayList<>();
        if (!node.isArray()) {
            return errors;
        }
        for (JsonNode entry : node) {
            JsonNode value = entry.path("value");
            errors.add(
                    new ValidationException.FieldError(
                            orDefault(Json.text(entry, "field"), ""),
                            orDefault(Json.text(entry, "message"), UNKNOWN_MESSAGE),
                            value.isMissingNode() || value.isNull()
                                    ? null
                                    : Json.mapper().convertValue(value, Object.class)));
        }
        return errors;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isEmpty() ? value : fallback;
    }
}
