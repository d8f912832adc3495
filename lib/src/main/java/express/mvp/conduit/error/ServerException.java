package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.Map;

/**
 * Thrown for any status without a dedicated kind, including server errors.
 *
 * <p>The raw response body is kept for diagnostics. Only 5xx responses, and responses whose
 * status is unknown, are considered transient; other client errors (e.g. a plain 400 or a 409)
 * are surfaced without retry.
 */
public class ServerException extends ConduitException {

    private final int status;
    private final String method;
    private final String url;
    private final String body;

    /**
     * Constructs a new server exception.
     *
     * @param status the HTTP status, or 0 if unknown
     * @param code the error code from the body
     * @param message the detail message
     * @param method the HTTP method of the failed call
     * @param url the target of the failed call
     * @param body the raw response body, may be null
     * @param details structured details, may be null
     */
    public ServerException(
            int status,
            String code,
            String message,
            String method,
            String url,
            String body,
            Map<String, Object> details) {
        super(ErrorKind.SERVER, code, message, details, null);
        this.status = status;
        this.method = method;
        this.url = url;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public String method() {
        return method;
    }

    public String url() {
        return url;
    }

    /**
     * Returns the raw response body.
     *
     * @return the body, or null if the response had none
     */
    public String body() {
        return body;
    }

    @Override
    public boolean isRetryable() {
        return status <= 0 || status >= 500;
    }
}
