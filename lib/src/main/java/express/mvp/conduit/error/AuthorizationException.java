package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.Map;

/**
 * Thrown when the credential is valid but not permitted to perform the action (HTTP 403).
 *
 * <p>The server may name the resource and action that were denied.
 */
public class AuthorizationException extends ConduitException {

    private final String resource;
    private final String action;

    /**
     * Constructs a new authorization exception.
     *
     * @param message the detail message
     * @param resource the denied resource, may be null
     * @param action the denied action, may be null
     * @param details structured details, may be null
     */
    public AuthorizationException(
            String message, String resource, String action, Map<String, Object> details) {
        super(ErrorKind.AUTHORIZATION, null, message, details, null);
        this.resource = resource;
        this.action = action;
    }

    /**
     * Returns the resource that was denied.
     *
     * @return the resource, or null if the server did not name one
     */
    public String resource() {
        return resource;
    }

    /**
     * Returns the action that was denied.
     *
     * @return the action, or null if the server did not name one
     */
    public String action() {
        return action;
    }
}
