package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.Map;

/** Thrown when the server rejected or did not receive a credential (HTTP 401). */
public class AuthenticationException extends ConduitException {

    /**
     * Constructs a new authentication exception.
     *
     * @param message the detail message
     * @param details structured details, may be null
     */
    public AuthenticationException(String message, Map<String, Object> details) {
        super(ErrorKind.AUTHENTICATION, null, message, details, null);
    }
}
