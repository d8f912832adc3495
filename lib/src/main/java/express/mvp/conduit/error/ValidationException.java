package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.List;
import java.util.Map;

/**
 * Thrown when the server rejected the request body (validation-shaped HTTP 400), or when a
 * request could not be built locally.
 *
 * <p>Each rejected field is reported as a {@link FieldError}.
 */
public class ValidationException extends ConduitException {

    private final List<FieldError> fieldErrors;

    /**
     * Constructs a new validation exception.
     *
     * @param message the detail message
     * @param fieldErrors the rejected fields, may be null
     * @param details structured details, may be null
     */
    public ValidationException(
            String message, List<FieldError> fieldErrors, Map<String, Object> details) {
        super(ErrorKind.VALIDATION, null, message, details, null);
        this.fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    /**
     * Constructs a validation exception for a request rejected before it was sent.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, null, message, null, cause);
        this.fieldErrors = List.of();
    }

    /**
     * Returns the rejected fields in the order the server reported them.
     *
     * @return an unmodifiable list, empty when the server listed none
     */
    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    /**
     * One rejected field.
     *
     * @param field the field name
     * @param message why the value was rejected
     * @param value the rejected value, may be null
     */
    public record FieldError(String field, String message, Object value) {}
}
