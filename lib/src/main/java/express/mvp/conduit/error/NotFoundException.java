package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.Map;

/** Thrown when the addressed resource does not exist (HTTP 404). */
public class NotFoundException extends ConduitException {

    /** Resource type reported when the server names none. */
    public static final String DEFAULT_RESOURCE_TYPE = "Resource";

    /** Resource id reported when the server names none. */
    public static final String DEFAULT_RESOURCE_ID = "unknown";

    private final String resourceType;
    private final String resourceId;

    /**
     * Constructs a new not-found exception.
     *
     * @param resourceType the resource type, defaults to {@value #DEFAULT_RESOURCE_TYPE}
     * @param resourceId the resource id, defaults to {@value #DEFAULT_RESOURCE_ID}
     * @param message the detail message, derived from type and id when null
     * @param details structured details, may be null
     */
    public NotFoundException(
            String resourceType, String resourceId, String message, Map<String, Object> details) {
        super(
                ErrorKind.NOT_FOUND,
                null,
                message != null
                        ? message
                        : orDefault(resourceType, DEFAULT_RESOURCE_TYPE)
                                + " with id '"
                                + orDefault(resourceId, DEFAULT_RESOURCE_ID)
                                + "' not found",
                details,
                null);
        this.resourceType = orDefault(resourceType, DEFAULT_RESOURCE_TYPE);
        this.resourceId = orDefault(resourceId, DEFAULT_RESOURCE_ID);
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
