package express.mvp.conduit.client;

import express.mvp.conduit.ConduitException;
import express.mvp.conduit.error.ErrorKind;

/** A remote task or DAG execution reached {@code failed} or {@code cancelled}. */
public class ExecutionFailedException extends ConduitException {

    private final String resourceId;
    private final String status;

    /**
     * Constructs a new exception.
     *
     * @param resourceId the task id, or the DAG execution id
     * @param status the terminal status
     * @param message the detail message, including the remote error message
     */
    public ExecutionFailedException(String resourceId, String status, String message) {
        super(ErrorKind.EXECUTION_FAILED, null, message, null, null);
        this.resourceId = resourceId;
        this.status = status;
    }

    public String resourceId() {
        return resourceId;
    }

    public String status() {
        return status;
    }
}
