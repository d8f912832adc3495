package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;

/**
 * Thrown when a transient failure persisted through every allowed attempt.
 *
 * <p>The last concrete failure is available from {@link #lastError()} (and as the cause), so
 * callers can tell why retries stopped, not only that they did.
 */
public class MaxRetriesExceededException extends ConduitException {

    private final int attempts;
    private final ConduitException lastError;

    /**
     * Constructs a new exhaustion exception.
     *
     * @param attempts the number of attempts made
     * @param lastError the failure observed on the last attempt
     */
    public MaxRetriesExceededException(int attempts, ConduitException lastError) {
        super(
                ErrorKind.MAX_RETRIES_EXCEEDED,
                null,
                "Maximum retries (" + attempts + ") exceeded",
                null,
                lastError);
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Returns the failure observed on the last attempt.
     *
     * @return the last error
     */
    public ConduitException lastError() {
        return lastError;
    }
}
