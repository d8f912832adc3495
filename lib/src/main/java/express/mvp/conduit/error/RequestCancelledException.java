package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;

/** Thrown when the caller cancelled a call through its {@code CancellationToken}. */
public class RequestCancelledException extends ConduitException {

    private final int attempts;

    /**
     * Constructs a new cancellation exception.
     *
     * @param attempts the number of attempts made before cancellation was observed
     * @param lastError the last failure observed, may be null
     */
    public RequestCancelledException(int attempts, ConduitException lastError) {
        super(
                ErrorKind.CANCELLED,
                null,
                "Request cancelled after " + attempts + " attempt(s)",
                null,
                lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
