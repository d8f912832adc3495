package express.mvp.conduit.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.conduit.ConduitException;

/**
 * Tracks the attempts of one logical operation.
 *
 * <p>A context lives only as long as the operation it tracks: one HTTP call, or one run of
 * reconnect attempts. It records the attempt count, the time spent, and the last error. It's used
 * by {@link RetryPolicy} to make retry decisions.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. It is confined to the event loop that drives the operation.
 *
 * @see RetryPolicy
 */
public final class RetryContext {

    /** Identifier for the operation being retried. */
    private final String operationId;

    /** Maximum number of attempts (including initial). */
    private final int maxAttempts;

    /** Current attempt number (1-based). */
    private int attemptCount;

    /** Time of first attempt, from the owning clock. */
    private final long startTimeMillis;

    /** Last error encountered. */
    private ConduitException lastError;

    /** Total time spent in delays. */
    private long totalDelayMillis;

    /** Next delay to apply (set by policy). */
    private long nextDelayMillis;

    /**
     * Creates a new retry context.
     *
     * @param operationId identifier for the operation
     * @param maxAttempts maximum number of attempts
     * @param startTimeMillis the current time of the owning clock
     */
    public RetryContext(String operationId, int maxAttempts, long startTimeMillis) {
        this.operationId = operationId;
        this.maxAttempts = maxAttempts;
        this.startTimeMillis = startTimeMillis;
    }

    /**
     * Creates a context starting at the current wall-clock time.
     *
     * @param operationId identifier for the operation
     * @param maxAttempts maximum number of attempts
     */
    public RetryContext(String operationId, int maxAttempts) {
        this(operationId, maxAttempts, System.currentTimeMillis());
    }

    public String getOperationId() {
        return operationId;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the current attempt count.
     *
     * @return number of attempts made (0 before first attempt)
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Checks if there are attempts remaining.
     *
     * @return true if more attempts are allowed
     */
    public boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    /**
     * Records that an attempt is starting.
     *
     * @return the new attempt number
     */
    public int startAttempt() {
        return ++attemptCount;
    }

    /**
     * Records a failed attempt.
     *
     * @param error the classified failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Throwable is kept for diagnostics and cannot be safely copied.")
    public void recordFailure(ConduitException error) {
        this.lastError = error;
    }

    /**
     * Returns the last error encountered.
     *
     * @return the last error, or null if no failures yet
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public ConduitException getLastError() {
        return lastError;
    }

    /**
     * Returns the elapsed time relative to the given clock reading.
     *
     * @param nowMillis the current time of the owning clock
     * @return elapsed milliseconds
     */
    public long getElapsedMillis(long nowMillis) {
        return nowMillis - startTimeMillis;
    }

    public long getTotalDelayMillis() {
        return totalDelayMillis;
    }

    /**
     * Sets the delay for the next retry.
     *
     * <p>This is typically called by the retry policy.
     *
     * @param delayMillis delay in milliseconds
     */
    public void setNextDelay(long delayMillis) {
        this.nextDelayMillis = delayMillis;
    }

    public long getNextDelayMillis() {
        return nextDelayMillis;
    }

    /**
     * Records that a delay was scheduled.
     *
     * @param delayMillis the delay that was applied
     */
    public void recordDelay(long delayMillis) {
        this.totalDelayMillis += delayMillis;
    }

    /** Resets the context for reuse, e.g. after a successful reconnect. */
    public void reset() {
        this.attemptCount = 0;
        this.lastError = null;
        this.totalDelayMillis = 0;
        this.nextDelayMillis = 0;
    }

    @Override
    public String toString() {
        return String.format(
                "RetryContext[op=%s, attempt=%d/%d, lastError=%s]",
                operationId,
                attemptCount,
                maxAttempts,
                lastError != null ? lastError.kind().name() : null);
    }
}
