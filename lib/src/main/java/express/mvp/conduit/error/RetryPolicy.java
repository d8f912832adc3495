package express.mvp.conduit.error;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Defines retry behavior for failed calls and reconnect attempts.
 *
 * <p>The delay before retrying after attempt <i>n</i> (1-indexed) is:
 *
 * <pre>
 * delay(n) = min(initialDelay * 2^(n-1) + uniform(0, maxJitter), maxDelay)
 * </pre>
 *
 * <p>The random jitter term keeps many clients from retrying in lockstep. The same policy type
 * drives both the HTTP request executor and the event-stream reconnect loop, each with its own
 * {@link RetryContext}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(3)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(5))
 *     .build();
 *
 * RetryContext context = new RetryContext("GET /api/v1/tasks", policy.getMaxAttempts());
 * context.startAttempt();
 * context.recordFailure(error);
 * if (policy.shouldRetry(context)) {
 *     loop.schedule(this::nextAttempt, Duration.ofMillis(policy.calculateDelay(context)));
 * }
 * }</pre>
 *
 * @see RetryContext
 * @see ErrorKind
 */
public final class RetryPolicy {

    /** Default upper bound of the random jitter added to every delay. */
    public static final Duration DEFAULT_MAX_JITTER = Duration.ofMillis(1000);

    /** Maximum number of attempts. */
    private final int maxAttempts;

    /** Delay after the first failed attempt, before jitter. */
    private final long initialDelayMillis;

    /** Maximum delay cap, applied after jitter. */
    private final long maxDelayMillis;

    /** Upper bound of the uniform jitter term. */
    private final long maxJitterMillis;

    /** Source of uniform values in [0, 1). */
    private final DoubleSupplier random;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelayMillis = builder.initialDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.maxJitterMillis = builder.maxJitterMillis;
        this.random = builder.random;
    }

    /**
     * Returns the maximum number of attempts.
     *
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMillis() {
        return initialDelayMillis;
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    /**
     * Determines if another attempt should be made.
     *
     * <p>Retry requires attempts remaining and a retryable last error. A context with no recorded
     * failure always allows the first attempt.
     *
     * @param context the retry context
     * @return true if retry should be attempted
     */
    public boolean shouldRetry(RetryContext context) {
        if (!context.hasAttemptsRemaining()) {
            return false;
        }
        if (context.getLastError() == null) {
            return true;
        }
        return context.getLastError().isRetryable();
    }

    /**
     * Calculates the delay before the next attempt.
     *
     * @param context the retry context (its attempt count is the failed attempt number)
     * @return delay in milliseconds
     */
    public long calculateDelay(RetryContext context) {
        long delay = delayForAttempt(Math.max(1, context.getAttemptCount()));
        context.setNextDelay(delay);
        return delay;
    }

    /**
     * Computes the delay that follows a failed attempt.
     *
     * @param attempt the failed attempt number, 1-indexed
     * @return delay in milliseconds, never above the cap
     */
    public long delayForAttempt(int attempt) {
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long exponential = initialDelayMillis * (1L << exponent);
        if (exponential < 0 || exponential > maxDelayMillis) {
            exponential = maxDelayMillis;
        }
        long jitter = maxJitterMillis > 0 ? (long) (random.getAsDouble() * maxJitterMillis) : 0;
        return Math.min(exponential + jitter, maxDelayMillis);
    }

    /**
     * Returns a policy that never retries.
     *
     * @return no-retry policy
     */
    public static RetryPolicy noRetry() {
        return new Builder().maxAttempts(1).build();
    }

    /**
     * Returns a policy with exponential backoff, default jitter and the given cap.
     *
     * @param maxAttempts maximum attempts
     * @param initialDelay delay after the first failure
     * @param maxDelay maximum delay cap
     * @return exponential backoff policy
     */
    public static RetryPolicy exponentialBackoff(
            int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .build();
    }

    /**
     * Returns a builder for custom policy configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts="
                + maxAttempts
                + ", initialDelay="
                + initialDelayMillis
                + "ms, maxDelay="
                + maxDelayMillis
                + "ms, maxJitter="
                + maxJitterMillis
                + "ms]";
    }

    /** Builder for {@link RetryPolicy}. */
    public static final class Builder {
        private int maxAttempts = 3;
        private long initialDelayMillis = 1_000;
        private long maxDelayMillis = 30_000;
        private long maxJitterMillis = DEFAULT_MAX_JITTER.toMillis();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        /**
         * Sets the maximum number of attempts.
         *
         * @param maxAttempts max attempts (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay after the first failed attempt.
         *
         * @param delay initial delay
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative");
            }
            this.initialDelayMillis = delay.toMillis();
            return this;
        }

        /**
         * Sets the maximum delay cap.
         *
         * @param maxDelay maximum delay
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelayMillis = maxDelay.toMillis();
            return this;
        }

        /**
         * Sets the upper bound of the uniform jitter term.
         *
         * @param maxJitter jitter bound ({@link Duration#ZERO} disables jitter)
         * @return this builder
         */
        public Builder maxJitter(Duration maxJitter) {
            Objects.requireNonNull(maxJitter, "maxJitter");
            if (maxJitter.isNegative()) {
                throw new IllegalArgumentException("maxJitter must not be negative");
            }
            this.maxJitterMillis = maxJitter.toMillis();
            return this;
        }

        /**
         * Replaces the source of uniform random values in [0, 1).
         *
         * @param random the random source
         * @return this builder
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         */
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
