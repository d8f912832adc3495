package express.mvp.conduit.error;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryPolicy} and {@link RetryContext}. */
@DisplayName("RetryPolicy")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class RetryPolicyTest {

    private static RetryPolicy policy(double random) {
        return RetryPolicy.builder()
                .maxAttempts(5)
                .initialDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(5000))
                .random(() -> random)
                .build();
    }

    @Nested
    @DisplayName("No retry policy")
    class NoRetryPolicyTests {

        @Test
        @DisplayName("noRetry allows only one attempt")
        void noRetry_allowsOneAttempt() {
            assertEquals(1, RetryPolicy.noRetry().getMaxAttempts());
        }

        @Test
        @DisplayName("noRetry returns false for shouldRetry after first attempt")
        void noRetry_returnsFalseAfterFirstAttempt() {
            RetryPolicy policy = RetryPolicy.noRetry();
            RetryContext context = new RetryContext("op", policy.getMaxAttempts());

            context.startAttempt();
            context.recordFailure(new NetworkException("down", null));

            assertFalse(policy.shouldRetry(context));
        }
    }

    @Nested
    @DisplayName("Exponential backoff")
    class BackoffTests {

        @Test
        @DisplayName("Delay doubles per attempt without jitter")
        void doublesPerAttempt() {
            RetryPolicy policy = policy(0.0);
            assertEquals(1000, policy.delayForAttempt(1));
            assertEquals(2000, policy.delayForAttempt(2));
            assertEquals(4000, policy.delayForAttempt(3));
        }

        @Test
        @DisplayName("Delay is capped after jitter")
        void cappedAfterJitter() {
            RetryPolicy policy = policy(0.999);
            assertEquals(1999, policy.delayForAttempt(1));
            assertEquals(5000, policy.delayForAttempt(3));
            assertEquals(5000, policy.delayForAttempt(30));
        }

        @Test
        @DisplayName("Huge attempt numbers do not overflow")
        void noOverflow() {
            assertEquals(5000, policy(0.0).delayForAttempt(Integer.MAX_VALUE));
        }

        @Test
        @DisplayName("Delays never decrease and stay within the cap")
        void nonDecreasing() {
            AtomicReference<Double> random = new AtomicReference<>(0.0);
            RetryPolicy policy =
                    RetryPolicy.builder()
                            .maxAttempts(5)
                            .initialDelay(Duration.ofMillis(1000))
                            .maxDelay(Duration.ofMillis(5000))
                            .random(random::get)
                            .build();
            double[] draws = {0.99, 0.0, 0.99, 0.0, 0.5};
            long previous = 0;
            for (int attempt = 1; attempt <= draws.length; attempt++) {
                random.set(draws[attempt - 1]);
                long delay = policy.delayForAttempt(attempt);
                assertTrue(delay >= previous, "attempt " + attempt + ": " + delay);
                assertTrue(delay <= 5000);
                previous = delay;
            }
        }

        @Test
        @DisplayName("calculateDelay uses the context's attempt count")
        void calculateDelay_usesContext() {
            RetryPolicy policy = policy(0.0);
            RetryContext context = new RetryContext("op", 5);

            context.startAttempt();
            context.startAttempt();

            assertEquals(2000, policy.calculateDelay(context));
            assertEquals(2000, context.getNextDelayMillis());
        }

        @Test
        @DisplayName("Jitter can be disabled")
        void noJitter() {
            RetryPolicy policy =
                    RetryPolicy.builder()
                            .initialDelay(Duration.ofMillis(250))
                            .maxJitter(Duration.ZERO)
                            .random(() -> 0.9)
                            .build();
            assertEquals(250, policy.delayForAttempt(1));
        }
    }

    @Nested
    @DisplayName("Retry decisions")
    class DecisionTests {

        @Test
        @DisplayName("Retryable errors are retried while attempts remain")
        void retryableWithinLimit() {
            RetryPolicy policy =
                    RetryPolicy.exponentialBackoff(
                            3, Duration.ofSeconds(1), Duration.ofSeconds(30));
            RetryContext context = new RetryContext("op", policy.getMaxAttempts());

            context.startAttempt();
            context.recordFailure(new NetworkException("down", null));
            assertTrue(policy.shouldRetry(context));

            context.startAttempt();
            context.startAttempt();
            assertFalse(policy.shouldRetry(context));
        }

        @Test
        @DisplayName("Permanent errors are never retried")
        void permanentNeverRetried() {
            RetryPolicy policy = policy(0.0);
            RetryContext context = new RetryContext("op", policy.getMaxAttempts());

            context.startAttempt();
            context.recordFailure(new AuthenticationException("bad key", null));

            assertFalse(policy.shouldRetry(context));
        }

        @Test
        @DisplayName("Client-status server errors are not retried")
        void clientStatusNotRetried() {
            RetryPolicy policy = policy(0.0);
            RetryContext context = new RetryContext("op", policy.getMaxAttempts());

            context.startAttempt();
            context.recordFailure(new ServerException(409, "CONFLICT", "c", "PUT", "/x", "", null));

            assertFalse(policy.shouldRetry(context));
        }
    }

    @Nested
    @DisplayName("Builder validation")
    class BuilderTests {

        @Test
        @DisplayName("Rejects fewer than one attempt")
        void rejectsZeroAttempts() {
            assertThrows(
                    IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        }

        @Test
        @DisplayName("Rejects negative delays")
        void rejectsNegativeDelays() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().initialDelay(Duration.ofMillis(-1)));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().maxDelay(Duration.ofMillis(-1)));
        }
    }

    @Nested
    @DisplayName("RetryContext")
    class RetryContextTests {

        @Test
        @DisplayName("Tracks attempts, delays and resets")
        void tracksAndResets() {
            RetryContext context = new RetryContext("reconnect", 2, 100);

            assertEquals(1, context.startAttempt());
            context.recordFailure(new NetworkException("x", null));
            context.recordDelay(1500);
            assertEquals(2, context.startAttempt());
            assertFalse(context.hasAttemptsRemaining());
            assertEquals(1500, context.getTotalDelayMillis());
            assertEquals(400, context.getElapsedMillis(500));

            context.reset();

            assertEquals(0, context.getAttemptCount());
            assertNull(context.getLastError());
            assertEquals(0, context.getTotalDelayMillis());
            assertTrue(context.hasAttemptsRemaining());
        }
    }
}
