package express.mvp.conduit.error;

import express.mvp.conduit.ConduitException;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Thrown when the server throttled the client (HTTP 429).
 *
 * <p>The quota fields are exposed when the server supplied them, so callers can render a
 * countdown or pace their own traffic.
 */
public class RateLimitedException extends ConduitException {

    private final OptionalLong retryAfter;
    private final OptionalLong limit;
    private final OptionalLong remaining;

    /**
     * Constructs a new rate-limit exception.
     *
     * @param message the detail message
     * @param retryAfter seconds until the quota resets, may be null
     * @param limit the quota size, may be null
     * @param remaining the quota left, may be null
     * @param details structured details, may be null
     */
    public RateLimitedException(
            String message,
            Long retryAfter,
            Long limit,
            Long remaining,
            Map<String, Object> details) {
        super(ErrorKind.RATE_LIMITED, null, message, details, null);
        this.retryAfter = toOptional(retryAfter);
        this.limit = toOptional(limit);
        this.remaining = toOptional(remaining);
    }

    public OptionalLong retryAfter() {
        return retryAfter;
    }

    public OptionalLong limit() {
        return limit;
    }

    public OptionalLong remaining() {
        return remaining;
    }

    private static OptionalLong toOptional(Long value) {
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }
}
