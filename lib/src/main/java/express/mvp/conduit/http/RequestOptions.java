package express.mvp.conduit.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call overrides of the executor's configuration.
 *
 * <p>Headers given here are applied after the configured ones and win on conflict.
 */
public final class RequestOptions {

    /** No overrides. */
    public static final RequestOptions DEFAULT = builder().build();

    private final Duration timeout;
    private final Map<String, String> headers;
    private final CancellationToken cancellationToken;

    private RequestOptions(Builder builder) {
        this.timeout = builder.timeout;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.cancellationToken = builder.cancellationToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the timeout override.
     *
     * @return the timeout, or null to use the configured one
     */
    public Duration timeout() {
        return timeout;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /**
     * Returns the caller's cancellation signal.
     *
     * @return the token, or null when the call cannot be cancelled
     */
    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /** Builder for {@link RequestOptions}. */
    public static final class Builder {
        private Duration timeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private CancellationToken cancellationToken;

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(
                    Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
