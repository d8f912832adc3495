package express.mvp.conduit.client;

import java.time.Duration;

/**
 * How {@link OrchestratorClient} waits for a remote task or DAG execution to finish.
 *
 * <p>Unset values fall back to the defaults of the waiting method.
 */
public final class WaitOptions {

    /** All defaults, polling. */
    public static final WaitOptions DEFAULT = builder().build();

    private final Duration pollInterval;
    private final Duration timeout;
    private final boolean useEventStream;

    private WaitOptions(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.timeout = builder.timeout;
        this.useEventStream = builder.useEventStream;
    }

    public static Builder builder() {
        return new Builder();
    }

    Duration pollIntervalOr(Duration fallback) {
        return pollInterval != null ? pollInterval : fallback;
    }

    Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    public boolean useEventStream() {
        return useEventStream;
    }

    @Override
    public String toString() {
        return "WaitOptions[pollInterval="
                + pollInterval
                + ", timeout="
                + timeout
                + ", useEventStream="
                + useEventStream
                + "]";
    }

    /** Builder for {@link WaitOptions}. */
    public static final class Builder {
        private Duration pollInterval;
        private Duration timeout;
        private boolean useEventStream;

        private Builder() {}

        public Builder pollInterval(Duration pollInterval) {
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Waits on the event stream instead of polling. Applies to tasks only.
         *
         * @param useEventStream true to wait for a completion event
         * @return this builder
         */
        public Builder useEventStream(boolean useEventStream) {
            this.useEventStream = useEventStream;
            return this;
        }

        public WaitOptions build() {
            return new WaitOptions(this);
        }
    }
}
