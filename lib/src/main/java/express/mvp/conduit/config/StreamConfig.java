package express.mvp.conduit.config;

import express.mvp.conduit.error.RetryPolicy;
import express.mvp.conduit.stream.MalformedFramePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of one event-stream connection.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Stream Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>url</td><td>(required)</td><td>{@code ws://} or {@code wss://} address</td></tr>
 *   <tr><td>apiKey</td><td>none</td><td>Sent as the {@code apiKey} query parameter</td></tr>
 *   <tr><td>autoReconnect</td><td>true</td><td>Reconnect after an unexpected close</td></tr>
 *   <tr><td>reconnectInterval</td><td>1s</td><td>Reconnect backoff base delay</td></tr>
 *   <tr><td>maxReconnectAttempts</td><td>10</td><td>Consecutive reconnect attempts</td></tr>
 *   <tr><td>heartbeatInterval</td><td>30s</td><td>Ping period</td></tr>
 *   <tr><td>heartbeatTimeout</td><td>10s</td><td>Silence tolerated after a ping</td></tr>
 *   <tr><td>connectTimeout</td><td>10s</td><td>Transport open timeout</td></tr>
 *   <tr><td>malformedFramePolicy</td><td>REPORT</td><td>Handling of unparseable frames</td></tr>
 * </table>
 *
 * <p>Reconnect delays follow the same backoff formula as request retries, capped at {@link
 * #MAX_RECONNECT_DELAY}.
 */
public final class StreamConfig {

    /** Upper bound of any reconnect delay. */
    public static final Duration MAX_RECONNECT_DELAY = Duration.ofSeconds(30);

    private final String url;
    private final String apiKey;
    private final boolean autoReconnect;
    private final Duration reconnectInterval;
    private final int maxReconnectAttempts;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final Duration connectTimeout;
    private final MalformedFramePolicy malformedFramePolicy;

    private StreamConfig(Builder builder) {
        this.url = builder.url;
        this.apiKey = builder.apiKey;
        this.autoReconnect = builder.autoReconnect;
        this.reconnectInterval = builder.reconnectInterval;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTimeout = builder.heartbeatTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.malformedFramePolicy = builder.malformedFramePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String url() {
        return url;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean autoReconnect() {
        return autoReconnect;
    }

    public Duration reconnectInterval() {
        return reconnectInterval;
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public MalformedFramePolicy malformedFramePolicy() {
        return malformedFramePolicy;
    }

    /**
     * Builds the reconnect backoff policy.
     *
     * @return a policy based on {@link #reconnectInterval()}, capped at {@link
     *     #MAX_RECONNECT_DELAY}
     */
    public RetryPolicy reconnectPolicy() {
        return RetryPolicy.exponentialBackoff(
                Math.max(1, maxReconnectAttempts), reconnectInterval, MAX_RECONNECT_DELAY);
    }

    /**
     * Returns the address to open, with the credential appended as a query parameter.
     *
     * @return the connection URI
     * @throws IllegalArgumentException if the configured address is not a valid URI
     */
    public URI connectUri() {
        if (apiKey == null || apiKey.isEmpty()) {
            return URI.create(url);
        }
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(
                url + separator + "apiKey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    /**
     * Returns a builder pre-filled with this configuration.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .url(url)
                .apiKey(apiKey)
                .autoReconnect(autoReconnect)
                .reconnectInterval(reconnectInterval)
                .maxReconnectAttempts(maxReconnectAttempts)
                .heartbeatInterval(heartbeatInterval)
                .heartbeatTimeout(heartbeatTimeout)
                .connectTimeout(connectTimeout)
                .malformedFramePolicy(malformedFramePolicy);
    }

    @Override
    public String toString() {
        return "StreamConfig[url="
                + url
                + ", autoReconnect="
                + autoReconnect
                + ", reconnectInterval="
                + reconnectInterval.toMillis()
                + "ms, maxReconnectAttempts="
                + maxReconnectAttempts
                + ", heartbeat="
                + heartbeatInterval.toMillis()
                + "/"
                + heartbeatTimeout.toMillis()
                + "ms, malformedFrames="
                + malformedFramePolicy
                + "]";
    }

    /** Builder for constructing {@link StreamConfig} instances. */
    public static final class Builder {
        private String url;
        private String apiKey;
        private boolean autoReconnect = true;
        private Duration reconnectInterval = Duration.ofSeconds(1);
        private int maxReconnectAttempts = 10;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration heartbeatTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private MalformedFramePolicy malformedFramePolicy = MalformedFramePolicy.REPORT;

        public Builder url(String url) {
            this.url = Objects.requireNonNull(url, "url");
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder reconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = nonNegative(reconnectInterval, "reconnectInterval");
            return this;
        }

        /**
         * Sets how many consecutive reconnect attempts are made before giving up.
         *
         * @param maxReconnectAttempts attempts, zero disables reconnection
         * @return this builder for chaining
         */
        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
            }
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = positive(heartbeatInterval, "heartbeatInterval");
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = positive(heartbeatTimeout, "heartbeatTimeout");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder malformedFramePolicy(MalformedFramePolicy malformedFramePolicy) {
            this.malformedFramePolicy =
                    Objects.requireNonNull(malformedFramePolicy, "malformedFramePolicy");
            return this;
        }

        /**
         * Applies {@code conduit.stream.*} keys.
         *
         * <p>Recognised keys: {@code autoReconnect}, {@code reconnectIntervalMs}, {@code
         * maxReconnectAttempts}, {@code heartbeatIntervalMs}, {@code heartbeatTimeoutMs}, {@code
         * connectTimeoutMs}, {@code malformedFrames} ({@code report} or {@code drop}).
         *
         * @param properties the source properties
         * @return this builder for chaining
         * @throws IllegalArgumentException if a value is malformed
         */
        public Builder properties(Properties properties) {
            String prefix = ClientConfig.PROPERTY_PREFIX + "stream.";
            String value = properties.getProperty(prefix + "autoReconnect");
            if (value != null && !value.isBlank()) {
                autoReconnect(Boolean.parseBoolean(value.trim()));
            }
            Long millis = longProperty(properties, prefix + "reconnectIntervalMs");
            if (millis != null) {
                reconnectInterval(Duration.ofMillis(millis));
            }
            Long attempts = longProperty(properties, prefix + "maxReconnectAttempts");
            if (attempts != null) {
                maxReconnectAttempts(Math.toIntExact(attempts));
            }
            millis = longProperty(properties, prefix + "heartbeatIntervalMs");
            if (millis != null) {
                heartbeatInterval(Duration.ofMillis(millis));
            }
            millis = longProperty(properties, prefix + "heartbeatTimeoutMs");
            if (millis != null) {
                heartbeatTimeout(Duration.ofMillis(millis));
            }
            millis = longProperty(properties, prefix + "connectTimeoutMs");
            if (millis != null) {
                connectTimeout(Duration.ofMillis(millis));
            }
            value = properties.getProperty(prefix + "malformedFrames");
            if (value != null && !value.isBlank()) {
                malformedFramePolicy(
                        MalformedFramePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            }
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the immutable configuration
         * @throws IllegalStateException if no address was set
         */
        public StreamConfig build() {
            if (url == null || url.isEmpty()) {
                throw new IllegalStateException("url is required");
            }
            return new StreamConfig(this);
        }

        private static Long longProperty(Properties properties, String key) {
            String value = properties.getProperty(key);
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Property " + key + " is not a number: " + value, e);
            }
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }
}
