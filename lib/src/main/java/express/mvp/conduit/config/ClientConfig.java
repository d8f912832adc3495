package express.mvp.conduit.config;

import express.mvp.conduit.error.RetryPolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of the request executor and, through {@link #stream()}, of the event
 * stream.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Client Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>baseUrl</td><td>(required)</td><td>Server address, trailing slash removed</td></tr>
 *   <tr><td>apiKey</td><td>none</td><td>Bearer credential</td></tr>
 *   <tr><td>timeout</td><td>30s</td><td>Per-call timeout</td></tr>
 *   <tr><td>retries</td><td>3</td><td>Total attempts per call</td></tr>
 *   <tr><td>retryDelay</td><td>1s</td><td>Backoff base delay</td></tr>
 *   <tr><td>maxRetryDelay</td><td>30s</td><td>Backoff cap</td></tr>
 *   <tr><td>headers</td><td>none</td><td>Headers added to every call</td></tr>
 *   <tr><td>websocketUrl</td><td>derived</td><td>Stream address; {@code http} becomes
 *       {@code ws} and {@code /ws} is appended to the base address</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .baseUrl("http://localhost:8080")
 *     .apiKey(System.getenv("ORCHESTRATOR_API_KEY"))
 *     .timeout(Duration.ofSeconds(15))
 *     .retries(5)
 *     .build();
 * }</pre>
 *
 * @see StreamConfig
 */
public final class ClientConfig {

    /** Prefix of every key read by {@link #fromProperties(Properties)}. */
    public static final String PROPERTY_PREFIX = "conduit.";

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final int retries;
    private final Duration retryDelay;
    private final Duration maxRetryDelay;
    private final Map<String, String> headers;
    private final String websocketUrl;
    private final StreamConfig stream;

    private ClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout;
        this.retries = builder.retries;
        this.retryDelay = builder.retryDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.websocketUrl =
                builder.websocketUrl != null
                        ? builder.websocketUrl
                        : baseUrl.replaceFirst("^http", "ws") + "/ws";
        this.stream =
                builder.stream != null
                        ? builder.stream.build()
                        : StreamConfig.builder().url(websocketUrl).apiKey(apiKey).build();
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads configuration from {@code conduit.*} properties.
     *
     * <table border="1">
     *   <caption>Recognised Keys</caption>
     *   <tr><th>Key</th><th>Value</th></tr>
     *   <tr><td>conduit.baseUrl</td><td>server address (required)</td></tr>
     *   <tr><td>conduit.apiKey</td><td>bearer credential</td></tr>
     *   <tr><td>conduit.timeoutMs</td><td>per-call timeout</td></tr>
     *   <tr><td>conduit.retries</td><td>total attempts</td></tr>
     *   <tr><td>conduit.retryDelayMs</td><td>backoff base</td></tr>
     *   <tr><td>conduit.maxRetryDelayMs</td><td>backoff cap</td></tr>
     *   <tr><td>conduit.websocketUrl</td><td>stream address override</td></tr>
     *   <tr><td>conduit.header.&lt;name&gt;</td><td>custom header</td></tr>
     *   <tr><td>conduit.stream.*</td><td>see {@link StreamConfig.Builder#properties}</td></tr>
     * </table>
     *
     * @param properties the source properties
     * @return the configuration
     * @throws IllegalArgumentException if a value is malformed or {@code conduit.baseUrl} is absent
     */
    public static ClientConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        String base = properties.getProperty(PROPERTY_PREFIX + "baseUrl");
        if (base == null || base.isBlank()) {
            throw new IllegalArgumentException("Missing property " + PROPERTY_PREFIX + "baseUrl");
        }
        Builder builder = builder().baseUrl(base.trim());

        String key = properties.getProperty(PROPERTY_PREFIX + "apiKey");
        if (key != null && !key.isBlank()) {
            builder.apiKey(key.trim());
        }
        Long timeoutMs = longProperty(properties, "timeoutMs");
        if (timeoutMs != null) {
            builder.timeout(Duration.ofMillis(timeoutMs));
        }
        Long retries = longProperty(properties, "retries");
        if (retries != null) {
            if (retries < Integer.MIN_VALUE || retries > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                        "Property " + PROPERTY_PREFIX + "retries out of range: " + retries);
            }
            builder.retries(retries.intValue());
        }
        Long retryDelayMs = longProperty(properties, "retryDelayMs");
        if (retryDelayMs != null) {
            builder.retryDelay(Duration.ofMillis(retryDelayMs));
        }
        Long maxRetryDelayMs = longProperty(properties, "maxRetryDelayMs");
        if (maxRetryDelayMs != null) {
            builder.maxRetryDelay(Duration.ofMillis(maxRetryDelayMs));
        }
        String ws = properties.getProperty(PROPERTY_PREFIX + "websocketUrl");
        if (ws != null && !ws.isBlank()) {
            builder.websocketUrl(ws.trim());
        }
        String headerPrefix = PROPERTY_PREFIX + "header.";
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(headerPrefix) && name.length() > headerPrefix.length()) {
                builder.header(name.substring(headerPrefix.length()), properties.getProperty(name));
            }
        }

        ClientConfig derived = builder.build();
        builder.stream(
                StreamConfig.builder()
                        .url(derived.websocketUrl())
                        .apiKey(derived.apiKey())
                        .properties(properties));
        return builder.build();
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Returns the bearer credential.
     *
     * @return the API key, or null when calls are unauthenticated
     */
    public String apiKey() {
        return apiKey;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the total attempt ceiling per call.
     *
     * @return the number of attempts, at least 1
     */
    public int retries() {
        return retries;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public Duration maxRetryDelay() {
        return maxRetryDelay;
    }

    /**
     * Returns the custom headers added to every call.
     *
     * @return an unmodifiable map in insertion order
     */
    public Map<String, String> headers() {
        return headers;
    }

    public String websocketUrl() {
        return websocketUrl;
    }

    /**
     * Returns the event-stream configuration, derived from this configuration unless overridden.
     *
     * @return the stream configuration
     */
    public StreamConfig stream() {
        return stream;
    }

    /**
     * Builds the retry policy of the request executor.
     *
     * @return a policy with {@link #retries()} attempts and this configuration's delays
     */
    public RetryPolicy retryPolicy() {
        return RetryPolicy.exponentialBackoff(retries, retryDelay, maxRetryDelay);
    }

    @Override
    public String toString() {
        return "ClientConfig[baseUrl="
                + baseUrl
                + ", apiKey="
                + (apiKey != null ? "***" : "none")
                + ", timeout="
                + timeout.toMillis()
                + "ms, retries="
                + retries
                + ", retryDelay="
                + retryDelay.toMillis()
                + "ms, maxRetryDelay="
                + maxRetryDelay.toMillis()
                + "ms, websocketUrl="
                + websocketUrl
                + "]";
    }

    private static Long longProperty(Properties properties, String name) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + PROPERTY_PREFIX + name + " is not a number: " + value, e);
        }
    }

    /**
     * Builder for constructing {@link ClientConfig} instances.
     *
     * <p>Only {@code baseUrl} is required.
     */
    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
        private int retries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String websocketUrl;
        private StreamConfig.Builder stream;

        /**
         * Sets the server address. A trailing slash is removed.
         *
         * @param baseUrl the base address, e.g. {@code http://localhost:8080}
         * @return this builder for chaining
         */
        public Builder baseUrl(String baseUrl) {
            Objects.requireNonNull(baseUrl, "baseUrl");
            this.baseUrl =
                    baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        /**
         * Sets the per-call timeout.
         *
         * @param timeout a positive duration
         * @return this builder for chaining
         */
        public Builder timeout(Duration timeout) {
            this.timeout = positive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the total attempt ceiling per call.
         *
         * @param retries attempts, at least 1
         * @return this builder for chaining
         */
        public Builder retries(int retries) {
            if (retries < 1) {
                throw new IllegalArgumentException("retries must be >= 1");
            }
            this.retries = retries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = nonNegative(retryDelay, "retryDelay");
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = nonNegative(maxRetryDelay, "maxRetryDelay");
            return this;
        }

        /**
         * Adds a header sent with every call.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder for chaining
         */
        public Builder header(String name, String value) {
            headers.put(
                    Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> values) {
            values.forEach(this::header);
            return this;
        }

        public Builder websocketUrl(String websocketUrl) {
            this.websocketUrl = websocketUrl;
            return this;
        }

        /**
         * Overrides the derived event-stream configuration.
         *
         * @param stream a stream builder; its url and credential are used as given
         * @return this builder for chaining
         */
        public Builder stream(StreamConfig.Builder stream) {
            this.stream = stream;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the immutable configuration
         * @throws IllegalStateException if no base address was set
         */
        public ClientConfig build() {
            if (baseUrl == null || baseUrl.isEmpty()) {
                throw new IllegalStateException("baseUrl is required");
            }
            return new ClientConfig(this);
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
