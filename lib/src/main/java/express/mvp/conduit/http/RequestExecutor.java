package express.mvp.conduit.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import express.mvp.conduit.ConduitException;
import express.mvp.conduit.config.ClientConfig;
import express.mvp.conduit.error.ErrorClassifier;
import express.mvp.conduit.error.MaxRetriesExceededException;
import express.mvp.conduit.error.RequestCancelledException;
import express.mvp.conduit.error.RetryContext;
import express.mvp.conduit.error.RetryPolicy;
import express.mvp.conduit.error.ServerException;
import express.mvp.conduit.error.ValidationException;
import express.mvp.conduit.json.Json;
import express.mvp.conduit.loop.Cancellable;
import express.mvp.conduit.loop.EventLoop;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues logical calls against the server, retrying transient failures with backoff.
 *
 * <p>One logical call is a sequence of attempts tracked by a {@link RetryContext}. After each
 * failed attempt the failure is classified by {@link ErrorClassifier}; the call is retried only
 * when the failure is transient, attempts remain and the caller has not cancelled. The backoff
 * sleep is a timer on the {@link EventLoop}; no thread is blocked while waiting.
 *
 * <h2>Outcomes</h2>
 *
 * <ul>
 *   <li>2xx: the {@code data} member of the success envelope ({@link NullNode} when absent)
 *   <li>permanent failure: the classified exception, after one attempt
 *   <li>transient failure on the last attempt: {@link MaxRetriesExceededException} wrapping it
 *   <li>cancellation: {@link RequestCancelledException}, observed before each attempt and during
 *       backoff
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RequestExecutor executor = new RequestExecutor(config, new JdkHttpTransport(), loop);
 * executor.get("/api/v1/tasks/" + id)
 *     .thenAccept(task -> System.out.println(task.path("status").asText()));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Methods may be called from any thread. Each call's state lives on the event loop.
 */
public final class RequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(RequestExecutor.class.getName());

    private final ClientConfig config;
    private final HttpTransport transport;
    private final EventLoop loop;
    private final RetryPolicy retryPolicy;

    /**
     * Creates an executor.
     *
     * @param config the client configuration
     * @param transport the transport used for every attempt
     * @param loop the loop running retry timers and callbacks
     */
    public RequestExecutor(ClientConfig config, HttpTransport transport, EventLoop loop) {
        this(config, transport, loop, config.retryPolicy());
    }

    /**
     * Creates an executor with an explicit retry policy.
     *
     * @param config the client configuration
     * @param transport the transport used for every attempt
     * @param loop the loop running retry timers and callbacks
     * @param retryPolicy the policy, overriding the one derived from {@code config}
     */
    public RequestExecutor(
            ClientConfig config, HttpTransport transport, EventLoop loop, RetryPolicy retryPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Performs one logical call.
     *
     * @param method the HTTP verb
     * @param path the path below the base address, e.g. {@code /api/v1/tasks}
     * @param body the value serialized as the JSON body, or null for none
     * @param options per-call overrides, or null
     * @return a future completed with the payload or a {@link ConduitException}; a path or body
     *     that cannot be turned into a request fails with a {@link ValidationException}
     */
    public CompletableFuture<JsonNode> execute(
            String method, String path, Object body, RequestOptions options) {
        RequestOptions effective = options != null ? options : RequestOptions.DEFAULT;
        Call call;
        try {
            call = new Call(method, path, body != null ? Json.write(body) : null, effective);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new ValidationException("Invalid request " + method + " " + path, e));
        }
        loop.execute(call::start);
        return call.result;
    }

    public CompletableFuture<JsonNode> get(String path) {
        return execute("GET", path, null, null);
    }

    public CompletableFuture<JsonNode> get(String path, RequestOptions options) {
        return execute("GET", path, null, options);
    }

    public CompletableFuture<JsonNode> post(String path, Object body) {
        return execute("POST", path, body, null);
    }

    public CompletableFuture<JsonNode> post(String path, Object body, RequestOptions options) {
        return execute("POST", path, body, options);
    }

    public CompletableFuture<JsonNode> put(String path, Object body, RequestOptions options) {
        return execute("PUT", path, body, options);
    }

    public CompletableFuture<JsonNode> patch(String path, Object body, RequestOptions options) {
        return execute("PATCH", path, body, options);
    }

    public CompletableFuture<JsonNode> delete(String path, RequestOptions options) {
        return execute("DELETE", path, null, options);
    }

    /**
     * Builds the headers of every attempt.
     *
     * <p>Order of application, later wins: JSON content negotiation, bearer credential, configured
     * headers, per-call headers. Names compare case-insensitively.
     */
    Map<String, String> headersFor(RequestOptions options) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        String apiKey = config.apiKey();
        if (apiKey != null && !apiKey.isEmpty()) {
            headers.put("Authorization", "Bearer " + apiKey);
        }
        headers.putAll(config.headers());
        headers.putAll(options.headers());
        return headers;
    }

    /** State of one logical call. Confined to the event loop. */
    private final class Call {
        private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
        private final String method;
        private final String path;
        private final HttpCall template;
        private final CancellationToken token;
        private final RetryContext context;

        private Cancellable backoff = Cancellable.NOOP;
        private Cancellable cancelHook = Cancellable.NOOP;
        private CompletableFuture<HttpResult> inFlight;

        Call(String method, String path, String body, RequestOptions options) {
            this.method = method.toUpperCase(Locale.ROOT);
            this.path = path.startsWith("/") ? path : "/" + path;
            Duration timeout = options.timeout() != null ? options.timeout() : config.timeout();
            this.template =
                    new HttpCall(
                            this.method,
                            URI.create(config.baseUrl() + this.path),
                            headersFor(options),
                            body,
                            timeout);
            this.token = options.cancellationToken();
            this.context =
                    new RetryContext(
                            this.method + " " + this.path,
                            retryPolicy.getMaxAttempts(),
                            loop.currentTimeMillis());
        }

        void start() {
            if (token != null) {
                cancelHook = token.onCancel(() -> loop.execute(this::cancelled));
            }
            attempt();
        }

        private void attempt() {
            if (result.isDone()) {
                return;
            }
            if (token != null && token.isCancelled()) {
                cancelled();
                return;
            }
            int attempt = context.startAttempt();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(
                        context.getOperationId()
                                + " attempt "
                                + attempt
                                + "/"
                                + context.getMaxAttempts());
            }
            CompletableFuture<HttpResult> sent = send();
            inFlight = sent;
            sent.whenComplete(
                    (response, error) -> loop.execute(() -> completed(sent, response, error)));
        }

        private CompletableFuture<HttpResult> send() {
            try {
                return transport.send(template);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void completed(
                CompletableFuture<HttpResult> sent, HttpResult response, Throwable error) {
            if (result.isDone() || sent != inFlight) {
                return;
            }
            inFlight = null;
            if (error != null) {
                failed(ErrorClassifier.classifyTransportFailure(error, template.timeout()));
                return;
            }
            if (!response.isSuccess()) {
                failed(classify(response));
                return;
            }
            JsonNode node;
            try {
                node =
                        response.body().isBlank()
                                ? NullNode.getInstance()
                                : Json.read(response.body());
            } catch (JsonProcessingException e) {
                failed(
                        new ServerException(
                                response.status(),
                                "INVALID_RESPONSE",
                                "Malformed response body: " + e.getOriginalMessage(),
                                method,
                                template.uri().toString(),
                                response.body(),
                                null));
                return;
            }
            if (node.path("success").isBoolean() && !node.path("success").asBoolean()) {
                failed(classify(response));
                return;
            }
            succeed(unwrapEnvelope(node));
        }

        private ConduitException classify(HttpResult response) {
            return ErrorClassifier.classify(
                    response.status(),
                    response.body(),
                    method,
                    template.uri().toString(),
                    template.timeout());
        }

        private void failed(ConduitException error) {
            context.recordFailure(error);
            if (!error.isRetryable()) {
                fail(error);
                return;
            }
            if (token != null && token.isCancelled()) {
                cancelled();
                return;
            }
            if (!retryPolicy.shouldRetry(context)) {
                LOGGER.warning(
                        context.getOperationId()
                                + " failed after "
                                + context.getAttemptCount()
                                + " attempts: "
                                + error.getMessage());
                fail(new MaxRetriesExceededException(context.getAttemptCount(), error));
                return;
            }
            long delay = retryPolicy.calculateDelay(context);
            context.recordDelay(delay);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(
                        "Retrying "
                                + context.getOperationId()
                                + " in "
                                + delay
                                + "ms after "
                                + error.kind()
                                + ": "
                                + error.getMessage());
            }
            backoff = loop.schedule(this::attempt, Duration.ofMillis(delay));
        }

        private void cancelled() {
            if (result.isDone()) {
                return;
            }
            backoff.cancel();
            CompletableFuture<HttpResult> sent = inFlight;
            inFlight = null;
            if (sent != null) {
                sent.cancel(true);
            }
            fail(new RequestCancelledException(context.getAttemptCount(), context.getLastError()));
        }

        private void succeed(JsonNode payload) {
            cancelHook.cancel();
            result.complete(payload);
        }

        private void fail(ConduitException error) {
            cancelHook.cancel();
            backoff.cancel();
            result.completeExceptionally(error);
        }
    }

    /**
     * Extracts the payload of a success envelope.
     *
     * @param node the parsed body
     * @return {@code data} of an envelope, the body itself when it is not an envelope
     */
    static JsonNode unwrapEnvelope(JsonNode node) {
        if (node.isObject() && (node.has("success") || node.has("data"))) {
            JsonNode data = node.get("data");
            return data != null ? data : NullNode.getInstance();
        }
        return node;
    }
}
