package express.mvp.conduit.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.conduit.ConduitException;
import express.mvp.conduit.config.ClientConfig;
import express.mvp.conduit.error.ConduitTimeoutException;
import express.mvp.conduit.http.HttpTransport;
import express.mvp.conduit.http.JdkHttpTransport;
import express.mvp.conduit.http.RequestExecutor;
import express.mvp.conduit.http.RequestOptions;
import express.mvp.conduit.json.Json;
import express.mvp.conduit.loop.EventLoop;
import express.mvp.conduit.loop.SingleThreadEventLoop;
import express.mvp.conduit.stream.EventEnvelope;
import express.mvp.conduit.stream.EventStreamClient;
import express.mvp.conduit.stream.EventType;
import express.mvp.conduit.stream.NettyStreamTransport;
import express.mvp.conduit.stream.StreamTransport;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client for the orchestration service: tasks, agents, DAGs and approvals.
 *
 * <p>Every call goes through a {@link RequestExecutor}, so transient failures are retried with
 * backoff and failures complete the returned future with a {@link ConduitException}. Resource
 * shapes are not modelled; payloads are returned as {@link JsonNode} and request bodies may be any
 * value Jackson can serialize.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (OrchestratorClient client = new OrchestratorClient(
 *         ClientConfig.builder().baseUrl("http://localhost:8080").apiKey(key).build())) {
 *     JsonNode task = client.runTask(Map.of("name", "Long job"), WaitOptions.DEFAULT).join();
 * }
 * }</pre>
 *
 * <h2>Resource Ownership</h2>
 *
 * <p>A client built from a {@link ClientConfig} alone owns its event loop and transports and
 * releases them in {@link #close()}. Injected collaborators stay owned by the caller.
 */
public final class OrchestratorClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(OrchestratorClient.class.getName());

    static final String TASKS = "/api/v1/tasks";
    static final String AGENTS = "/api/v1/agents";
    static final String DAGS = "/api/v1/dags";
    static final String APPROVALS = "/api/v1/approvals";

    static final Duration TASK_POLL_INTERVAL = Duration.ofSeconds(2);
    static final Duration TASK_TIMEOUT = Duration.ofMinutes(5);
    static final Duration DAG_POLL_INTERVAL = Duration.ofSeconds(5);
    static final Duration DAG_TIMEOUT = Duration.ofMinutes(10);

    private final ClientConfig config;
    private final EventLoop loop;
    private final RequestExecutor executor;
    private final boolean ownsResources;

    private StreamTransport streamTransport;
    private EventStreamClient eventStream;

    /**
     * Creates a client with its own event loop, HTTP client and, on first use, WebSocket transport.
     *
     * @param config the client configuration
     */
    public OrchestratorClient(ClientConfig config) {
        this(
                config,
                new JdkHttpTransport(),
                new SingleThreadEventLoop("conduit-client"),
                null,
                true);
    }

    /**
     * Creates a client on injected collaborators, none of which is closed by {@link #close()}.
     *
     * @param config the client configuration
     * @param httpTransport sends HTTP calls
     * @param loop runs retries, polling and the event stream
     * @param streamTransport opens event-stream connections
     */
    public OrchestratorClient(
            ClientConfig config,
            HttpTransport httpTransport,
            EventLoop loop,
            StreamTransport streamTransport) {
        this(
                config,
                httpTransport,
                loop,
                Objects.requireNonNull(streamTransport, "streamTransport"),
                false);
    }

    private OrchestratorClient(
            ClientConfig config,
            HttpTransport httpTransport,
            EventLoop loop,
            StreamTransport streamTransport,
            boolean ownsResources) {
        this.config = Objects.requireNonNull(config, "config");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.executor = new RequestExecutor(config, httpTransport, loop);
        this.streamTransport = streamTransport;
        this.ownsResources = ownsResources;
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Returns the executor behind this client, for endpoints without a dedicated method.
     *
     * @return the executor
     */
    public RequestExecutor executor() {
        return executor;
    }

    // ---- health ----

    public CompletableFuture<JsonNode> healthCheck() {
        return executor.get("/health");
    }

    // ---- tasks ----

    /**
     * Lists tasks.
     *
     * @param filter query parameters such as {@code status}, {@code priority}, {@code tags}, {@code
     *     page}, {@code limit}; may be null
     * @return a page of tasks
     */
    public CompletableFuture<JsonNode> listTasks(Map<String, ?> filter) {
        return executor.get(TASKS + QueryParams.of(filter));
    }

    public CompletableFuture<JsonNode> getTask(String taskId) {
        return executor.get(task(taskId));
    }

    public CompletableFuture<JsonNode> getTask(String taskId, RequestOptions options) {
        return executor.get(task(taskId), options);
    }

    public CompletableFuture<JsonNode> createTask(Object task) {
        return executor.post(TASKS, task);
    }

    public CompletableFuture<JsonNode> updateTask(String taskId, Object updates) {
        return executor.patch(task(taskId), updates, null);
    }

    public CompletableFuture<JsonNode> deleteTask(String taskId) {
        return executor.delete(task(taskId), null);
    }

    public CompletableFuture<JsonNode> cancelTask(String taskId) {
        return executor.post(task(taskId) + "/cancel", null);
    }

    public CompletableFuture<JsonNode> retryTask(String taskId) {
        return executor.post(task(taskId) + "/retry", null);
    }

    public CompletableFuture<JsonNode> pauseTask(String taskId) {
        return executor.post(task(taskId) + "/pause", null);
    }

    public CompletableFuture<JsonNode> resumeTask(String taskId) {
        return executor.post(task(taskId) + "/resume", null);
    }

    public CompletableFuture<JsonNode> getTaskLogs(String taskId, Map<String, ?> params) {
        return executor.get(task(taskId) + "/logs" + QueryParams.of(params));
    }

    public CompletableFuture<JsonNode> getChildTasks(String taskId, Map<String, ?> params) {
        return executor.get(task(taskId) + "/children" + QueryParams.of(params));
    }

    // ---- agents ----

    public CompletableFuture<JsonNode> listAgents(Map<String, ?> filter) {
        return executor.get(AGENTS + QueryParams.of(filter));
    }

    public CompletableFuture<JsonNode> getAgent(String agentId) {
        return executor.get(agent(agentId));
    }

    public CompletableFuture<JsonNode> createAgent(Object agent) {
        return executor.post(AGENTS, agent);
    }

    public CompletableFuture<JsonNode> updateAgent(String agentId, Object updates) {
        return executor.patch(agent(agentId), updates, null);
    }

    public CompletableFuture<JsonNode> deleteAgent(String agentId) {
        return executor.delete(agent(agentId), null);
    }

    public CompletableFuture<JsonNode> getAgentTasks(String agentId, Map<String, ?> params) {
        return executor.get(agent(agentId) + "/tasks" + QueryParams.of(params));
    }

    public CompletableFuture<JsonNode> assignTask(String agentId, String taskId) {
        return executor.post(agent(agentId) + "/assign", Map.of("taskId", taskId));
    }

    public CompletableFuture<JsonNode> unassignTask(String agentId, String taskId) {
        return executor.post(agent(agentId) + "/unassign", Map.of("taskId", taskId));
    }

    // ---- DAGs ----

    public CompletableFuture<JsonNode> listDags(Map<String, ?> filter) {
        return executor.get(DAGS + QueryParams.of(filter));
    }

    public CompletableFuture<JsonNode> getDag(String dagId) {
        return executor.get(dag(dagId));
    }

    public CompletableFuture<JsonNode> createDag(Object dag) {
        return executor.post(DAGS, dag);
    }

    public CompletableFuture<JsonNode> updateDag(String dagId, Object updates) {
        return executor.patch(dag(dagId), updates, null);
    }

    public CompletableFuture<JsonNode> deleteDag(String dagId) {
        return executor.delete(dag(dagId), null);
    }

    /**
     * Starts an execution of a DAG.
     *
     * @param dagId the DAG id
     * @param input initial input of the root nodes, or null
     * @return the new execution
     */
    public CompletableFuture<JsonNode> startDag(String dagId, Object input) {
        ObjectNode body = Json.object();
        if (input != null) {
            body.set("input", Json.mapper().valueToTree(input));
        }
        return executor.post(dag(dagId) + "/start", body);
    }

    public CompletableFuture<JsonNode> stopDag(String dagId) {
        return executor.post(dag(dagId) + "/stop", null);
    }

    public CompletableFuture<JsonNode> pauseDag(String dagId) {
        return executor.post(dag(dagId) + "/pause", null);
    }

    public CompletableFuture<JsonNode> resumeDag(String dagId) {
        return executor.post(dag(dagId) + "/resume", null);
    }

    public CompletableFuture<JsonNode> getDagExecutions(String dagId, Map<String, ?> params) {
        return executor.get(dag(dagId) + "/executions" + QueryParams.of(params));
    }

    public CompletableFuture<JsonNode> getDagExecution(String dagId, String executionId) {
        return executor.get(dag(dagId) + "/executions/" + QueryParams.encode(executionId));
    }

    // ---- approvals ----

    public CompletableFuture<JsonNode> listApprovals(Map<String, ?> filter) {
        return executor.get(APPROVALS + QueryParams.of(filter));
    }

    public CompletableFuture<JsonNode> getApproval(String approvalId) {
        return executor.get(approval(approvalId));
    }

    public CompletableFuture<JsonNode> createApproval(Object approval) {
        return executor.post(APPROVALS, approval);
    }

    /**
     * Answers an approval request.
     *
     * @param approvalId the approval id
     * @param response the decision, e.g. {@code {"approved": true, "comment": "..."}}
     * @return the updated approval
     */
    public CompletableFuture<JsonNode> respondToApproval(String approvalId, Object response) {
        return executor.post(approval(approvalId) + "/respond", response);
    }

    public CompletableFuture<JsonNode> cancelApproval(String approvalId) {
        return executor.post(approval(approvalId) + "/cancel", null);
    }

    public CompletableFuture<JsonNode> getPendingApprovals(String approverId) {
        return executor.get(
                APPROVALS + "/pending" + QueryParams.of(Map.of("approverId", approverId)));
    }

    // ---- event stream ----

    /**
     * Returns the shared event-stream client, creating it on first use. Not connected yet.
     *
     * @return the event stream
     */
    public synchronized EventStreamClient eventStream() {
        if (eventStream == null) {
            if (streamTransport == null) {
                streamTransport = new NettyStreamTransport(config.stream().connectTimeout());
            }
            eventStream = new EventStreamClient(config.stream(), streamTransport, loop);
        }
        return eventStream;
    }

    /**
     * Connects the shared event stream.
     *
     * @return the connected stream
     */
    public CompletableFuture<EventStreamClient> connectEventStream() {
        EventStreamClient stream = eventStream();
        return stream.connect().thenApply(ignored -> stream);
    }

    /** Disconnects and discards the shared event stream. A later call creates a fresh one. */
    public synchronized void disconnectEventStream() {
        if (eventStream != null) {
            eventStream.close();
            eventStream = null;
        }
    }

    // ---- waiting ----

    /**
     * Waits until a task reaches {@code completed}.
     *
     * <p>Polls every 2s for at most 5 minutes unless {@code options} says otherwise. With {@link
     * WaitOptions#useEventStream()}, subscribes to the task and waits for its completion event; if
     * that times out, the task is fetched once so a failure is reported as such.
     *
     * @param taskId the task id
     * @param options polling and timeout settings
     * @return the completed task, or a failure with {@link ExecutionFailedException} or {@link
     *     ConduitTimeoutException}
     */
    public CompletableFuture<JsonNode> waitForTask(String taskId, WaitOptions options) {
        WaitOptions effective = options != null ? options : WaitOptions.DEFAULT;
        Duration timeout = effective.timeoutOr(TASK_TIMEOUT);
        if (effective.useEventStream()) {
            return waitForTaskEvent(taskId, timeout);
        }
        return poll(
                () -> getTask(taskId),
                task -> taskOutcome(taskId, task),
                effective.pollIntervalOr(TASK_POLL_INTERVAL),
                timeout,
                "Timeout waiting for task " + taskId);
    }

    /**
     * Waits until a DAG execution reaches {@code completed}, polling every 5s for at most 10
     * minutes unless {@code options} says otherwise.
     *
     * @param dagId the DAG id
     * @param executionId the execution id
     * @param options polling and timeout settings
     * @return the completed execution
     */
    public CompletableFuture<JsonNode> waitForDag(
            String dagId, String executionId, WaitOptions options) {
        WaitOptions effective = options != null ? options : WaitOptions.DEFAULT;
        return poll(
                () -> getDagExecution(dagId, executionId),
                execution -> {
                    String status = execution.path("status").asText();
                    if ("completed".equals(status)) {
                        return true;
                    }
                    if ("failed".equals(status)) {
                        throw new ExecutionFailedException(
                                executionId,
                                status,
                                "DAG "
                                        + dagId
                                        + " execution "
                                        + executionId
                                        + " failed: "
                                        + remoteMessage(execution));
                    }
                    return false;
                },
                effective.pollIntervalOr(DAG_POLL_INTERVAL),
                effective.timeoutOr(DAG_TIMEOUT),
                "Timeout waiting for DAG " + dagId + " execution " + executionId);
    }

    /**
     * Creates a task and waits for it to complete.
     *
     * @param task the task to create
     * @param options wait settings
     * @return the completed task
     */
    public CompletableFuture<JsonNode> runTask(Object task, WaitOptions options) {
        return createTask(task)
                .thenCompose(created -> waitForTask(created.path("id").asText(), options));
    }

    /**
     * Starts a DAG and waits for the execution to complete.
     *
     * @param dagId the DAG id
     * @param input initial input, or null
     * @param options wait settings
     * @return the completed execution
     */
    public CompletableFuture<JsonNode> runDag(String dagId, Object input, WaitOptions options) {
        return startDag(dagId, input)
                .thenCompose(
                        execution -> waitForDag(dagId, execution.path("id").asText(), options));
    }

    private CompletableFuture<JsonNode> waitForTaskEvent(String taskId, Duration timeout) {
        return connectEventStream()
                .thenCompose(
                        stream -> {
                            String subscriptionId = stream.subscribeToTask(taskId);
                            return stream.waitFor(
                                            EventType.TASK_COMPLETED,
                                            payload -> isTask(payload, taskId),
                                            timeout)
                                    .whenComplete(
                                            (envelope, error) ->
                                                    stream.unsubscribe(subscriptionId));
                        })
                .thenApply(EventEnvelope::payload)
                .exceptionallyCompose(
                        error -> {
                            ConduitException cause = ConduitException.unwrap(error);
                            if (!(cause instanceof ConduitTimeoutException)) {
                                return CompletableFuture.failedFuture(cause);
                            }
                            return getTask(taskId)
                                    .thenApply(
                                            task -> {
                                                String status = task.path("status").asText();
                                                if ("failed".equals(status)) {
                                                    throw new ExecutionFailedException(
                                                            taskId,
                                                            "failed",
                                                            "Task "
                                                                    + taskId
                                                                    + " failed: "
                                                                    + remoteMessage(task));
                                                }
                                                throw cause;
                                            });
                        });
    }

    private static boolean isTask(JsonNode payload, String taskId) {
        return taskId.equals(Json.text(payload, "id"))
                || taskId.equals(Json.text(payload, "taskId"));
    }

    private static boolean taskOutcome(String taskId, JsonNode task) {
        String status = task.path("status").asText();
        return switch (status) {
            case "completed" -> true;
            case "failed", "cancelled" -> throw new ExecutionFailedException(
                    taskId, status, "Task " + taskId + " " + status + ": " + remoteMessage(task));
            default -> false;
        };
    }

    private static String remoteMessage(JsonNode resource) {
        String message = Json.text(resource.path("error"), "message");
        return message != null ? message : "Unknown error";
    }

    /**
     * Polls until {@code outcome} returns true, throws, or the timeout passes. Sleeps are loop
     * timers.
     */
    private CompletableFuture<JsonNode> poll(
            Supplier<CompletableFuture<JsonNode>> fetch,
            Predicate<JsonNode> outcome,
            Duration interval,
            Duration timeout,
            String timeoutMessage) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        loop.execute(
                () -> {
                    long deadline = loop.currentTimeMillis() + timeout.toMillis();
                    new Poller(fetch, outcome, interval, timeout, deadline, timeoutMessage, result)
                            .run();
                });
        return result;
    }

    /** One polling loop. Confined to the event loop. */
    private final class Poller implements Runnable {
        private final Supplier<CompletableFuture<JsonNode>> fetch;
        private final Predicate<JsonNode> outcome;
        private final Duration interval;
        private final Duration timeout;
        private final long deadline;
        private final String timeoutMessage;
        private final CompletableFuture<JsonNode> result;

        Poller(
                Supplier<CompletableFuture<JsonNode>> fetch,
                Predicate<JsonNode> outcome,
                Duration interval,
                Duration timeout,
                long deadline,
                String timeoutMessage,
                CompletableFuture<JsonNode> result) {
            this.fetch = fetch;
            this.outcome = outcome;
            this.interval = interval;
            this.timeout = timeout;
            this.deadline = deadline;
            this.timeoutMessage = timeoutMessage;
            this.result = result;
        }

        @Override
        public void run() {
            if (result.isDone()) {
                return;
            }
            if (loop.currentTimeMillis() >= deadline) {
                result.completeExceptionally(new ConduitTimeoutException(timeoutMessage, timeout));
                return;
            }
            fetch.get()
                    .whenComplete(
                            (resource, error) -> loop.execute(() -> fetched(resource, error)));
        }

        private void fetched(JsonNode resource, Throwable error) {
            if (error != null) {
                result.completeExceptionally(ConduitException.unwrap(error));
                return;
            }
            boolean done;
            try {
                done = outcome.test(resource);
            } catch (ConduitException e) {
                result.completeExceptionally(e);
                return;
            }
            if (done) {
                result.complete(resource);
                return;
            }
            LOGGER.fine(() -> "Still waiting: " + resource.path("status").asText());
            loop.schedule(this, interval);
        }
    }

    /** Closes the event stream and, when owned, the event loop. */
    @Override
    public void close() {
        disconnectEventStream();
        if (ownsResources) {
            if (streamTransport != null) {
                streamTransport.close();
            }
            loop.close();
            LOGGER.log(Level.FINE, "Closed client for {0}", config.baseUrl());
        }
    }

    private static String task(String taskId) {
        return TASKS + "/" + QueryParams.encode(taskId);
    }

    private static String agent(String agentId) {
        return AGENTS + "/" + QueryParams.encode(agentId);
    }

    private static String dag(String dagId) {
        return DAGS + "/" + QueryParams.encode(dagId);
    }

    private static String approval(String approvalId) {
        return APPROVALS + "/" + QueryParams.encode(approvalId);
    }
}
