package express.mvp.conduit.stream;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.conduit.config.StreamConfig;
import express.mvp.conduit.error.ConnectionException;
import express.mvp.conduit.lifecycle.ConnectionState;
import express.mvp.conduit.lifecycle.ConnectionStateListener;
import express.mvp.conduit.loop.EventLoop;
import express.mvp.conduit.loop.SingleThreadEventLoop;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event-stream client: one resilient connection, its subscriptions, and event dispatch.
 *
 * <p>Subscriptions may be made before {@link #connect()}; they are sent once the connection opens
 * and again after every reconnect. Listeners and waits survive reconnects too.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (EventStreamClient stream = EventStreamClient.create(config)) {
 *     stream.subscribeToTask("t-1");
 *     stream.connect().join();
 *     EventEnvelope done = stream.waitFor(EventType.TASK_COMPLETED,
 *             payload -> "t-1".equals(payload.path("taskId").asText()),
 *             Duration.ofMinutes(5)).join();
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 *
 * <p>Stream errors never surface as exceptions from this class. They are delivered to {@link
 * #addErrorListener error listeners}, or logged when none is registered.
 */
public final class EventStreamClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(EventStreamClient.class.getName());

    private static final long CLOSE_WAIT_SECONDS = 5;

    private final StreamConfig config;
    private final EventLoop loop;
    private final StreamTransport transport;
    private final boolean ownsResources;
    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
    private final ConnectionManager connection;
    private final EventDispatcher dispatcher;
    private final List<StreamErrorListener> errorListeners = new CopyOnWriteArrayList<>();
    private final Map<String, ListenerRegistration> subscriptionListeners =
            new ConcurrentHashMap<>();

    /**
     * Creates a client on an existing loop and transport. Neither is closed by {@link #close()}.
     *
     * @param config the stream configuration
     * @param transport opens sessions
     * @param loop runs all connection state and dispatch
     */
    public EventStreamClient(StreamConfig config, StreamTransport transport, EventLoop loop) {
        this(config, transport, loop, false);
    }

    private EventStreamClient(
            StreamConfig config, StreamTransport transport, EventLoop loop, boolean ownsResources) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.ownsResources = ownsResources;
        this.connection = new ConnectionManager(config, transport, loop, subscriptions);
        this.dispatcher =
                new EventDispatcher(
                        loop,
                        config.malformedFramePolicy(),
                        connection::updateConnectionId,
                        this::reportError);
        connection.setFrameHandler(dispatcher::dispatch);
        connection.addObserver(
                new ConnectionObserver() {
                    @Override
                    public void onError(ConnectionException error) {
                        reportError(error);
                    }
                });
    }

    /**
     * Creates a client with its own event loop and Netty transport, both released by {@link
     * #close()}.
     *
     * @param config the stream configuration
     * @return the client, not yet connected
     */
    public static EventStreamClient create(StreamConfig config) {
        return new EventStreamClient(
                config,
                new NettyStreamTransport(config.connectTimeout()),
                new SingleThreadEventLoop("conduit-stream"),
                true);
    }

    public StreamConfig config() {
        return config;
    }

    // ---- connection ----

    /**
     * Connects, or joins the attempt already in progress.
     *
     * @return a future completed once connected and subscriptions have been replayed
     */
    public CompletableFuture<Void> connect() {
        return connection.connect();
    }

    /**
     * Disconnects with a normal close. No reconnect follows.
     *
     * @return a future completed once disconnected
     */
    public CompletableFuture<Void> disconnect() {
        return connection.disconnect();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public ConnectionState state() {
        return connection.getState();
    }

    /**
     * Returns the id the server assigned to this connection.
     *
     * @return the id from the latest heartbeat, or null
     */
    public String connectionId() {
        return connection.connectionId();
    }

    // ---- subscriptions ----

    /**
     * Subscribes to events. Sent now if connected, otherwise on the next connect.
     *
     * @param spec what to subscribe to
     * @return the subscription id
     */
    public String subscribe(SubscriptionSpec spec) {
        return subscriptions.subscribe(spec);
    }

    /**
     * Subscribes and registers a listener that sees only envelopes the subscription selects,
     * payload filter included. {@link #unsubscribe(String)} removes both.
     *
     * @param spec what to subscribe to
     * @param listener the listener
     * @return the subscription id
     */
    public String subscribe(SubscriptionSpec spec, EventListener listener) {
        ListenerRegistration registration = dispatcher.on(spec, listener);
        String id = subscriptions.subscribe(spec);
        subscriptionListeners.put(id, registration);
        return id;
    }

    /**
     * Removes a subscription and any listener registered with it. Unknown ids are ignored.
     *
     * @param id the subscription id
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String id) {
        ListenerRegistration registration = subscriptionListeners.remove(id);
        if (registration != null) {
            registration.remove();
        }
        return subscriptions.unsubscribe(id);
    }

    public List<Subscription> subscriptions() {
        return subscriptions.subscriptions();
    }

    /**
     * Subscribes to updates, completion, failure and log lines of one task.
     *
     * @param taskId the task id
     * @return the subscription id
     */
    public String subscribeToTask(String taskId) {
        return subscribe(
                SubscriptionSpec.of(
                                EventType.TASK_UPDATED,
                                EventType.TASK_COMPLETED,
                                EventType.TASK_FAILED,
                                EventType.LOG_MESSAGE)
                        .withFilter("taskId", taskId));
    }

    public String subscribeToAgent(String agentId) {
        return subscribe(
                SubscriptionSpec.of(EventType.AGENT_STATUS_CHANGED).withFilter("agentId", agentId));
    }

    public String subscribeToDag(String dagId) {
        return subscribe(
                SubscriptionSpec.of(
                                EventType.DAG_STARTED, EventType.DAG_COMPLETED, EventType.DAG_FAILED)
                        .withFilter("dagId", dagId));
    }

    public String subscribeToApprovals() {
        return subscribe(
                SubscriptionSpec.of(EventType.APPROVAL_REQUIRED, EventType.APPROVAL_RESOLVED));
    }

    // ---- listeners ----

    public ListenerRegistration on(EventType type, EventListener listener) {
        return dispatcher.on(type, listener);
    }

    public ListenerRegistration on(String type, EventListener listener) {
        return dispatcher.on(type, listener);
    }

    /**
     * Adds a listener for every envelope, heartbeats included.
     *
     * @param listener the listener
     * @return the registration
     */
    public ListenerRegistration onAny(EventListener listener) {
        return dispatcher.addListener(listener);
    }

    /**
     * Waits for the next envelope of a type whose payload satisfies a predicate.
     *
     * @param type the type
     * @param predicate tested against the payload, or null for any
     * @param timeout how long to wait; null waits until match or {@link #close()}
     * @return the matching envelope, or a failure with a timeout or connection error
     * @see EventDispatcher#waitFor(String, Predicate, Duration)
     */
    public CompletableFuture<EventEnvelope> waitFor(
            EventType type, Predicate<JsonNode> predicate, Duration timeout) {
        return dispatcher.waitFor(type, predicate, timeout);
    }

    public CompletableFuture<EventEnvelope> waitFor(
            String type, Predicate<JsonNode> predicate, Duration timeout) {
        return dispatcher.waitFor(type, predicate, timeout);
    }

    public ListenerRegistration addErrorListener(StreamErrorListener listener) {
        errorListeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> errorListeners.remove(listener);
    }

    public void addStateListener(ConnectionStateListener listener) {
        connection.stateMachine().addListener(listener);
    }

    public ListenerRegistration addConnectionObserver(ConnectionObserver observer) {
        return connection.addObserver(observer);
    }

    /**
     * Notifies on every scheduled reconnect attempt.
     *
     * @param listener receives the attempt number
     * @return the registration
     */
    public ListenerRegistration onReconnecting(IntConsumer listener) {
        Objects.requireNonNull(listener, "listener");
        return connection.addObserver(
                new ConnectionObserver() {
                    @Override
                    public void onReconnecting(int attempt, long delayMillis) {
                        listener.accept(attempt);
                    }
                });
    }

    public ListenerRegistration onReconnected(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        return connection.addObserver(
                new ConnectionObserver() {
                    @Override
                    public void onReconnected() {
                        listener.run();
                    }
                });
    }

    /**
     * Notifies on every close, intentional or not.
     *
     * @param listener receives the close code and reason
     * @return the registration
     */
    public ListenerRegistration onClose(CloseListener listener) {
        Objects.requireNonNull(listener, "listener");
        return connection.addObserver(
                new ConnectionObserver() {
                    @Override
                    public void onClosed(int code, String reason) {
                        listener.onClose(code, reason);
                    }
                });
    }

    private void reportError(ConnectionException error) {
        if (errorListeners.isEmpty()) {
            LOGGER.log(Level.WARNING, "Event stream error: " + error.getMessage(), error.getCause());
            return;
        }
        for (StreamErrorListener listener : errorListeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Error listener failed", e);
            }
        }
    }

    /**
     * Disconnects, fails outstanding waits, and releases the loop and transport if this client
     * created them.
     */
    @Override
    public void close() {
        CompletableFuture<Void> closing = connection.disconnect();
        dispatcher.shutdown();
        if (!loop.inEventLoop()) {
            try {
                closing.get(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.log(Level.WARNING, "Interrupted while closing event stream", e);
            } catch (ExecutionException | TimeoutException e) {
                LOGGER.log(Level.WARNING, "Event stream did not close cleanly", e);
            }
        }
        if (ownsResources) {
            transport.close();
            loop.close();
        }
    }

    /** Receives close notifications. */
    @FunctionalInterface
    public interface CloseListener {

        /**
         * Called after the connection closed.
         *
         * @param code the close code
         * @param reason the close reason
         */
        void onClose(int code, String reason);
    }
}
