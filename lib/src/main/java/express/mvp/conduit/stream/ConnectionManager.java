package express.mvp.conduit.stream;

import express.mvp.conduit.config.StreamConfig;
import express.mvp.conduit.error.ConnectionException;
import express.mvp.conduit.error.RetryContext;
import express.mvp.conduit.error.RetryPolicy;
import express.mvp.conduit.lifecycle.ConnectionState;
import express.mvp.conduit.lifecycle.ConnectionStateMachine;
import express.mvp.conduit.loop.Cancellable;
import express.mvp.conduit.loop.EventLoop;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the lifecycle of one event-stream connection: connect, heartbeat, reconnect with backoff,
 * and clean close.
 *
 * <h2>Connect</h2>
 *
 * <p>{@link #connect()} opens a session through the {@link StreamTransport}. When the session
 * opens, in this order: the reconnect counter is reset, every registered subscription is replayed,
 * the heartbeat starts, the state becomes {@link ConnectionState#CONNECTED}, and pending connect
 * futures complete. A caller observing {@code CONNECTED} therefore never races the replay. If the
 * caller's own connect fails, the state returns to {@link ConnectionState#DISCONNECTED} and the
 * future fails; no automatic reconnect follows.
 *
 * <h2>Reconnect</h2>
 *
 * <p>An unexpected close or a heartbeat timeout moves a connected session to {@link
 * ConnectionState#RECONNECTING} when auto-reconnect is enabled. Attempt <i>n</i> starts after
 * {@code min(reconnectInterval * 2^(n-1) + jitter, 30s)}. After {@code maxReconnectAttempts}
 * consecutive failures the manager reports {@link ConnectionException.Reason#RECONNECT_EXHAUSTED}
 * once and stays disconnected until {@link #connect()} is called again.
 *
 * <h2>Stale sessions</h2>
 *
 * <p>Every session is tagged with a generation number. Callbacks of a session from an earlier
 * generation are ignored, and a session that opens after being superseded is closed at once, so
 * at most one session ever delivers frames.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Public methods may be called from any thread; all state changes run on the event loop.
 */
public final class ConnectionManager {

    private static final Logger LOGGER = Logger.getLogger(ConnectionManager.class.getName());

    /** Close code used when the heartbeat deadline passes. */
    public static final int HEARTBEAT_TIMEOUT_CODE = 4000;

    static final String HEARTBEAT_TIMEOUT_REASON = "Heartbeat timeout";
    static final String DISCONNECT_REASON = "Client disconnecting";

    private final StreamConfig config;
    private final StreamTransport transport;
    private final EventLoop loop;
    private final RetryPolicy reconnectPolicy;
    private final SubscriptionRegistry subscriptions;
    private final ConnectionStateMachine state = new ConnectionStateMachine("event-stream");
    private final List<ConnectionObserver> observers = new CopyOnWriteArrayList<>();
    private final Heartbeat heartbeat;
    private final RetryContext reconnects;

    private volatile Consumer<String> frameHandler = frame -> {};
    private volatile String connectionId;

    // Loop-confined state
    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();
    private StreamSession session;
    private long generation;
    private boolean closingIntentionally;
    private boolean automaticAttempt;
    private Cancellable reconnectTimer = Cancellable.NOOP;
    private Cancellable connectTimer = Cancellable.NOOP;

    /**
     * Creates a manager using the reconnect policy of {@code config}.
     *
     * @param config the stream configuration
     * @param transport opens sessions
     * @param loop the loop owning all connection state
     * @param subscriptions the registry replayed on every connect
     */
    public ConnectionManager(
            StreamConfig config,
            StreamTransport transport,
            EventLoop loop,
            SubscriptionRegistry subscriptions) {
        this(config, transport, loop, subscriptions, config.reconnectPolicy());
    }

    /**
     * Creates a manager with an explicit reconnect policy.
     *
     * @param config the stream configuration
     * @param transport opens sessions
     * @param loop the loop owning all connection state
     * @param subscriptions the registry replayed on every connect
     * @param reconnectPolicy supplies reconnect delays
     */
    public ConnectionManager(
            StreamConfig config,
            StreamTransport transport,
            EventLoop loop,
            SubscriptionRegistry subscriptions,
            RetryPolicy reconnectPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.reconnects =
                new RetryContext(
                        "reconnect " + config.url(),
                        config.maxReconnectAttempts(),
                        loop.currentTimeMillis());
        this.heartbeat =
                new Heartbeat(
                        loop,
                        config.heartbeatInterval(),
                        config.heartbeatTimeout(),
                        () -> send(ControlFrames.ping()),
                        this::heartbeatExpired);
    }

    /**
     * Sets the consumer of inbound frames. Called on the loop, in arrival order.
     *
     * @param frameHandler the consumer
     */
    public void setFrameHandler(Consumer<String> frameHandler) {
        this.frameHandler = Objects.requireNonNull(frameHandler, "frameHandler");
    }

    /**
     * Adds a lifecycle observer.
     *
     * @param observer the observer
     * @return the registration
     */
    public ListenerRegistration addObserver(ConnectionObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
        return () -> observers.remove(observer);
    }

    public ConnectionStateMachine stateMachine() {
        return state;
    }

    public ConnectionState getState() {
        return state.getState();
    }

    public boolean isConnected() {
        return state.isActive();
    }

    /**
     * Returns the server-assigned connection id, learned from heartbeat envelopes.
     *
     * @return the id, or null before the first heartbeat and after disconnect
     */
    public String connectionId() {
        return connectionId;
    }

    void updateConnectionId(String connectionId) {
        this.connectionId = connectionId;
    }

    /**
     * Opens the connection.
     *
     * <p>Already connected: completes at once. Attempt in progress or scheduled: joins it.
     *
     * @return a future completed once connected, or failed with a {@link ConnectionException}
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        loop.execute(() -> startConnect(result));
        return result;
    }

    /**
     * Closes the connection with code 1000 and stops any pending reconnect.
     *
     * <p>Pending connect futures fail with {@link ConnectionException.Reason#CLOSED}.
     *
     * @return a future completed once the manager is disconnected
     */
    public CompletableFuture<Void> disconnect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        loop.execute(
                () -> {
                    closeIntentionally();
                    result.complete(null);
                });
        return result;
    }

    /**
     * Sends a frame on the open session. Dropped when not connected.
     *
     * @param frame the frame
     * @return true if the frame was handed to the session
     */
    boolean send(String frame) {
        StreamSession current = session;
        if (current == null || !state.isActive()) {
            LOGGER.fine(() -> "Not connected, dropping frame " + frame);
            return false;
        }
        current.send(frame);
        return true;
    }

    private void startConnect(CompletableFuture<Void> result) {
        ConnectionState current = state.getState();
        switch (current) {
            case CONNECTED -> result.complete(null);
            case CONNECTING, RECONNECTING -> connectWaiters.add(result);
            case DISCONNECTED -> {
                closingIntentionally = false;
                reconnects.reset();
                connectWaiters.add(result);
                automaticAttempt = false;
                openSession();
            }
            default ->
                    result.completeExceptionally(
                            new ConnectionException(
                                    ConnectionException.Reason.CLOSED,
                                    "Connection is " + current,
                                    null));
        }
    }

    private void openSession() {
        if (!state.transitionTo(ConnectionState.CONNECTING)) {
            return;
        }
        long gen = ++generation;
        URI uri;
        CompletableFuture<StreamSession> opening;
        try {
            uri = config.connectUri();
            opening = transport.open(uri, new SessionListener(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        connectTimer =
                loop.schedule(
                        () -> {
                            if (gen == generation
                                    && state.getState() == ConnectionState.CONNECTING) {
                                generation++;
                                attemptFailed(
                                        new ConnectionException(
                                                ConnectionException.Reason.CONNECT_FAILED,
                                                "Connection timed out after "
                                                        + config.connectTimeout().toMillis()
                                                        + "ms",
                                                null));
                            }
                        },
                        config.connectTimeout());
        opening.whenComplete(
                (opened, error) -> loop.execute(() -> sessionOpened(gen, opened, error)));
    }

    private void sessionOpened(long gen, StreamSession opened, Throwable error) {
        if (gen != generation) {
            if (opened != null) {
                LOGGER.fine("Closing superseded session");
                opened.close(StreamSession.NORMAL_CLOSURE, "Superseded");
            }
            return;
        }
        connectTimer.cancel();
        if (error != null) {
            generation++;
            String message = error.getMessage() != null ? error.getMessage() : error.toString();
            attemptFailed(
                    new ConnectionException(
                            ConnectionException.Reason.CONNECT_FAILED,
                            "Failed to connect: " + message,
                            error));
            return;
        }

        session = opened;
        boolean reconnected = automaticAttempt;
        reconnects.reset();
        subscriptions.attach(this::sendRaw);
        heartbeat.start();
        state.transitionTo(ConnectionState.CONNECTED);
        LOGGER.info("Event stream connected to " + config.url());
        completeWaiters();
        if (reconnected) {
            notifyObservers(ConnectionObserver::onReconnected);
        }
    }

    private void sendRaw(String frame) {
        StreamSession current = session;
        if (current != null) {
            current.send(frame);
        }
    }

    private void attemptFailed(ConnectionException error) {
        LOGGER.log(Level.FINE, "Connect attempt failed", error);
        emit(error);
        if (!automaticAttempt) {
            state.transitionTo(ConnectionState.DISCONNECTED, error);
            failWaiters(error);
            return;
        }
        scheduleReconnect(error);
    }

    private void received(long gen, String frame) {
        if (gen != generation) {
            return;
        }
        heartbeat.onInbound();
        frameHandler.accept(frame);
    }

    private void closed(long gen, int code, String reason) {
        if (gen != generation) {
            return;
        }
        generation++;
        if (state.getState() == ConnectionState.CONNECTING) {
            connectTimer.cancel();
            attemptFailed(
                    new ConnectionException(
                            ConnectionException.Reason.CONNECT_FAILED,
                            "Connection closed during connect: " + code + " " + reason,
                            code,
                            reason,
                            null));
            return;
        }
        ConnectionException cause =
                new ConnectionException(
                        ConnectionException.Reason.ABNORMAL_CLOSE,
                        "Connection closed: " + code + (reason.isEmpty() ? "" : " " + reason),
                        code,
                        reason,
                        null);
        if (code != StreamSession.NORMAL_CLOSURE) {
            emit(cause);
        }
        lost(code, reason, cause);
    }

    private void transportError(long gen, Throwable error) {
        if (gen != generation) {
            return;
        }
        emit(
                new ConnectionException(
                        ConnectionException.Reason.TRANSPORT_ERROR,
                        "Event stream error: "
                                + (error.getMessage() != null ? error.getMessage() : error),
                        error));
    }

    private void heartbeatExpired() {
        if (state.getState() != ConnectionState.CONNECTED) {
            return;
        }
        ConnectionException cause =
                new ConnectionException(
                        ConnectionException.Reason.HEARTBEAT_TIMEOUT,
                        "Heartbeat timeout - server not responding",
                        HEARTBEAT_TIMEOUT_CODE,
                        HEARTBEAT_TIMEOUT_REASON,
                        null);
        LOGGER.warning("No traffic within " + config.heartbeatTimeout().toMillis() + "ms of ping");
        emit(cause);
        generation++;
        StreamSession dead = session;
        if (dead != null) {
            dead.close(HEARTBEAT_TIMEOUT_CODE, HEARTBEAT_TIMEOUT_REASON);
        }
        lost(HEARTBEAT_TIMEOUT_CODE, HEARTBEAT_TIMEOUT_REASON, cause);
    }

    /** Tears down the lost session and either reconnects or settles in DISCONNECTED. */
    private void lost(int code, String reason, ConnectionException cause) {
        session = null;
        heartbeat.stop();
        subscriptions.detach();
        notifyObservers(observer -> observer.onClosed(code, reason));
        if (closingIntentionally) {
            return;
        }
        if (!config.autoReconnect()) {
            state.transitionTo(ConnectionState.DISCONNECTED, cause);
            failWaiters(cause);
            return;
        }
        scheduleReconnect(cause);
    }

    private void scheduleReconnect(ConnectionException cause) {
        if (reconnects.getAttemptCount() >= config.maxReconnectAttempts()) {
            ConnectionException exhausted =
                    new ConnectionException(
                            ConnectionException.Reason.RECONNECT_EXHAUSTED,
                            "Max reconnection attempts ("
                                    + config.maxReconnectAttempts()
                                    + ") exceeded",
                            cause);
            LOGGER.warning(exhausted.getMessage());
            state.transitionTo(ConnectionState.DISCONNECTED, exhausted);
            emit(exhausted);
            failWaiters(exhausted);
            return;
        }
        int attempt = reconnects.startAttempt();
        reconnects.recordFailure(cause);
        long delay = reconnectPolicy.calculateDelay(reconnects);
        reconnects.recordDelay(delay);
        state.transitionTo(ConnectionState.RECONNECTING, cause);
        LOGGER.info("Reconnecting in " + delay + "ms (attempt " + attempt + ")");
        notifyObservers(observer -> observer.onReconnecting(attempt, delay));
        reconnectTimer =
                loop.schedule(
                        () -> {
                            if (state.getState() == ConnectionState.RECONNECTING
                                    && !closingIntentionally) {
                                automaticAttempt = true;
                                openSession();
                            }
                        },
                        Duration.ofMillis(delay));
    }

    private void closeIntentionally() {
        closingIntentionally = true;
        reconnectTimer.cancel();
        connectTimer.cancel();
        heartbeat.stop();
        connectionId = null;
        ConnectionState current = state.getState();
        if (current == ConnectionState.DISCONNECTED) {
            return;
        }
        state.transitionTo(ConnectionState.CLOSING);
        generation++;
        subscriptions.detach();
        StreamSession closing = session;
        session = null;
        if (closing != null) {
            closing.close(StreamSession.NORMAL_CLOSURE, DISCONNECT_REASON);
        }
        failWaiters(
                new ConnectionException(
                        ConnectionException.Reason.CLOSED, "Disconnected while connecting", null));
        state.transitionTo(ConnectionState.DISCONNECTED);
        if (closing != null) {
            notifyObservers(
                    observer -> observer.onClosed(StreamSession.NORMAL_CLOSURE, DISCONNECT_REASON));
        }
        LOGGER.info("Event stream disconnected");
    }

    private void emit(ConnectionException error) {
        notifyObservers(observer -> observer.onError(error));
    }

    /** Observer failures are logged and never interrupt a lifecycle step. */
    private void notifyObservers(Consumer<ConnectionObserver> notification) {
        for (ConnectionObserver observer : observers) {
            try {
                notification.accept(observer);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection observer failed", e);
            }
        }
    }

    private void completeWaiters() {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        waiters.forEach(waiter -> waiter.complete(null));
    }

    private void failWaiters(ConnectionException error) {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        waiters.forEach(waiter -> waiter.completeExceptionally(error));
    }

    @Override
    public String toString() {
        return "ConnectionManager[" + config.url() + ":" + state.getState() + "]";
    }

    /** Re-posts transport callbacks to the loop, tagged with their session's generation. */
    private final class SessionListener implements StreamListener {
        private final long gen;

        SessionListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onMessage(String text) {
            loop.execute(() -> received(gen, text));
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> closed(gen, code, reason != null ? reason : ""));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> transportError(gen, error));
        }
    }
}
