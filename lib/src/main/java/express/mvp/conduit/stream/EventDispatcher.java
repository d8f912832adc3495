package express.mvp.conduit.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.conduit.error.ConduitTimeoutException;
import express.mvp.conduit.error.ConnectionException;
import express.mvp.conduit.json.Json;
import express.mvp.conduit.loop.Cancellable;
import express.mvp.conduit.loop.EventLoop;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses inbound frames and routes envelopes to listeners and pending waits.
 *
 * <h2>Routing</h2>
 *
 * <p>For each well-formed envelope, in this order:
 *
 * <ol>
 *   <li>a {@code heartbeat} envelope updates the connection id
 *   <li>generic listeners, in registration order
 *   <li>listeners registered for the envelope's type, in registration order
 *   <li>the oldest pending {@link #waitFor wait} for the type whose predicate accepts the payload
 * </ol>
 *
 * <p>Only one wait is resolved per envelope. Other waits stay armed.
 *
 * <h2>Malformed frames</h2>
 *
 * <p>A frame that is not a JSON object with a textual {@code type} is never dispatched. Under
 * {@link MalformedFramePolicy#REPORT} it is reported to the error sink as {@link
 * ConnectionException.Reason#MALFORMED_FRAME}; under {@link MalformedFramePolicy#DROP} it is only
 * logged.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Listeners may be added and removed from any thread. Dispatch and wait bookkeeping run on the
 * event loop.
 */
public final class EventDispatcher {

    private static final Logger LOGGER = Logger.getLogger(EventDispatcher.class.getName());

    private final EventLoop loop;
    private final MalformedFramePolicy malformedFramePolicy;
    private final Consumer<String> connectionIdSink;
    private final StreamErrorListener errorSink;

    private final List<Entry> listeners = new CopyOnWriteArrayList<>();

    // Loop-confined
    private final List<PendingWait> waits = new ArrayList<>();
    private boolean shutdown;

    /**
     * Creates a dispatcher.
     *
     * @param loop the loop dispatch runs on
     * @param malformedFramePolicy what to do with unparseable frames
     * @param connectionIdSink receives the connection id of heartbeat envelopes
     * @param errorSink receives malformed-frame reports
     */
    public EventDispatcher(
            EventLoop loop,
            MalformedFramePolicy malformedFramePolicy,
            Consumer<String> connectionIdSink,
            StreamErrorListener errorSink) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.malformedFramePolicy =
                Objects.requireNonNull(malformedFramePolicy, "malformedFramePolicy");
        this.connectionIdSink = Objects.requireNonNull(connectionIdSink, "connectionIdSink");
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink");
    }

    /**
     * Adds a listener receiving every envelope, heartbeats included.
     *
     * @param listener the listener
     * @return the registration
     */
    public ListenerRegistration addListener(EventListener listener) {
        return register(new Entry(null, null, listener));
    }

    /**
     * Adds a listener for one envelope type.
     *
     * @param type the wire name
     * @param listener the listener
     * @return the registration
     */
    public ListenerRegistration on(String type, EventListener listener) {
        return register(new Entry(Objects.requireNonNull(type, "type"), null, listener));
    }

    public ListenerRegistration on(EventType type, EventListener listener) {
        return on(type.wireName(), listener);
    }

    /**
     * Adds a listener for the envelopes a subscription selects, filter included.
     *
     * @param spec the selector
     * @param listener the listener
     * @return the registration
     */
    public ListenerRegistration on(SubscriptionSpec spec, EventListener listener) {
        return register(new Entry(null, Objects.requireNonNull(spec, "spec"), listener));
    }

    private ListenerRegistration register(Entry entry) {
        Objects.requireNonNull(entry.listener, "listener");
        listeners.add(entry);
        return () -> listeners.remove(entry);
    }

    /**
     * Waits for the next envelope of a type whose payload satisfies a predicate.
     *
     * <p>Exactly one of match, timeout and shutdown completes the returned future, and the timer is
     * disarmed in every case. Cancelling the future withdraws the wait.
     *
     * @param type the wire name
     * @param predicate tested against the payload, or null to accept any
     * @param timeout how long to wait; null or zero waits until match or shutdown
     * @return a future completed with the envelope, or failed with {@link ConduitTimeoutException}
     *     or {@link ConnectionException}
     */
    public CompletableFuture<EventEnvelope> waitFor(
            String type, Predicate<JsonNode> predicate, Duration timeout) {
        PendingWait wait =
                new PendingWait(
                        Objects.requireNonNull(type, "type"),
                        predicate != null ? predicate : payload -> true);
        wait.result.whenComplete(
                (envelope, error) -> {
                    if (wait.result.isCancelled()) {
                        loop.execute(() -> disarm(wait));
                    }
                });
        loop.execute(() -> arm(wait, timeout));
        return wait.result;
    }

    public CompletableFuture<EventEnvelope> waitFor(
            EventType type, Predicate<JsonNode> predicate, Duration timeout) {
        return waitFor(type.wireName(), predicate, timeout);
    }

    /**
     * Returns the number of armed waits. Must be called on the loop.
     *
     * @return the count
     */
    int pendingWaits() {
        return waits.size();
    }

    /**
     * Parses and routes one inbound frame. Posts to the loop unless already on it.
     *
     * @param frame the raw text frame
     */
    public void dispatch(String frame) {
        if (loop.inEventLoop()) {
            route(frame);
        } else {
            loop.execute(() -> route(frame));
        }
    }

    /**
     * Fails every armed wait with {@link ConnectionException.Reason#CLOSED} and rejects new ones.
     */
    public void shutdown() {
        loop.execute(
                () -> {
                    shutdown = true;
                    List<PendingWait> armed = new ArrayList<>(waits);
                    waits.clear();
                    ConnectionException closed =
                            new ConnectionException(
                                    ConnectionException.Reason.CLOSED,
                                    "Event stream closed while waiting",
                                    null);
                    for (PendingWait wait : armed) {
                        wait.timer.cancel();
                        wait.result.completeExceptionally(closed);
                    }
                });
    }

    private void arm(PendingWait wait, Duration timeout) {
        if (wait.result.isDone()) {
            return;
        }
        if (shutdown) {
            wait.result.completeExceptionally(
                    new ConnectionException(
                            ConnectionException.Reason.CLOSED, "Event stream closed", null));
            return;
        }
        waits.add(wait);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            wait.timer =
                    loop.schedule(
                            () -> {
                                if (waits.remove(wait)) {
                                    wait.result.completeExceptionally(
                                            new ConduitTimeoutException(
                                                    "Timeout waiting for event: " + wait.type,
                                                    timeout));
                                }
                            },
                            timeout);
        }
    }

    private void disarm(PendingWait wait) {
        waits.remove(wait);
        wait.timer.cancel();
    }

    private void route(String frame) {
        EventEnvelope envelope = parse(frame);
        if (envelope == null) {
            return;
        }
        if (envelope.is(EventType.HEARTBEAT)) {
            String connectionId = Json.text(envelope.payload(), "connectionId");
            if (connectionId != null) {
                connectionIdSink.accept(connectionId);
            }
        }

        for (Entry entry : listeners) {
            if (entry.type == null && (entry.spec == null || entry.spec.matches(envelope))) {
                deliver(entry.listener, envelope);
            }
        }
        for (Entry entry : listeners) {
            if (envelope.type().equals(entry.type)) {
                deliver(entry.listener, envelope);
            }
        }

        Iterator<PendingWait> it = waits.iterator();
        while (it.hasNext()) {
            PendingWait wait = it.next();
            if (wait.type.equals(envelope.type()) && accepts(wait, envelope)) {
                it.remove();
                wait.timer.cancel();
                wait.result.complete(envelope);
                return;
            }
        }
    }

    private EventEnvelope parse(String frame) {
        JsonNode node;
        try {
            node = Json.read(frame);
        } catch (JsonProcessingException e) {
            malformed(frame, "invalid JSON: " + e.getOriginalMessage(), e);
            return null;
        }
        if (node == null || !node.isObject()) {
            malformed(frame, "not a JSON object", null);
            return null;
        }
        JsonNode type = node.path("type");
        if (!type.isTextual()) {
            malformed(frame, "missing type", null);
            return null;
        }
        return new EventEnvelope(
                type.asText(),
                node.path("payload"),
                Json.text(node, "timestamp"),
                Json.text(node, "correlationId"));
    }

    private void malformed(String frame, String problem, Throwable cause) {
        if (malformedFramePolicy == MalformedFramePolicy.DROP) {
            LOGGER.fine(() -> "Dropping malformed frame (" + problem + "): " + frame);
            return;
        }
        LOGGER.warning("Malformed frame (" + problem + ")");
        errorSink.onError(
                new ConnectionException(
                        ConnectionException.Reason.MALFORMED_FRAME,
                        "Failed to parse message: " + problem,
                        cause));
    }

    private static void deliver(EventListener listener, EventEnvelope envelope) {
        try {
            listener.onEvent(envelope);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Event listener failed for " + envelope.type(), e);
        }
    }

    private static boolean accepts(PendingWait wait, EventEnvelope envelope) {
        try {
            return wait.predicate.test(envelope.payload());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Wait predicate failed for " + envelope.type(), e);
            return false;
        }
    }

    /** Listener registration; a null type with a null spec receives everything. */
    private static final class Entry {
        final String type;
        final SubscriptionSpec spec;
        final EventListener listener;

        Entry(String type, SubscriptionSpec spec, EventListener listener) {
            this.type = type;
            this.spec = spec;
            this.listener = listener;
        }
    }

    private static final class PendingWait {
        final String type;
        final Predicate<JsonNode> predicate;
        final CompletableFuture<EventEnvelope> result = new CompletableFuture<>();
        Cancellable timer = Cancellable.NOOP;

        PendingWait(String type, Predicate<JsonNode> predicate) {
            this.type = type;
            this.predicate = predicate;
        }
    }
}
