package express.mvp.conduit.stream;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.conduit.config.StreamConfig;
import express.mvp.conduit.error.ConnectionException;
import express.mvp.conduit.error.RetryPolicy;
import express.mvp.conduit.lifecycle.ConnectionState;
import express.mvp.conduit.loop.ManualEventLoop;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConnectionManager} on a virtual clock.
 *
 * <p>Reconnect jitter is pinned to zero, so the n-th reconnect fires {@code 1000 * 2^(n-1)} ms
 * after the loss.
 */
@DisplayName("ConnectionManager")
class ConnectionManagerTest {

    private static final String HEARTBEAT_FRAME =
            "{\"type\":\"heartbeat\",\"payload\":{\"connectionId\":\"c-1\"}}";

    private ManualEventLoop loop;
    private FakeStreamTransport transport;
    private SubscriptionRegistry registry;
    private RecordingObserver observer;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeStreamTransport();
        AtomicInteger ids = new AtomicInteger();
        registry = new SubscriptionRegistry(() -> "sub-" + ids.incrementAndGet());
        observer = new RecordingObserver();
        manager = newManager(config().build());
    }

    private static StreamConfig.Builder config() {
        return StreamConfig.builder()
                .url("ws://stream.test/ws")
                .apiKey("k")
                .maxReconnectAttempts(3)
                .heartbeatInterval(Duration.ofSeconds(30))
                .heartbeatTimeout(Duration.ofSeconds(10));
    }

    private ConnectionManager newManager(StreamConfig config) {
        ConnectionManager created =
                new ConnectionManager(
                        config,
                        transport,
                        loop,
                        registry,
                        RetryPolicy.builder()
                                .maxAttempts(config.maxReconnectAttempts())
                                .initialDelay(config.reconnectInterval())
                                .maxDelay(StreamConfig.MAX_RECONNECT_DELAY)
                                .random(() -> 0.0)
                                .build());
        created.addObserver(observer);
        return created;
    }

    private FakeStreamTransport.FakeSession connect() {
        CompletableFuture<Void> connected = manager.connect();
        FakeStreamTransport.FakeSession session = transport.last().accept();
        assertTrue(connected.isDone());
        assertFalse(connected.isCompletedExceptionally());
        return session;
    }

    @Nested
    @DisplayName("connect")
    class ConnectTests {

        @Test
        @DisplayName("Opens the credentialed address and becomes CONNECTED")
        void connects() {
            connect();

            assertEquals(1, transport.opens.size());
            assertEquals(URI.create("ws://stream.test/ws?apiKey=k"), transport.opens.get(0).uri);
            assertEquals(ConnectionState.CONNECTED, manager.getState());
            assertTrue(manager.isConnected());
            assertEquals(0, observer.reconnected);
        }

        @Test
        @DisplayName("Concurrent connects share one attempt")
        void concurrentConnects() {
            CompletableFuture<Void> first = manager.connect();
            CompletableFuture<Void> second = manager.connect();

            assertEquals(1, transport.opens.size());
            transport.last().accept();

            assertTrue(first.isDone() && !first.isCompletedExceptionally());
            assertTrue(second.isDone() && !second.isCompletedExceptionally());
        }

        @Test
        @DisplayName("Connect while connected completes at once")
        void connectWhenConnected() {
            connect();

            assertTrue(manager.connect().isDone());
            assertEquals(1, transport.opens.size());
        }

        @Test
        @DisplayName("A failed first attempt ends DISCONNECTED without reconnecting")
        void initialFailure() {
            CompletableFuture<Void> connected = manager.connect();
            transport.last().reject(new ConnectException("Connection refused"));

            CompletionException e = assertThrows(CompletionException.class, connected::join);
            ConnectionException cause = assertInstanceOf(ConnectionException.class, e.getCause());
            assertEquals(ConnectionException.Reason.CONNECT_FAILED, cause.reason());
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            assertEquals(1, observer.errorCount(ConnectionException.Reason.CONNECT_FAILED));
            assertEquals(0, loop.pendingTimers());
            assertTrue(observer.reconnectAttempts.isEmpty());
        }

        @Test
        @DisplayName("A connect that never completes times out")
        void connectTimeout() {
            CompletableFuture<Void> connected = manager.connect();

            loop.advanceBy(Duration.ofSeconds(10));

            assertTrue(connected.isCompletedExceptionally());
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());

            FakeStreamTransport.FakeSession late = transport.last().accept();
            assertEquals(List.of("1000 Superseded"), late.closes);
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        }

        @Test
        @DisplayName("Can connect again after a failed attempt")
        void reconnectAfterFailure() {
            manager.connect();
            transport.last().reject(new IOException("refused"));

            connect();

            assertEquals(2, transport.opens.size());
            assertEquals(ConnectionState.CONNECTED, manager.getState());
        }
    }

    @Nested
    @DisplayName("Subscription replay")
    class ReplayTests {

        @Test
        @DisplayName("Replays exactly once per connect and never on heartbeats")
        void replayOncePerConnect() {
            registry.subscribe(SubscriptionSpec.of(EventType.TASK_COMPLETED));
            registry.subscribe(
                    SubscriptionSpec.of(EventType.DAG_COMPLETED).withFilter("dagId", "d-1"));

            FakeStreamTransport.FakeSession first = connect();
            assertEquals(2, first.sentOfType("subscribe").size());

            loop.advanceBy(Duration.ofSeconds(30));
            transport.last().receive(HEARTBEAT_FRAME);
            loop.advanceBy(Duration.ofSeconds(15));

            assertEquals(1, first.sentOfType("ping").size());
            assertEquals(2, first.sentOfType("subscribe").size());

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");
            loop.advanceBy(Duration.ofSeconds(1));
            FakeStreamTransport.FakeSession second = transport.last().accept();

            assertEquals(2, second.sentOfType("subscribe").size());
            assertEquals(2, first.sentOfType("subscribe").size());
            assertEquals(
                    List.of("sub-1", "sub-2"),
                    second.sentOfType("subscribe").stream()
                            .map(n -> n.path("subscriptionId").asText())
                            .toList());
        }

        @Test
        @DisplayName("Subscriptions made while connected are sent once and replayed later")
        void subscribeWhileConnected() {
            FakeStreamTransport.FakeSession first = connect();

            registry.subscribe(SubscriptionSpec.of(EventType.LOG_MESSAGE));
            assertEquals(1, first.sentOfType("subscribe").size());

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");
            registry.subscribe(SubscriptionSpec.of(EventType.TASK_FAILED));
            assertEquals(1, first.sentOfType("subscribe").size());

            loop.advanceBy(Duration.ofSeconds(1));
            FakeStreamTransport.FakeSession second = transport.last().accept();
            assertEquals(2, second.sentOfType("subscribe").size());
        }
    }

    @Nested
    @DisplayName("Heartbeat")
    class HeartbeatTests {

        @Test
        @DisplayName("Silence after a ping closes with 4000 and reconnects once")
        void silenceTriggersReconnect() {
            FakeStreamTransport.FakeSession first = connect();

            loop.advanceTo(29_999);
            assertTrue(first.sentOfType("ping").isEmpty());

            loop.advanceTo(30_000);
            assertEquals(1, first.sentOfType("ping").size());

            loop.advanceTo(40_000);
            assertEquals(List.of("4000 Heartbeat timeout"), first.closes);
            assertEquals(ConnectionState.RECONNECTING, manager.getState());
            assertEquals(1, observer.errorCount(ConnectionException.Reason.HEARTBEAT_TIMEOUT));
            assertEquals(41_000, loop.nextDeadline());

            loop.advanceTo(41_000);
            assertEquals(2, transport.opens.size());
            transport.last().accept();

            assertEquals(List.of(1), observer.reconnectAttempts);
            assertEquals(1, observer.reconnected);
            assertEquals(List.of("4000 Heartbeat timeout"), first.closes);
            assertEquals(ConnectionState.CONNECTED, manager.getState());
        }

        @Test
        @DisplayName("Silence is detected when pings come faster than the timeout")
        void shortIntervalSilence() {
            manager =
                    newManager(
                            config().heartbeatInterval(Duration.ofSeconds(5))
                                    .heartbeatTimeout(Duration.ofSeconds(10))
                                    .build());
            FakeStreamTransport.FakeSession session = connect();

            loop.advanceTo(14_999);
            assertEquals(2, session.sentOfType("ping").size());
            assertTrue(session.closes.isEmpty());

            loop.advanceTo(15_000);
            assertEquals(List.of("4000 Heartbeat timeout"), session.closes);
            assertEquals(ConnectionState.RECONNECTING, manager.getState());
            assertEquals(1, observer.errorCount(ConnectionException.Reason.HEARTBEAT_TIMEOUT));
        }

        @Test
        @DisplayName("Traffic between fast pings restarts the silence window")
        void shortIntervalTraffic() {
            manager =
                    newManager(
                            config().heartbeatInterval(Duration.ofSeconds(5))
                                    .heartbeatTimeout(Duration.ofSeconds(10))
                                    .build());
            FakeStreamTransport.FakeSession session = connect();

            loop.advanceTo(12_000);
            transport.last().receive(HEARTBEAT_FRAME);
            loop.advanceTo(24_999);

            assertTrue(session.closes.isEmpty());
            assertEquals(ConnectionState.CONNECTED, manager.getState());

            loop.advanceTo(25_000);
            assertEquals(List.of("4000 Heartbeat timeout"), session.closes);
        }

        @Test
        @DisplayName("Any inbound frame answers the ping")
        void trafficKeepsAlive() {
            FakeStreamTransport.FakeSession session = connect();

            loop.advanceTo(30_000);
            loop.advanceTo(35_000);
            transport.last().receive("{\"type\":\"task.updated\",\"payload\":{}}");
            loop.advanceTo(59_999);

            assertTrue(session.closes.isEmpty());
            assertEquals(ConnectionState.CONNECTED, manager.getState());
        }

        @Test
        @DisplayName("Frames are handed to the frame handler")
        void framesForwarded() {
            List<String> frames = new ArrayList<>();
            manager.setFrameHandler(frames::add);
            connect();

            transport.last().receive(HEARTBEAT_FRAME);

            assertEquals(List.of(HEARTBEAT_FRAME), frames);
        }
    }

    @Nested
    @DisplayName("Reconnect")
    class ReconnectTests {

        @Test
        @DisplayName("Delays double between failed attempts")
        void backoff() {
            connect();
            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");

            loop.advanceBy(Duration.ofMillis(1000));
            transport.last().reject(new IOException("refused"));
            loop.advanceBy(Duration.ofMillis(2000));

            assertEquals(3, transport.opens.size());
            assertEquals(List.of(1, 2), observer.reconnectAttempts);
            assertEquals(List.of(1000L, 2000L), observer.reconnectDelays);
        }

        @Test
        @DisplayName("Exhaustion is reported once and ends DISCONNECTED")
        void exhaustion() {
            connect();
            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "gone");

            for (int i = 0; i < 3; i++) {
                loop.advanceBy(Duration.ofMillis(1000L << i));
                transport.last().reject(new IOException("refused"));
            }
            loop.advanceBy(Duration.ofMinutes(5));

            assertEquals(4, transport.opens.size());
            assertEquals(1, observer.errorCount(ConnectionException.Reason.RECONNECT_EXHAUSTED));
            assertEquals(1, observer.errorCount(ConnectionException.Reason.ABNORMAL_CLOSE));
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            assertEquals(0, loop.pendingTimers());
        }

        @Test
        @DisplayName("A successful reconnect resets the attempt count")
        void resetAfterSuccess() {
            connect();
            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");
            loop.advanceBy(Duration.ofSeconds(1));
            transport.last().accept();

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");

            assertEquals(List.of(1, 1), observer.reconnectAttempts);
        }

        @Test
        @DisplayName("Callbacks from a replaced session are ignored")
        void staleCallbacksIgnored() {
            connect();
            FakeStreamTransport.PendingOpen old = transport.last();
            loop.advanceTo(40_000);
            int closesBefore = observer.closes.size();
            int errorsBefore = observer.errors.size();

            old.serverClose(StreamSession.ABNORMAL_CLOSURE, "late");
            old.listener.onError(new IOException("late"));

            assertEquals(closesBefore, observer.closes.size());
            assertEquals(errorsBefore, observer.errors.size());
            assertEquals(ConnectionState.RECONNECTING, manager.getState());
            assertEquals(List.of(1), observer.reconnectAttempts);
        }

        @Test
        @DisplayName("Without auto-reconnect a loss ends DISCONNECTED")
        void noAutoReconnect() {
            manager = newManager(config().autoReconnect(false).build());
            connect();

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");

            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            assertTrue(observer.reconnectAttempts.isEmpty());
            assertEquals(0, loop.pendingTimers());
        }

        @Test
        @DisplayName("A normal server close is not reported as an error")
        void normalCloseNotAnError() {
            connect();

            transport.last().serverClose(StreamSession.NORMAL_CLOSURE, "bye");

            assertEquals(0, observer.errorCount(ConnectionException.Reason.ABNORMAL_CLOSE));
            assertEquals(List.of("1000 bye"), observer.closes);
        }
    }

    @Nested
    @DisplayName("Observer failures")
    class ObserverFailureTests {

        @Test
        @DisplayName("A throwing close observer does not stop the reconnect")
        void throwingCloseObserver() {
            manager.addObserver(
                    new ConnectionObserver() {
                        @Override
                        public void onClosed(int code, String reason) {
                            throw new IllegalStateException("close listener");
                        }
                    });
            connect();

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");

            assertEquals(ConnectionState.RECONNECTING, manager.getState());
            assertFalse(manager.isConnected());
            loop.advanceBy(Duration.ofSeconds(5));
            assertEquals(2, transport.opens.size());
        }

        @Test
        @DisplayName("A throwing reconnecting observer does not strand the manager")
        void throwingReconnectingObserver() {
            manager.addObserver(
                    new ConnectionObserver() {
                        @Override
                        public void onReconnecting(int attempt, long delayMillis) {
                            throw new IllegalStateException("reconnecting listener");
                        }
                    });
            connect();

            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");
            assertEquals(1, loop.pendingTimers());

            loop.advanceBy(Duration.ofSeconds(1));
            assertEquals(2, transport.opens.size());
            CompletableFuture<Void> joined = manager.connect();
            transport.last().accept();

            assertTrue(joined.isDone() && !joined.isCompletedExceptionally());
            assertEquals(List.of(1), observer.reconnectAttempts);
        }

        @Test
        @DisplayName("A throwing reconnected observer still leaves the stream CONNECTED")
        void throwingReconnectedObserver() {
            manager.addObserver(
                    new ConnectionObserver() {
                        @Override
                        public void onReconnected() {
                            throw new IllegalStateException("reconnected listener");
                        }
                    });
            connect();
            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");
            loop.advanceBy(Duration.ofSeconds(1));
            transport.last().accept();

            assertEquals(ConnectionState.CONNECTED, manager.getState());
            assertEquals(1, observer.reconnected);
        }
    }

    @Nested
    @DisplayName("disconnect")
    class DisconnectTests {

        @Test
        @DisplayName("Closes normally and never reconnects")
        void closesNormally() {
            FakeStreamTransport.FakeSession session = connect();

            CompletableFuture<Void> done = manager.disconnect();

            assertTrue(done.isDone());
            assertEquals(List.of("1000 Client disconnecting"), session.closes);
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            assertEquals(0, loop.pendingTimers());

            transport.last().serverClose(StreamSession.NORMAL_CLOSURE, "");
            loop.advanceBy(Duration.ofMinutes(1));
            assertEquals(1, transport.opens.size());
            assertTrue(observer.reconnectAttempts.isEmpty());
        }

        @Test
        @DisplayName("Cancels a pending reconnect")
        void cancelsReconnect() {
            connect();
            transport.last().serverClose(StreamSession.ABNORMAL_CLOSURE, "");

            manager.disconnect();
            loop.advanceBy(Duration.ofMinutes(1));

            assertEquals(1, transport.opens.size());
            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        }

        @Test
        @DisplayName("Fails connect waiters when disconnecting mid-connect")
        void failsWaiters() {
            CompletableFuture<Void> connecting = manager.connect();

            manager.disconnect();

            CompletionException e = assertThrows(CompletionException.class, connecting::join);
            assertEquals(
                    ConnectionException.Reason.CLOSED,
                    ((ConnectionException) e.getCause()).reason());
        }

        @Test
        @DisplayName("Heartbeat connection id is cleared")
        void clearsConnectionId() {
            connect();
            manager.updateConnectionId("c-1");

            manager.disconnect();

            assertNull(manager.connectionId());
        }

        @Test
        @DisplayName("Frames are dropped while disconnected")
        void sendWhileDisconnected() {
            assertFalse(manager.send("{\"type\":\"ping\"}"));
        }
    }
}
