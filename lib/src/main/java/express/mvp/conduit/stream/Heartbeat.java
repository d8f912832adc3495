package express.mvp.conduit.stream;

import express.mvp.conduit.loop.Cancellable;
import express.mvp.conduit.loop.EventLoop;
import java.time.Duration;
import java.util.Objects;

/**
 * Liveness probe of one connected session.
 *
 * <p>Every interval a ping is sent and, unless one is already pending, a timeout is armed. Any
 * inbound frame disarms the timeout. If the timeout fires, the session is presumed dead. A heartbeat exists only while its session
 * is connected; {@link #stop()} disarms everything.
 *
 * <p>Confined to the event loop.
 */
final class Heartbeat {

    private final EventLoop loop;
    private final Duration interval;
    private final Duration timeout;
    private final Runnable ping;
    private final Runnable onTimeout;

    private Cancellable tick = Cancellable.NOOP;
    private Cancellable deadline = Cancellable.NOOP;
    private long lastSentAt = -1;
    private boolean running;

    Heartbeat(
            EventLoop loop,
            Duration interval,
            Duration timeout,
            Runnable ping,
            Runnable onTimeout) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.ping = Objects.requireNonNull(ping, "ping");
        this.onTimeout = Objects.requireNonNull(onTimeout, "onTimeout");
    }

    void start() {
        if (running) {
            return;
        }
        running = true;
        tick = loop.schedule(this::beat, interval);
    }

    /** Inbound traffic proves liveness. */
    void onInbound() {
        deadline.cancel();
        deadline = Cancellable.NOOP;
    }

    void stop() {
        running = false;
        tick.cancel();
        deadline.cancel();
        tick = Cancellable.NOOP;
        deadline = Cancellable.NOOP;
    }

    boolean isRunning() {
        return running;
    }

    boolean isAwaitingResponse() {
        return deadline != Cancellable.NOOP;
    }

    /**
     * Returns when the last ping was sent.
     *
     * @return loop time in milliseconds, or -1 before the first ping
     */
    long lastSentAt() {
        return lastSentAt;
    }

    private void beat() {
        if (!running) {
            return;
        }
        lastSentAt = loop.currentTimeMillis();
        ping.run();
        if (!running) {
            return;
        }
        // Silence is measured from the first unanswered ping.
        if (deadline == Cancellable.NOOP) {
            deadline = loop.schedule(this::expired, timeout);
        }
        tick = loop.schedule(this::beat, interval);
    }

    private void expired() {
        if (!running) {
            return;
        }
        deadline = Cancellable.NOOP;
        onTimeout.run();
    }
}
