package express.mvp.conduit.loop;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLoop} backed by one daemon platform thread.
 *
 * <p>Tasks are executed by a single-thread {@link ScheduledThreadPoolExecutor}. A task that throws
 * is logged and does not stop the loop. Cancelled timers are removed from the queue immediately so
 * frequent re-arming (heartbeats, wait deadlines) does not accumulate dead entries.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (SingleThreadEventLoop loop = new SingleThreadEventLoop("conduit")) {
 *     Cancellable timer = loop.schedule(() -> System.out.println("tick"), Duration.ofSeconds(1));
 *     timer.cancel();
 * }
 * }</pre>
 */
public final class SingleThreadEventLoop implements EventLoop {

    private static final Logger LOGGER = Logger.getLogger(SingleThreadEventLoop.class.getName());

    private static final long SHUTDOWN_GRACE_MILLIS = 1_000;

    private final ScheduledThreadPoolExecutor executor;

    private volatile Thread thread;

    /**
     * Creates and starts a loop whose thread is named "{name}-1".
     *
     * @param name the thread name prefix
     */
    public SingleThreadEventLoop(String name) {
        EventLoopThreadFactory factory = new EventLoopThreadFactory(name);
        this.executor =
                new ScheduledThreadPoolExecutor(
                        1,
                        runnable -> {
                            Thread t = factory.newThread(runnable);
                            thread = t;
                            return t;
                        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.prestartCoreThread();
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Event loop closed, dropping task", e);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        long millis = Math.max(0, delay.toMillis());
        try {
            ScheduledFuture<?> future =
                    executor.schedule(guard(task), millis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Event loop closed, dropping timer", e);
            return Cancellable.NOOP;
        }
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    /**
     * Checks if the loop has been closed.
     *
     * @return true after {@link #close()}
     */
    public boolean isClosed() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        if (inEventLoop()) {
            return;
        }
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                LOGGER.warning(
                        "Event loop did not terminate within " + SHUTDOWN_GRACE_MILLIS + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Event loop task failed", e);
            }
        };
    }

    @Override
    public String toString() {
        Thread t = thread;
        return "SingleThreadEventLoop[" + (t != null ? t.getName() : "unstarted") + "]";
    }
}
