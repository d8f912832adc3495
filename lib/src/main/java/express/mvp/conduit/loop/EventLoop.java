package express.mvp.conduit.loop;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Single-threaded cooperative scheduler driving the communication layer.
 *
 * <p>All state of the retry loop, the connection manager and the dispatcher is mutated from tasks
 * running on one event loop. Nothing here ever blocks: a backoff sleep, a heartbeat interval or a
 * wait deadline is a task scheduled with {@link #schedule(Runnable, Duration)}.
 *
 * <h2>Ordering</h2>
 *
 * <p>Tasks submitted with {@link #execute(Runnable)} run in submission order. Scheduled tasks run
 * in deadline order; tasks with equal deadlines run in scheduling order.
 *
 * @see SingleThreadEventLoop
 */
public interface EventLoop extends Executor, AutoCloseable {

    /**
     * Submits a task to run on the loop as soon as possible.
     *
     * @param task the task
     */
    @Override
    void execute(Runnable task);

    /**
     * Schedules a task to run on the loop after a delay.
     *
     * @param task the task
     * @param delay the delay, zero or negative runs as soon as possible
     * @return a handle that disarms the task
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Checks if the caller is running on this loop.
     *
     * @return true inside a loop task
     */
    boolean inEventLoop();

    /**
     * Returns the loop's notion of the current time.
     *
     * @return milliseconds since the epoch (virtual for test loops)
     */
    long currentTimeMillis();

    /** Stops the loop. Pending tasks are discarded. */
    @Override
    void close();
}
