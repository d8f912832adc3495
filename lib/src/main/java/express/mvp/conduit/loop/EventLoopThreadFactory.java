package express.mvp.conduit.loop;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for event-loop threads with configurable naming.
 *
 * <p>Created threads are named "{prefix}-{counter}" so loop activity is easy to spot in thread
 * dumps and log records. Daemon threads are the default, so an unclosed client never keeps the
 * JVM alive.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class EventLoopThreadFactory implements ThreadFactory {

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    /** Base name prefix for created threads. */
    private final String namePrefix;

    /** Whether created threads should be daemon threads. */
    private final boolean daemon;

    /**
     * Creates a factory producing daemon threads with the given name prefix.
     *
     * @param namePrefix the prefix for thread names
     */
    public EventLoopThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public EventLoopThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates a new, unstarted thread that will execute the given runnable.
     *
     * @param runnable the task to execute
     * @return a new platform thread
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new Thread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "EventLoopThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
