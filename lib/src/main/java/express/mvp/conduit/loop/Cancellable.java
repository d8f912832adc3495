package express.mvp.conduit.loop;

/** Handle to a scheduled task that has not run yet. */
@FunctionalInterface
public interface Cancellable {

    /** A handle that was never armed. */
    Cancellable NOOP = () -> false;

    /**
     * Cancels the scheduled task.
     *
     * <p>Cancelling a task that already ran, or was already cancelled, has no effect.
     *
     * @return true if this call prevented the task from running
     */
    boolean cancel();
}
