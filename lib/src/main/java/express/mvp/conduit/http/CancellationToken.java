package express.mvp.conduit.http;

import express.mvp.conduit.loop.Cancellable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-owned signal that aborts an in-progress call.
 *
 * <p>A token may be shared by several calls and cancelled from any thread. Cancellation is
 * one-way: once cancelled, a token stays cancelled.
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CompletableFuture<JsonNode> call =
 *     executor.get("/api/v1/tasks", RequestOptions.builder().cancellationToken(token).build());
 * token.cancel(); // call fails with RequestCancelledException
 * }</pre>
 */
public final class CancellationToken {

    private static final Logger LOGGER = Logger.getLogger(CancellationToken.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    /**
     * Requests cancellation and runs the registered hooks once.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Cancellation hook failed", e);
            }
        }
        hooks.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a hook run on cancellation. If the token is already cancelled the hook runs now.
     *
     * @param hook the hook
     * @return a handle that unregisters the hook
     */
    public Cancellable onCancel(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get() && hooks.remove(hook)) {
            hook.run();
            return Cancellable.NOOP;
        }
        return () -> hooks.remove(hook);
    }
}
