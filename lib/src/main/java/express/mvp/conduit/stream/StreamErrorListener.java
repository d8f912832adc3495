package express.mvp.conduit.stream;

import express.mvp.conduit.error.ConnectionException;

/** Receives event-stream errors, which are reported rather than thrown. */
@FunctionalInterface
public interface StreamErrorListener {

    /**
     * Called for each stream error.
     *
     * @param error the error; {@link ConnectionException#reason()} tells what happened
     */
    void onError(ConnectionException error);
}
