package express.mvp.conduit.stream;

/** Receives dispatched envelopes. Runs on the event loop. */
@FunctionalInterface
public interface EventListener {

    /**
     * Called for each matching envelope.
     *
     * @param envelope the envelope
     */
    void onEvent(EventEnvelope envelope);
}
