package express.mvp.conduit.stream;

/**
 * Token returned when a listener is added. Removing through the token never depends on listener
 * identity, so the same lambda may be registered several times and removed one at a time.
 */
@FunctionalInterface
public interface ListenerRegistration {

    /**
     * Removes the listener. Further calls have no effect.
     *
     * @return true if this call removed it
     */
    boolean remove();
}
