package express.mvp.conduit.stream;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Tracks active subscriptions independently of connection state.
 *
 * <p>Subscriptions survive any number of reconnects; only {@link #unsubscribe(String)} removes
 * one. While a session is attached, subscribe and unsubscribe frames are sent immediately. While
 * detached, they are only recorded; {@link #attach(Consumer)} later sends one subscribe frame per
 * subscription, in registration order.
 *
 * <h2>Ordering</h2>
 *
 * <p>Attaching replays under the registry lock, so a subscription added concurrently is either
 * part of the replay or sent after it, never lost and never sent twice.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe.
 */
public final class SubscriptionRegistry {

    private static final Logger LOGGER = Logger.getLogger(SubscriptionRegistry.class.getName());

    private final Map<String, SubscriptionSpec> subscriptions = new LinkedHashMap<>();
    private final Supplier<String> idGenerator;

    /** Sender of the attached session, null while detached. */
    private Consumer<String> sender;

    /** Creates a registry generating {@code sub_<epochMillis>_<random>} identifiers. */
    public SubscriptionRegistry() {
        this(SubscriptionRegistry::newSubscriptionId);
    }

    /**
     * Creates a registry with a custom identifier source.
     *
     * @param idGenerator produces unique identifiers
     */
    public SubscriptionRegistry(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Records a subscription and, when attached, sends its subscribe frame.
     *
     * @param spec what to subscribe to
     * @return the new subscription's identifier
     */
    public synchronized String subscribe(SubscriptionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        String id = idGenerator.get();
        subscriptions.put(id, spec);
        if (sender != null) {
            sender.accept(ControlFrames.subscribe(new Subscription(id, spec)));
        }
        LOGGER.fine(() -> "Subscribed " + id + " to " + spec);
        return id;
    }

    /**
     * Removes a subscription and, when attached, sends an unsubscribe frame.
     *
     * <p>Removing an unknown identifier does nothing.
     *
     * @param id the identifier
     * @return true if a subscription was removed
     */
    public synchronized boolean unsubscribe(String id) {
        if (subscriptions.remove(id) == null) {
            return false;
        }
        if (sender != null) {
            sender.accept(ControlFrames.unsubscribe(id));
        }
        LOGGER.fine(() -> "Unsubscribed " + id);
        return true;
    }

    /**
     * Attaches an open session and replays every subscription through it.
     *
     * @param sender writes one frame to the session
     * @return the number of subscribe frames sent
     */
    public synchronized int attach(Consumer<String> sender) {
        this.sender = Objects.requireNonNull(sender, "sender");
        for (Map.Entry<String, SubscriptionSpec> entry : subscriptions.entrySet()) {
            Subscription subscription = new Subscription(entry.getKey(), entry.getValue());
            sender.accept(ControlFrames.subscribe(subscription));
        }
        int replayed = subscriptions.size();
        LOGGER.fine(() -> "Replayed " + replayed + " subscription(s)");
        return replayed;
    }

    /** Detaches the session. Subscriptions are kept for the next attach. */
    public synchronized void detach() {
        this.sender = null;
    }

    public synchronized boolean isAttached() {
        return sender != null;
    }

    /**
     * Returns a subscription's selector.
     *
     * @param id the identifier
     * @return the selector, or empty for unknown identifiers
     */
    public synchronized Optional<SubscriptionSpec> get(String id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    /**
     * Returns a snapshot of all subscriptions in registration order.
     *
     * @return the subscriptions
     */
    public synchronized List<Subscription> subscriptions() {
        List<Subscription> snapshot = new ArrayList<>(subscriptions.size());
        subscriptions.forEach((id, spec) -> snapshot.add(new Subscription(id, spec)));
        return snapshot;
    }

    public synchronized int size() {
        return subscriptions.size();
    }

    static String newSubscriptionId() {
        String random =
                Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        if (random.length() > 9) {
            random = random.substring(0, 9);
        }
        return "sub_" + System.currentTimeMillis() + "_" + random;
    }
}
