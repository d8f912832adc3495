package express.mvp.conduit.stream;

import java.util.Objects;

/**
 * A registered subscription.
 *
 * @param id the identifier returned by {@code subscribe}
 * @param spec what it selects
 */
public record Subscription(String id, SubscriptionSpec spec) {

    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(spec, "spec");
    }
}
