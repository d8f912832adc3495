package express.mvp.conduit.stream;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a subscription selects: one or more event types and an optional payload filter.
 *
 * <p>The filter maps payload field names to required values, e.g. {@code taskId -> "t-1"}. It is
 * sent to the server with the subscribe frame and applied locally by {@link #matches}.
 *
 * <pre>{@code
 * SubscriptionSpec spec = SubscriptionSpec.of(EventType.TASK_COMPLETED)
 *     .withFilter("taskId", "t-1");
 * }</pre>
 */
public final class SubscriptionSpec {

    private final List<String> events;
    private final Map<String, String> filter;

    private SubscriptionSpec(List<String> events, Map<String, String> filter) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("at least one event type is required");
        }
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.filter = Collections.unmodifiableMap(new LinkedHashMap<>(filter));
    }

    /**
     * Selects catalog types.
     *
     * @param types the types
     * @return an unfiltered spec
     */
    public static SubscriptionSpec of(EventType... types) {
        List<String> names = new ArrayList<>(types.length);
        for (EventType type : types) {
            names.add(type.wireName());
        }
        return new SubscriptionSpec(names, Collections.emptyMap());
    }

    /**
     * Selects types by wire name.
     *
     * @param events the wire names
     * @return an unfiltered spec
     */
    public static SubscriptionSpec ofNames(List<String> events) {
        for (String event : events) {
            Objects.requireNonNull(event, "event");
        }
        return new SubscriptionSpec(events, Collections.emptyMap());
    }

    /**
     * Returns a copy with one more filter entry.
     *
     * @param field the payload field
     * @param value the required value
     * @return the new spec
     */
    public SubscriptionSpec withFilter(String field, String value) {
        Map<String, String> copy = new LinkedHashMap<>(filter);
        copy.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
        return new SubscriptionSpec(events, copy);
    }

    public List<String> events() {
        return events;
    }

    public Map<String, String> filter() {
        return filter;
    }

    /**
     * Checks if an envelope is selected: its type is listed and every filter field of its payload
     * holds the required value.
     *
     * @param envelope the envelope
     * @return true when selected
     */
    public boolean matches(EventEnvelope envelope) {
        if (!events.contains(envelope.type())) {
            return false;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            JsonNode value = envelope.payload().path(entry.getKey());
            if (!value.isValueNode() || !entry.getValue().equals(value.asText())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionSpec other)) {
            return false;
        }
        return events.equals(other.events) && filter.equals(other.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(events, filter);
    }

    @Override
    public String toString() {
        return filter.isEmpty() ? events.toString() : events + " where " + filter;
    }
}
