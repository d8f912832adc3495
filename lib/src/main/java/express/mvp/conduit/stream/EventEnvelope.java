package express.mvp.conduit.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;
import java.util.Optional;

/**
 * One inbound stream frame: {@code {type, payload, timestamp, correlationId?}}.
 *
 * @param type the wire type name
 * @param payload the payload, {@link NullNode} when absent
 * @param timestamp the server timestamp as sent, or null
 * @param correlationId the correlation id, or null
 */
public record EventEnvelope(String type, JsonNode payload, String timestamp, String correlationId) {

    public EventEnvelope {
        Objects.requireNonNull(type, "type");
        payload = payload == null || payload.isMissingNode() ? NullNode.getInstance() : payload;
    }

    /**
     * Returns the catalog entry of this envelope's type.
     *
     * @return the type, or empty when the name is not in the catalog
     */
    public Optional<EventType> eventType() {
        return EventType.fromWire(type);
    }

    /**
     * Checks the envelope's type.
     *
     * @param eventType the type to compare with
     * @return true if this envelope has that type
     */
    public boolean is(EventType eventType) {
        return eventType.wireName().equals(type);
    }
}
