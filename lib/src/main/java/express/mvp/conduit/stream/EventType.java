package express.mvp.conduit.stream;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of envelope types the server emits.
 *
 * <p>Dispatch is keyed by the wire name, so a type missing from this catalog is still delivered to
 * listeners registered for its name.
 */
public enum EventType {
    TASK_CREATED("task.created"),
    TASK_UPDATED("task.updated"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    AGENT_STATUS_CHANGED("agent.status_changed"),
    DAG_STARTED("dag.started"),
    DAG_COMPLETED("dag.completed"),
    DAG_FAILED("dag.failed"),
    APPROVAL_REQUIRED("approval.required"),
    APPROVAL_RESOLVED("approval.resolved"),
    LOG_MESSAGE("log.message"),
    /** Liveness envelope; its payload carries the server-assigned {@code connectionId}. */
    HEARTBEAT("heartbeat");

    private static final Map<String, EventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (EventType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used in the {@code type} field of envelopes and in subscribe frames.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a type by wire name.
     *
     * @param wireName the name from an envelope
     * @return the type, or empty for names outside the catalog
     */
    public static Optional<EventType> fromWire(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
