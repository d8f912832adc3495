package express.mvp.conduit.lifecycle;

/**
 * Represents the states of an event-stream connection.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * DISCONNECTED ──connect()──▶ CONNECTING ──opened──▶ CONNECTED
 *    ▲   ▲                      │   ▲                  │    │
 *    │   └─── first failure ────┘   │ delay elapsed    │    │ disconnect()
 *    │                              │                  │    ▼
 *    ├◀──── exhausted ──────── RECONNECTING ◀── lost ──┘  CLOSING
 *    │                                                      │
 *    └──────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>State Descriptions</h2>
 *
 * <ul>
 *   <li>{@link #DISCONNECTED}: Initial state, and the state after a close or a final failure
 *   <li>{@link #CONNECTING}: Transport open in progress
 *   <li>{@link #CONNECTED}: Open, subscriptions replayed, heartbeat running
 *   <li>{@link #RECONNECTING}: Waiting out the backoff delay before the next attempt
 *   <li>{@link #CLOSING}: Caller-initiated close in progress
 * </ul>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /**
     * No connection and no attempt pending.
     *
     * <p>Allowed transitions:
     *
     * <ul>
     *   <li>{@link #CONNECTING} - when connect() is called
     * </ul>
     */
    DISCONNECTED(0, "Disconnected", false),

    /**
     * Transport open in progress.
     *
     * <ul>
     *   <li>{@link #CONNECTED} - on success
     *   <li>{@link #DISCONNECTED} - the caller's own connect failed
     *   <li>{@link #RECONNECTING} - an automatic attempt failed and attempts remain
     *   <li>{@link #CLOSING} - if disconnect() is called during the attempt
     * </ul>
     */
    CONNECTING(1, "Connecting", false),

    /**
     * Open and ready. Frames can be sent.
     *
     * <ul>
     *   <li>{@link #RECONNECTING} - unexpected close with auto-reconnect enabled
     *   <li>{@link #CLOSING} - when disconnect() is called
     *   <li>{@link #DISCONNECTED} - unexpected close with auto-reconnect disabled
     * </ul>
     */
    CONNECTED(2, "Connected", true),

    /**
     * Backoff timer armed; the next attempt starts when it fires.
     *
     * <ul>
     *   <li>{@link #CONNECTING} - delay elapsed
     *   <li>{@link #DISCONNECTED} - attempts exhausted
     *   <li>{@link #CLOSING} - when disconnect() is called
     * </ul>
     */
    RECONNECTING(3, "Reconnecting", false),

    /**
     * Caller-initiated close in progress.
     *
     * <ul>
     *   <li>{@link #DISCONNECTED} - when close completes
     * </ul>
     */
    CLOSING(4, "Closing", false);

    private final int order;
    private final String displayName;
    private final boolean active;

    ConnectionState(int order, String displayName, boolean active) {
        this.order = order;
        this.displayName = displayName;
        this.active = active;
    }

    public int order() {
        return order;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Checks if frames can be sent.
     *
     * @return true only in {@link #CONNECTED} state
     */
    public boolean isActive() {
        return active;
    }

    /**
     * Checks if a connection attempt is pending, either running or scheduled.
     *
     * @return true in {@link #CONNECTING} and {@link #RECONNECTING}
     */
    public boolean isPending() {
        return this == CONNECTING || this == RECONNECTING;
    }

    /**
     * Checks if a connect operation can be initiated.
     *
     * @return true only in {@link #DISCONNECTED} state
     */
    public boolean canConnect() {
        return this == DISCONNECTED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
