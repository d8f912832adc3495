/**
 * Event stream: one long-lived WebSocket connection with heartbeat, reconnect and subscription
 * replay, plus envelope dispatch.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.conduit.stream.EventStreamClient} - Facade most callers use
 *   <li>{@link express.mvp.conduit.stream.ConnectionManager} - Connection lifecycle
 *   <li>{@link express.mvp.conduit.stream.SubscriptionRegistry} - Subscriptions that survive
 *       reconnects
 *   <li>{@link express.mvp.conduit.stream.EventDispatcher} - Listener routing and waits
 *   <li>{@link express.mvp.conduit.stream.StreamTransport} - Socket seam, {@link
 *       express.mvp.conduit.stream.NettyStreamTransport} in production
 * </ul>
 *
 * <h2>Wire Format</h2>
 *
 * <p>Outbound control frames:
 *
 * <pre>
 * {"type":"subscribe","subscriptionId":"sub_...","event":"task.completed","filter":{...}}
 * {"type":"unsubscribe","subscriptionId":"sub_..."}
 * {"type":"ping"}
 * </pre>
 *
 * <p>Inbound envelopes: {@code {"type":..., "payload":..., "timestamp":..., "correlationId":...}}.
 */
package express.mvp.conduit.stream;
