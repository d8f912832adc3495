/**
 * Connection lifecycle states and the state machine guarding their transitions.
 *
 * @see express.mvp.conduit.stream.ConnectionManager
 */
package express.mvp.conduit.lifecycle;
