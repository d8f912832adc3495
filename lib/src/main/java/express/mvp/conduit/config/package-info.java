/** Immutable client and event-stream configuration, built in code or read from properties. */
package express.mvp.conduit.config;
