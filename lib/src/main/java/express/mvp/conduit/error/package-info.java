/**
 * Error taxonomy, classification and retry arithmetic.
 *
 * <p>This package provides components for classifying failed calls, implementing retry
 * strategies, and reporting structured failures to callers.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.conduit.error.ErrorKind} - Discriminant of every failure
 *   <li>{@link express.mvp.conduit.error.ErrorClassifier} - Maps status codes and transport
 *       failures to kinds
 *   <li>{@link express.mvp.conduit.error.RetryPolicy} - Exponential backoff with jitter
 *   <li>{@link express.mvp.conduit.error.RetryContext} - Tracks attempts of one operation
 * </ul>
 *
 * <h2>Propagation</h2>
 *
 * <ul>
 *   <li><b>Transient</b> (NETWORK, TIMEOUT, SERVER, RATE_LIMITED): retried, then surfaced as
 *       {@link express.mvp.conduit.error.MaxRetriesExceededException}
 *   <li><b>Permanent</b> (AUTHENTICATION, AUTHORIZATION, NOT_FOUND, VALIDATION): surfaced on first
 *       occurrence
 *   <li><b>Stream</b> (CONNECTION): delivered to error listeners, never thrown
 * </ul>
 *
 * @see express.mvp.conduit.http.RequestExecutor
 */
package express.mvp.conduit.error;
