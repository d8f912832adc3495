/**
 * Request/response calls with timeout, retry and cancellation.
 *
 * <p>{@link express.mvp.conduit.http.RequestExecutor} turns one logical call into attempts sent
 * through an {@link express.mvp.conduit.http.HttpTransport}. The transport is injected, so tests
 * drive the executor with scripted responses.
 */
package express.mvp.conduit.http;
