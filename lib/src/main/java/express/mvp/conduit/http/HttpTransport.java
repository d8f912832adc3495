package express.mvp.conduit.http;

import java.util.concurrent.CompletableFuture;

/**
 * Sends single HTTP exchanges.
 *
 * <p>Implementations never retry and never classify: any response, whatever its status, completes
 * the future normally; only a failure to obtain a response (refused connection, DNS failure,
 * timeout) completes it exceptionally. Cancelling the returned future abandons the exchange.
 *
 * @see JdkHttpTransport
 * @see RequestExecutor
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends one exchange.
     *
     * @param call the exchange to perform
     * @return a future completed with the response
     */
    CompletableFuture<HttpResult> send(HttpCall call);
}
