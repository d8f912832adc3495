package express.mvp.conduit.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/** {@link HttpTransport} on top of the JDK {@link HttpClient}. */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger LOGGER = Logger.getLogger(JdkHttpTransport.class.getName());

    /** Default TCP connect timeout of the owned client. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;

    /** Creates a transport with its own client. */
    public JdkHttpTransport() {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build());
    }

    /**
     * Creates a transport sharing an existing client.
     *
     * @param client the client
     */
    public JdkHttpTransport(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<HttpResult> send(HttpCall call) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder().uri(call.uri()).timeout(call.timeout());
        call.headers().forEach(builder::header);
        builder.method(
                call.method(),
                call.body() != null
                        ? HttpRequest.BodyPublishers.ofString(call.body())
                        : HttpRequest.BodyPublishers.noBody());

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(call.method() + " " + call.uri());
        }
        return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new HttpResult(response.statusCode(), response.body()));
    }
}
