package express.mvp.conduit.http;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP exchange as handed to an {@link HttpTransport}.
 *
 * @param method the upper-case verb
 * @param uri the absolute target
 * @param headers the request headers
 * @param body the JSON body, or null for none
 * @param timeout the response deadline
 */
public record HttpCall(
        String method, URI uri, Map<String, String> headers, String body, Duration timeout) {

    public HttpCall {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(timeout, "timeout");
        headers =
                headers == null
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
