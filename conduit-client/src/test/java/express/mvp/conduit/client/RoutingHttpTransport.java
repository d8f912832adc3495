package express.mvp.conduit.client;

import express.mvp.conduit.http.HttpCall;
import express.mvp.conduit.http.HttpResult;
import express.mvp.conduit.http.HttpTransport;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpTransport} answering by method and path. Each route replays its responses in order
 * and keeps repeating the last one. Unknown routes answer 404.
 */
final class RoutingHttpTransport implements HttpTransport {

    final List<HttpCall> calls = new ArrayList<>();
    private final Map<String, Deque<HttpResult>> routes = new HashMap<>();

    RoutingHttpTransport on(String method, String pathAndQuery, int status, String body) {
        routes.computeIfAbsent(method + " " + pathAndQuery, k -> new ArrayDeque<>())
                .add(new HttpResult(status, body));
        return this;
    }

    /** Answers 200 with {@code data} wrapped in the success envelope. */
    RoutingHttpTransport ok(String method, String pathAndQuery, String data) {
        return on(method, pathAndQuery, 200, "{\"success\":true,\"data\":" + data + "}");
    }

    @Override
    public CompletableFuture<HttpResult> send(HttpCall call) {
        calls.add(call);
        Deque<HttpResult> responses = routes.get(key(call));
        if (responses == null || responses.isEmpty()) {
            String body = "{\"error\":{\"message\":\"No route " + key(call) + "\"}}";
            return CompletableFuture.completedFuture(new HttpResult(404, body));
        }
        HttpResult next = responses.size() > 1 ? responses.poll() : responses.peek();
        return CompletableFuture.completedFuture(next);
    }

    static String key(HttpCall call) {
        String query = call.uri().getRawQuery();
        return call.method() + " " + call.uri().getRawPath() + (query != null ? "?" + query : "");
    }

    List<String> routesCalled() {
        List<String> keys = new ArrayList<>();
        calls.forEach(call -> keys.add(key(call)));
        return keys;
    }

    HttpCall last() {
        return calls.get(calls.size() - 1);
    }
}
