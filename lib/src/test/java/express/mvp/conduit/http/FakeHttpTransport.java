package express.mvp.conduit.http;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Scripted {@link HttpTransport}. Unscripted calls hang until completed by the test. */
final class FakeHttpTransport implements HttpTransport {

    final List<HttpCall> calls = new ArrayList<>();
    final List<CompletableFuture<HttpResult>> hanging = new ArrayList<>();
    private final Deque<Object> script = new ArrayDeque<>();

    FakeHttpTransport respond(int status, String body) {
        script.add(new HttpResult(status, body));
        return this;
    }

    FakeHttpTransport respondTimes(int times, int status, String body) {
        for (int i = 0; i < times; i++) {
            respond(status, body);
        }
        return this;
    }

    FakeHttpTransport fail(Throwable error) {
        script.add(error);
        return this;
    }

    @Override
    public CompletableFuture<HttpResult> send(HttpCall call) {
        calls.add(call);
        Object next = script.poll();
        if (next instanceof HttpResult result) {
            return CompletableFuture.completedFuture(result);
        }
        if (next instanceof Throwable error) {
            return CompletableFuture.failedFuture(error);
        }
        CompletableFuture<HttpResult> pending = new CompletableFuture<>();
        hanging.add(pending);
        return pending;
    }
}
