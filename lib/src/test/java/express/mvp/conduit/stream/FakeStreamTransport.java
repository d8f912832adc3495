package express.mvp.conduit.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.conduit.json.Json;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Scripted {@link StreamTransport}: every open waits until the test accepts or rejects it. */
final class FakeStreamTransport implements StreamTransport {

    final List<PendingOpen> opens = new ArrayList<>();
    boolean closed;

    @Override
    public CompletableFuture<StreamSession> open(URI uri, StreamListener listener) {
        PendingOpen open = new PendingOpen(uri, listener);
        opens.add(open);
        return open.future;
    }

    PendingOpen last() {
        return opens.get(opens.size() - 1);
    }

    @Override
    public void close() {
        closed = true;
    }

    static final class PendingOpen {
        final URI uri;
        final StreamListener listener;
        final CompletableFuture<StreamSession> future = new CompletableFuture<>();
        FakeSession session;

        PendingOpen(URI uri, StreamListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        FakeSession accept() {
            session = new FakeSession();
            future.complete(session);
            return session;
        }

        void reject(Throwable error) {
            future.completeExceptionally(error);
        }

        /** Delivers an inbound frame as the socket would. */
        void receive(String frame) {
            listener.onMessage(frame);
        }

        void serverClose(int code, String reason) {
            listener.onClose(code, reason);
        }
    }

    static final class FakeSession implements StreamSession {
        final List<String> sent = new ArrayList<>();
        final List<String> closes = new ArrayList<>();

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close(int code, String reason) {
            closes.add(code + " " + reason);
        }

        List<JsonNode> sentOfType(String type) {
            List<JsonNode> frames = new ArrayList<>();
            for (String text : sent) {
                JsonNode node = parse(text);
                if (type.equals(node.path("type").asText())) {
                    frames.add(node);
                }
            }
            return frames;
        }

        private static JsonNode parse(String text) {
            try {
                return Json.read(text);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
