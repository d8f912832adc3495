package express.mvp.conduit.stream;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.conduit.json.Json;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SubscriptionRegistry}. */
@DisplayName("SubscriptionRegistry")
class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;
    private List<String> sent;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        registry = new SubscriptionRegistry(() -> "sub-" + ids.incrementAndGet());
        sent = new ArrayList<>();
    }

    private static JsonNode parse(String frame) throws Exception {
        return Json.read(frame);
    }

    @Nested
    @DisplayName("While detached")
    class DetachedTests {

        @Test
        @DisplayName("Subscriptions are recorded but nothing is sent")
        void recordsOnly() {
            String id = registry.subscribe(SubscriptionSpec.of(EventType.TASK_COMPLETED));

            assertEquals("sub-1", id);
            assertEquals(1, registry.size());
            assertFalse(registry.isAttached());
            assertTrue(registry.get(id).isPresent());
        }

        @Test
        @DisplayName("Unsubscribe of an unknown id is a no-op")
        void unknownUnsubscribe() {
            assertFalse(registry.unsubscribe("sub-404"));
        }
    }

    @Nested
    @DisplayName("attach")
    class AttachTests {

        @Test
        @DisplayName("Replays every subscription once, in insertion order")
        void replaysInOrder() throws Exception {
            registry.subscribe(SubscriptionSpec.of(EventType.TASK_COMPLETED));
            registry.subscribe(
                    SubscriptionSpec.of(EventType.TASK_UPDATED, EventType.TASK_FAILED)
                            .withFilter("taskId", "t-1"));

            int replayed = registry.attach(sent::add);

            assertEquals(2, replayed);
            assertEquals(2, sent.size());
            JsonNode first = parse(sent.get(0));
            assertEquals("subscribe", first.path("type").asText());
            assertEquals("sub-1", first.path("subscriptionId").asText());
            assertEquals("task.completed", first.path("event").asText());
            assertTrue(first.path("filter").isMissingNode());

            JsonNode second = parse(sent.get(1));
            assertTrue(second.path("event").isArray());
            assertEquals("task.updated", second.path("event").get(0).asText());
            assertEquals("t-1", second.path("filter").path("taskId").asText());
        }

        @Test
        @DisplayName("Sends new subscriptions and unsubscribes immediately")
        void liveUpdates() throws Exception {
            registry.attach(sent::add);

            String id = registry.subscribe(SubscriptionSpec.of(EventType.DAG_STARTED));
            assertTrue(registry.unsubscribe(id));

            assertEquals(2, sent.size());
            assertEquals("subscribe", parse(sent.get(0)).path("type").asText());
            JsonNode unsubscribe = parse(sent.get(1));
            assertEquals("unsubscribe", unsubscribe.path("type").asText());
            assertEquals(id, unsubscribe.path("subscriptionId").asText());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("Removed subscriptions are not replayed")
        void removedNotReplayed() {
            String id = registry.subscribe(SubscriptionSpec.of(EventType.TASK_COMPLETED));
            registry.subscribe(SubscriptionSpec.of(EventType.LOG_MESSAGE));
            registry.unsubscribe(id);

            registry.attach(sent::add);

            assertEquals(1, sent.size());
        }

        @Test
        @DisplayName("Detach stops sending")
        void detachStopsSending() {
            registry.attach(sent::add);
            registry.detach();

            registry.subscribe(SubscriptionSpec.of(EventType.TASK_COMPLETED));

            assertTrue(sent.isEmpty());
            assertEquals(1, registry.subscriptions().size());
        }
    }

    @Test
    @DisplayName("Generated ids carry the sub_ prefix and are unique")
    void generatedIds() {
        String a = SubscriptionRegistry.newSubscriptionId();
        String b = SubscriptionRegistry.newSubscriptionId();

        assertTrue(a.startsWith("sub_"));
        assertNotEquals(a, b);
    }

    @Nested
    @DisplayName("SubscriptionSpec")
    class SpecTests {

        private EventEnvelope envelope(String type, String payload) throws Exception {
            return new EventEnvelope(type, Json.read(payload), null, null);
        }

        @Test
        @DisplayName("Matches type and every filter field")
        void matches() throws Exception {
            SubscriptionSpec spec =
                    SubscriptionSpec.of(EventType.TASK_COMPLETED).withFilter("taskId", "t-1");

            assertTrue(spec.matches(envelope("task.completed", "{\"taskId\":\"t-1\"}")));
            assertFalse(spec.matches(envelope("task.completed", "{\"taskId\":\"t-2\"}")));
            assertFalse(spec.matches(envelope("task.failed", "{\"taskId\":\"t-1\"}")));
            assertFalse(spec.matches(envelope("task.completed", "{}")));
        }

        @Test
        @DisplayName("Filters compare numbers by their text")
        void numericFilter() throws Exception {
            SubscriptionSpec spec =
                    SubscriptionSpec.ofNames(List.of("custom")).withFilter("n", "7");

            assertTrue(spec.matches(envelope("custom", "{\"n\":7}")));
        }

        @Test
        @DisplayName("Requires at least one event type")
        void requiresEvents() {
            assertThrows(
                    IllegalArgumentException.class, () -> SubscriptionSpec.ofNames(List.of()));
        }
    }
}
