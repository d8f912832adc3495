package express.mvp.conduit.config;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.conduit.error.RetryPolicy;
import express.mvp.conduit.stream.MalformedFramePolicy;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StreamConfig}. */
@DisplayName("StreamConfig")
class StreamConfigTest {

    @Test
    @DisplayName("Applies defaults")
    void defaults() {
        StreamConfig config = StreamConfig.builder().url("ws://localhost:8080/ws").build();

        assertTrue(config.autoReconnect());
        assertEquals(Duration.ofSeconds(1), config.reconnectInterval());
        assertEquals(10, config.maxReconnectAttempts());
        assertEquals(Duration.ofSeconds(30), config.heartbeatInterval());
        assertEquals(Duration.ofSeconds(10), config.heartbeatTimeout());
        assertEquals(MalformedFramePolicy.REPORT, config.malformedFramePolicy());
    }

    @Test
    @DisplayName("Credential is appended as a query parameter")
    void connectUri() {
        assertEquals(
                URI.create("ws://h/ws"),
                StreamConfig.builder().url("ws://h/ws").build().connectUri());
        assertEquals(
                URI.create("ws://h/ws?apiKey=a%2Bb"),
                StreamConfig.builder().url("ws://h/ws").apiKey("a+b").build().connectUri());
        assertEquals(
                URI.create("ws://h/ws?v=1&apiKey=k"),
                StreamConfig.builder().url("ws://h/ws?v=1").apiKey("k").build().connectUri());
    }

    @Test
    @DisplayName("Reconnect policy uses the interval and the fixed cap")
    void reconnectPolicy() {
        RetryPolicy policy =
                StreamConfig.builder()
                        .url("ws://h")
                        .reconnectInterval(Duration.ofMillis(250))
                        .maxReconnectAttempts(3)
                        .build()
                        .reconnectPolicy();

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(250, policy.getInitialDelayMillis());
        assertEquals(StreamConfig.MAX_RECONNECT_DELAY.toMillis(), policy.getMaxDelayMillis());
    }

    @Test
    @DisplayName("toBuilder copies every field")
    void toBuilder() {
        StreamConfig original =
                StreamConfig.builder()
                        .url("ws://h")
                        .apiKey("k")
                        .autoReconnect(false)
                        .maxReconnectAttempts(2)
                        .heartbeatInterval(Duration.ofSeconds(5))
                        .malformedFramePolicy(MalformedFramePolicy.DROP)
                        .build();

        StreamConfig copy = original.toBuilder().build();

        assertEquals(original.toString(), copy.toString());
        assertEquals(original.connectUri(), copy.connectUri());
    }

    @Test
    @DisplayName("Rejects invalid values")
    void rejectsInvalid() {
        assertThrows(IllegalStateException.class, () -> StreamConfig.builder().build());
        assertThrows(
                IllegalArgumentException.class,
                () -> StreamConfig.builder().maxReconnectAttempts(-1));
        assertThrows(
                IllegalArgumentException.class,
                () -> StreamConfig.builder().heartbeatTimeout(Duration.ZERO));
    }
}
