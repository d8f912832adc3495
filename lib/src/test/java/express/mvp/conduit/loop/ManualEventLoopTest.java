package express.mvp.conduit.loop;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ManualEventLoop}. */
@DisplayName("ManualEventLoop")
class ManualEventLoopTest {

    private ManualEventLoop loop;
    private List<String> log;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        log = new ArrayList<>();
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("Runs tasks immediately")
        void runsImmediately() {
            loop.execute(() -> log.add("a"));
            assertEquals(List.of("a"), log);
        }

        @Test
        @DisplayName("Nested tasks run after the current one")
        void nestedTasksQueued() {
            loop.execute(
                    () -> {
                        log.add("outer-start");
                        loop.execute(() -> log.add("inner"));
                        log.add("outer-end");
                    });
            assertEquals(List.of("outer-start", "outer-end", "inner"), log);
        }

        @Test
        @DisplayName("A failing task does not stop the queue")
        void failingTaskIsolated() {
            loop.execute(
                    () -> {
                        loop.execute(() -> log.add("after"));
                        throw new IllegalStateException("boom");
                    });
            assertEquals(List.of("after"), log);
        }
    }

    @Nested
    @DisplayName("schedule")
    class ScheduleTests {

        @Test
        @DisplayName("Timers fire only when the clock reaches them")
        void firesOnAdvance() {
            loop.schedule(() -> log.add("t"), Duration.ofMillis(100));

            loop.advanceBy(Duration.ofMillis(99));
            assertTrue(log.isEmpty());
            assertEquals(100, loop.nextDeadline());

            loop.advanceBy(Duration.ofMillis(1));
            assertEquals(List.of("t"), log);
            assertEquals(0, loop.pendingTimers());
            assertEquals(-1, loop.nextDeadline());
        }

        @Test
        @DisplayName("Timers fire in deadline order, then scheduling order")
        void deadlineOrder() {
            loop.schedule(() -> log.add("late"), Duration.ofMillis(200));
            loop.schedule(() -> log.add("first"), Duration.ofMillis(100));
            loop.schedule(() -> log.add("second"), Duration.ofMillis(100));

            loop.advanceTo(500);

            assertEquals(List.of("first", "second", "late"), log);
            assertEquals(500, loop.currentTimeMillis());
        }

        @Test
        @DisplayName("Clock reads the deadline inside a firing timer")
        void clockAtDeadline() {
            List<Long> seen = new ArrayList<>();
            loop.schedule(() -> seen.add(loop.currentTimeMillis()), Duration.ofMillis(250));

            loop.advanceBy(Duration.ofSeconds(1));

            assertEquals(List.of(250L), seen);
        }

        @Test
        @DisplayName("Timers scheduled by timers fire within the same advance")
        void chainedTimers() {
            loop.schedule(
                    () -> {
                        log.add("a");
                        loop.schedule(() -> log.add("b"), Duration.ofMillis(100));
                    },
                    Duration.ofMillis(100));

            loop.advanceTo(200);

            assertEquals(List.of("a", "b"), log);
        }

        @Test
        @DisplayName("Cancelled timers never fire")
        void cancelled() {
            Cancellable timer = loop.schedule(() -> log.add("t"), Duration.ofMillis(10));

            assertTrue(timer.cancel());
            assertFalse(timer.cancel());
            loop.advanceBy(Duration.ofSeconds(1));

            assertTrue(log.isEmpty());
        }

        @Test
        @DisplayName("Cancelling a fired timer has no effect")
        void cancelAfterFire() {
            Cancellable timer = loop.schedule(() -> log.add("t"), Duration.ZERO);
            loop.runPending();

            assertFalse(timer.cancel());
            assertEquals(List.of("t"), log);
        }
    }

    @Test
    @DisplayName("close discards timers and rejects new work")
    void close() {
        loop.schedule(() -> log.add("t"), Duration.ofMillis(10));
        loop.close();

        loop.execute(() -> log.add("x"));
        assertSame(Cancellable.NOOP, loop.schedule(() -> log.add("y"), Duration.ZERO));
        loop.advanceBy(Duration.ofSeconds(1));

        assertTrue(log.isEmpty());
        assertEquals(0, loop.pendingTimers());
    }
}
