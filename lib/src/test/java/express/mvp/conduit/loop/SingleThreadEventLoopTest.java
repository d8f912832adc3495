package express.mvp.conduit.loop;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link SingleThreadEventLoop}. */
@DisplayName("SingleThreadEventLoop")
class SingleThreadEventLoopTest {

    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SingleThreadEventLoop("test-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    @DisplayName("Tasks run on the named loop thread")
    void runsOnLoopThread() throws Exception {
        CompletableFuture<String> name = new CompletableFuture<>();
        CompletableFuture<Boolean> inLoop = new CompletableFuture<>();
        loop.execute(
                () -> {
                    name.complete(Thread.currentThread().getName());
                    inLoop.complete(loop.inEventLoop());
                });

        assertTrue(name.get(5, TimeUnit.SECONDS).startsWith("test-loop"));
        assertTrue(inLoop.get(5, TimeUnit.SECONDS));
        assertFalse(loop.inEventLoop());
    }

    @Test
    @DisplayName("Scheduled tasks run after their delay")
    void scheduled() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        loop.schedule(fired::countDown, Duration.ofMillis(20));

        assertTrue(fired.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Cancelled tasks do not run")
    void cancelled() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        Cancellable timer = loop.schedule(() -> ran.set(true), Duration.ofMillis(200));

        assertTrue(timer.cancel());
        CountDownLatch later = new CountDownLatch(1);
        loop.schedule(later::countDown, Duration.ofMillis(400));

        assertTrue(later.await(5, TimeUnit.SECONDS));
        assertFalse(ran.get());
    }

    @Test
    @DisplayName("A failing task does not kill the loop")
    void survivesFailure() throws Exception {
        loop.execute(
                () -> {
                    throw new IllegalStateException("boom");
                });
        CountDownLatch next = new CountDownLatch(1);
        loop.execute(next::countDown);

        assertTrue(next.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Work submitted after close is dropped")
    void afterClose() {
        loop.close();

        assertTrue(loop.isClosed());
        assertDoesNotThrow(() -> loop.execute(() -> {}));
        assertSame(Cancellable.NOOP, loop.schedule(() -> {}, Duration.ZERO));
    }
}
