/**
 * Single-threaded event loops.
 *
 * <p>{@link express.mvp.conduit.loop.SingleThreadEventLoop} runs production work on one daemon
 * thread; the test suite's {@code ManualEventLoop} runs the same code under a virtual
 * clock for deterministic tests.
 */
package express.mvp.conduit.loop;
