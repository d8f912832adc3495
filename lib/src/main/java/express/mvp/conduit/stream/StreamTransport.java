package express.mvp.conduit.stream;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens event-stream connections.
 *
 * <p>The transport is the only code that touches sockets. It is injected into {@link
 * ConnectionManager}, so tests replace it with an in-memory fake.
 *
 * @see NettyStreamTransport
 */
public interface StreamTransport extends AutoCloseable {

    /**
     * Opens a connection.
     *
     * @param uri the address, credential included
     * @param listener receives frames and the close of this connection only
     * @return a future completed with the session once the connection is usable, or exceptionally
     *     if it cannot be opened
     */
    CompletableFuture<StreamSession> open(URI uri, StreamListener listener);

    /** Releases transport resources. Open sessions are closed. */
    @Override
    void close();
}
