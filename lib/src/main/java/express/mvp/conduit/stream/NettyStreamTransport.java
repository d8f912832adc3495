package express.mvp.conduit.stream;

import express.mvp.conduit.loop.EventLoopThreadFactory;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.SSLException;

/**
 * {@link StreamTransport} over a Netty WebSocket client.
 *
 * <p>Each {@link #open} builds a fresh pipeline with its own handshaker, so nothing of a previous
 * connection survives into the next one. Frames larger than one WebSocket frame are reassembled
 * before delivery. Server pings are answered with pongs; they are not delivered as messages.
 *
 * <p>The transport creates and owns a small daemon {@link NioEventLoopGroup} unless one is passed
 * in, in which case the caller keeps ownership.
 */
public final class NettyStreamTransport implements StreamTransport {

    private static final Logger LOGGER = Logger.getLogger(NettyStreamTransport.class.getName());

    private static final int MAX_FRAME_BYTES = 1 << 20;
    private static final int MAX_HTTP_CONTENT = 65536;

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final Duration connectTimeout;

    /** Creates a transport with its own single-threaded I/O group. */
    public NettyStreamTransport() {
        this(Duration.ofSeconds(10));
    }

    /**
     * Creates a transport with its own single-threaded I/O group.
     *
     * @param connectTimeout TCP connect timeout
     */
    public NettyStreamTransport(Duration connectTimeout) {
        this(
                new NioEventLoopGroup(1, new EventLoopThreadFactory("conduit-netty")),
                true,
                connectTimeout);
    }

    /**
     * Creates a transport on a shared I/O group.
     *
     * @param group the group, still owned by the caller
     * @param connectTimeout TCP connect timeout
     */
    public NettyStreamTransport(EventLoopGroup group, Duration connectTimeout) {
        this(group, false, connectTimeout);
    }

    private NettyStreamTransport(EventLoopGroup group, boolean ownsGroup, Duration connectTimeout) {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<StreamSession> open(URI uri, StreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        CompletableFuture<StreamSession> result = new CompletableFuture<>();
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        if (!secure && !"ws".equalsIgnoreCase(uri.getScheme())) {
            result.completeExceptionally(
                    new IllegalArgumentException("Unsupported scheme: " + uri.getScheme()));
            return result;
        }

        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            result.completeExceptionally(e);
            return result;
        }
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        ClientHandler handler =
                new ClientHandler(
                        WebSocketClientHandshakerFactory.newHandshaker(
                                uri,
                                WebSocketVersion.V13,
                                null,
                                true,
                                new DefaultHttpHeaders(),
                                MAX_FRAME_BYTES),
                        listener,
                        result);

        Bootstrap bootstrap =
                new Bootstrap()
                        .group(group)
                        .channel(NioSocketChannel.class)
                        .option(ChannelOption.TCP_NODELAY, true)
                        .option(ChannelOption.SO_KEEPALIVE, true)
                        .option(
                                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                                (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                        .handler(
                                new ChannelInitializer<SocketChannel>() {
                                    @Override
                                    protected void initChannel(SocketChannel ch) {
                                        ChannelPipeline p = ch.pipeline();
                                        if (sslContext != null) {
                                            p.addLast(
                                                    sslContext.newHandler(ch.alloc(), host, port));
                                        }
                                        p.addLast(new HttpClientCodec());
                                        p.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
                                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                                        p.addLast(handler);
                                    }
                                });

        LOGGER.fine(() -> "Opening " + uri.getScheme() + "://" + host + ":" + port + uri.getPath());
        ChannelFuture connecting = bootstrap.connect(host, port);
        connecting.addListener(
                (ChannelFutureListener) f -> {
                    if (!f.isSuccess()) {
                        result.completeExceptionally(f.cause());
                    }
                });
        return result;
    }

    @Override
    public void close() {
        if (!ownsGroup) {
            return;
        }
        try {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.log(Level.WARNING, "Interrupted while shutting down event loop group", e);
        }
    }

    /** Session over an open channel. */
    private static final class ChannelSession implements StreamSession {
        private final Channel channel;

        ChannelSession(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(String text) {
            channel.writeAndFlush(new TextWebSocketFrame(text))
                    .addListener(
                            (ChannelFutureListener) f -> {
                                if (!f.isSuccess()) {
                                    LOGGER.log(Level.FINE, "Frame write failed", f.cause());
                                }
                            });
        }

        @Override
        public void close(int code, String reason) {
            if (!channel.isActive()) {
                return;
            }
            channel.writeAndFlush(new CloseWebSocketFrame(code, reason))
                    .addListener((ChannelFutureListener) f -> channel.close());
        }
    }

    private static final class ClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private final StreamListener listener;
        private final CompletableFuture<StreamSession> opened;
        private final AtomicBoolean closeReported = new AtomicBoolean();
        private ChannelPromise handshakeFuture;
        private int closeCode = StreamSession.ABNORMAL_CLOSURE;
        private String closeReason = "";

        ClientHandler(
                WebSocketClientHandshaker handshaker,
                StreamListener listener,
                CompletableFuture<StreamSession> opened) {
            this.handshaker = handshaker;
            this.listener = listener;
            this.opened = opened;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                WebSocketHandshakeException e =
                        new WebSocketHandshakeException("Connection closed during handshake");
                handshakeFuture.setFailure(e);
                opened.completeExceptionally(e);
                return;
            }
            if (opened.isDone()
                    && !opened.isCompletedExceptionally()
                    && closeReported.compareAndSet(false, true)) {
                listener.onClose(closeCode, closeReason);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                        opened.complete(new ChannelSession(ch));
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                        opened.completeExceptionally(e);
                        ch.close();
                    }
                }
                return;
            }

            if (msg instanceof TextWebSocketFrame text) {
                listener.onMessage(text.text());
            } else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            } else if (msg instanceof CloseWebSocketFrame close) {
                closeCode =
                        close.statusCode() > 0 ? close.statusCode() : StreamSession.NORMAL_CLOSURE;
                closeReason = close.reasonText() != null ? close.reasonText() : "";
                ch.close();
            } else if (msg instanceof FullHttpResponse response) {
                LOGGER.warning("Unexpected HTTP response on open stream: " + response.status());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
                opened.completeExceptionally(cause);
            } else {
                listener.onError(cause);
            }
            ctx.close();
        }
    }
}
