package com.questrail.assetexport.connection.transport.netty;

import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.connection.transport.WorkerTransport;
import com.questrail.assetexport.connection.transport.WorkerTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyWebSocketWorkerTransport
 * =============================================================================
 * Netty-backed implementation of the {@link WorkerTransport} port: a WebSocket
 * client speaking text frames to the worker on {@code ws://host:port/}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * JSON, correlate requests, or retry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, frames) MUST NOT
 * escape this package, except for the event loop group handed in by the
 * composition root.
 *
 * <h2>Lifecycle</h2>
 * - {@link #open(String, int, Duration)} connects and performs the WebSocket upgrade.
 * - {@link #close()} closes the channel. The event loop group is owned by the
 *   caller and is not shut down here.
 */
public final class NettyWebSocketWorkerTransport implements WorkerTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketWorkerTransport.class);

    static final int MAX_MESSAGE_BYTES = 1 << 20;

    private final EventLoopGroup group;

    private volatile WorkerTransportListener listener;
    private volatile Channel channel;
    private volatile boolean closedLocally;

    public NettyWebSocketWorkerTransport(EventLoopGroup group)
    {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public void setListener(WorkerTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public CompletableFuture<Void> open(String host, int port, Duration timeout)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");
        WorkerTransportListener l = requireListener();

        if (channel != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport already open"));
        }

        URI uri = URI.create("ws://" + host + ":" + port + "/");
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), MAX_MESSAGE_BYTES);

        CompletableFuture<Void> opened = new CompletableFuture<>();
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_MESSAGE_BYTES));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker, timeoutMillis));
                        p.addLast(new WebSocketFrameAggregator(MAX_MESSAGE_BYTES));
                        p.addLast(new InboundHandler(opened, l));
                    }
                });

        log.debug("Connecting to export worker at {}", uri);

        ChannelFuture connect = bootstrap.connect(host, port);
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                opened.completeExceptionally(new WorkerConnectionException(
                        "Could not connect to export worker at " + uri, future.cause()));
            }
        });
        return opened;
    }

    @Override
    public CompletableFuture<Void> sendText(String message)
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(
                    new WorkerConnectionException("Export worker transport is not connected"));
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ch.writeAndFlush(new TextWebSocketFrame(message)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(new WorkerConnectionException(
                        "Failed to send to export worker", future.cause()));
            }
        });
        return written;
    }

    @Override
    public CompletableFuture<Void> close()
    {
        closedLocally = true;
        Channel ch = channel;
        channel = null;
        if (ch == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> closed = new CompletableFuture<>();
        ch.close().addListener(future -> closed.complete(null));
        return closed;
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private WorkerTransportListener requireListener()
    {
        WorkerTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("WorkerTransportListener must be set before open()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Completes the open future once the upgrade finishes and forwards complete
     * text messages to the port listener. Reports a drop at most once, and not
     * at all after a local {@link #close()}.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
    {
        private final CompletableFuture<Void> opened;
        private final WorkerTransportListener l;
        private boolean reportedDown;

        private InboundHandler(CompletableFuture<Void> opened, WorkerTransportListener l)
        {
            this.opened = opened;
            this.l = l;
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                channel = ctx.channel();
                log.debug("Export worker connection established: {}", ctx.channel().remoteAddress());
                opened.complete(null);
                l.onTransportUp();
                return;
            }
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                opened.completeExceptionally(new WorkerConnectionException("Export worker handshake timed out"));
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
        {
            l.onText(frame.text());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            if (channel == ctx.channel()) {
                channel = null;
            }
            boolean wasOpen = !opened.completeExceptionally(
                    new WorkerConnectionException("Export worker closed the connection during handshake"));
            if (wasOpen) {
                log.debug("Export worker connection closed");
                reportDown(null);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            boolean wasOpen = !opened.completeExceptionally(
                    new WorkerConnectionException("Export worker handshake failed", cause));
            if (wasOpen) {
                log.debug("Export worker connection failed", cause);
                reportDown(cause);
            }
            ctx.close();
        }

        // Runs on the channel's event loop only.
        private void reportDown(Throwable cause)
        {
            if (reportedDown || closedLocally) {
                return;
            }
            reportedDown = true;
            l.onTransportDown(cause);
        }
    }
}
