package com.questrail.hostlink.transport.tcp.netty;

import com.questrail.hostlink.transport.StreamConnection;
import com.questrail.hostlink.transport.StreamEndpoint;
import com.questrail.hostlink.transport.StreamEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.json.JsonObjectDecoder;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames JSON
 * documents, enforces timeouts and the one-outstanding-frame rule, and writes
 * replies. It never decodes commands.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Frames are copied into
 * {@code byte[]}; connections are exposed only as {@link StreamConnection}.
 *
 * <h2>Per-connection pipeline</h2>
 * <pre>
 *   IdleStateHandler     → closes a connection idle for longer than idleTimeout
 *   WriteTimeoutHandler  → closes a connection whose reply cannot be flushed
 *   JsonObjectDecoder    → accumulates partial reads into complete JSON frames
 *   ConnectionHandler    → one outstanding frame at a time, in arrival order
 * </pre>
 *
 * <p>A connection that is waiting for its reply is never closed for being idle;
 * the listener's response timeout governs that wait. Each connection is bound to
 * one worker event loop and never shared; a slow command only holds back the
 * connection that submitted it.</p>
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    /** Frames held per connection before reading is paused. */
    static final int MAX_HELD_FRAMES = 16;

    private final InetSocketAddress bindAddress;
    private final int maxFrameLength;
    private final Duration idleTimeout;
    private final Duration writeTimeout;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final ChannelGroup connections = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicBoolean up = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpStreamEndpoint(InetSocketAddress bindAddress,
                                  int maxFrameLength,
                                  Duration idleTimeout,
                                  Duration writeTimeout)
    {
        this(bindAddress, maxFrameLength, idleTimeout, writeTimeout, 0);
    }

    /**
     * @param workerThreads I/O threads shared by all connections; 0 selects
     *                      Netty's default
     */
    public NettyTcpStreamEndpoint(InetSocketAddress bindAddress,
                                  int maxFrameLength,
                                  Duration idleTimeout,
                                  Duration writeTimeout,
                                  int workerThreads)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        if (maxFrameLength < 2) {
            throw new IllegalArgumentException("maxFrameLength must be >= 2");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0");
        }
        this.maxFrameLength = maxFrameLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(workerThreads);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        connections.add(ch);
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("idle", new IdleStateHandler(
                                0, 0, NettyTcpStreamEndpoint.this.idleTimeout.toMillis(), TimeUnit.MILLISECONDS));
                        p.addLast("writeTimeout", new WriteTimeoutHandler(
                                NettyTcpStreamEndpoint.this.writeTimeout.toMillis(), TimeUnit.MILLISECONDS));
                        p.addLast("framer", new JsonObjectDecoder(NettyTcpStreamEndpoint.this.maxFrameLength));
                        p.addLast("connection", new ConnectionHandler(connectionIds.incrementAndGet()));
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();
        if (serverChannel != null) {
            throw new IllegalStateException("TCP endpoint already started on " + serverChannel.localAddress());
        }

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            l.onTransportDown(f.cause());
            shutdownGroups();
            throw new IllegalStateException("Failed to bind TCP endpoint on " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        if (up.compareAndSet(false, true)) {
            l.onTransportUp();
        }
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        connections.close().awaitUninterruptibly();
        shutdownGroups();

        StreamEndpointListener l = listener;
        if (l != null && up.compareAndSet(true, false)) {
            l.onTransportDown(null);
        }
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch != null ? ch.localAddress() : null;
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Owns the state of one connection. Every method runs on the connection's
     * event loop, so no field needs synchronization.
     */
    private final class ConnectionHandler extends ChannelInboundHandlerAdapter
    {
        private final long id;
        private final ArrayDeque<byte[]> heldFrames = new ArrayDeque<>();

        private NettyStreamConnection connection;
        private boolean awaitingReply;
        private Throwable pendingFrameError;
        private boolean frameErrorDelivered;
        private Throwable closeCause;

        ConnectionHandler(long id)
        {
            this.id = id;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            connection = new NettyStreamConnection(ctx.channel(), id, this);
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(connection);
            }
            super.channelActive(ctx);
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ByteBuf frame = (ByteBuf) msg;
            byte[] bytes;
            try {
                bytes = new byte[frame.readableBytes()];
                frame.getBytes(frame.readerIndex(), bytes);
            } finally {
                frame.release();
            }

            if (frameErrorDelivered || pendingFrameError != null) {
                return;
            }
            heldFrames.add(bytes);
            if (heldFrames.size() >= MAX_HELD_FRAMES) {
                ctx.channel().config().setAutoRead(false);
            }
            deliverNext(ctx.channel());
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent) {
                if (!awaitingReply) {
                    closeCause = new IdleConnectionException(idleTimeout);
                    ctx.close();
                }
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof DecoderException) {
                // The byte stream cannot be resynchronized; answer once, then close.
                ctx.channel().config().setAutoRead(false);
                heldFrames.clear();
                if (pendingFrameError == null && !frameErrorDelivered) {
                    pendingFrameError = cause;
                    deliverFrameErrorIfIdle();
                }
                return;
            }
            closeCause = cause;
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            heldFrames.clear();
            StreamEndpointListener l = listener;
            if (l != null && connection != null) {
                l.onConnectionClosed(connection, closeCause);
            }
            super.channelInactive(ctx);
        }

        void replyWritten(Channel channel)
        {
            awaitingReply = false;
            if (pendingFrameError != null) {
                deliverFrameErrorIfIdle();
                return;
            }
            if (!channel.config().isAutoRead() && heldFrames.size() < MAX_HELD_FRAMES) {
                channel.config().setAutoRead(true);
            }
            deliverNext(channel);
        }

        void replyFailed(Channel channel, Throwable cause)
        {
            if (closeCause == null) {
                closeCause = cause;
            }
            channel.close();
        }

        private void deliverNext(Channel channel)
        {
            if (awaitingReply || heldFrames.isEmpty() || !channel.isActive()) {
                return;
            }
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }
            awaitingReply = true;
            byte[] frame = heldFrames.poll();
            try {
                l.onFrame(connection, frame);
            } catch (RuntimeException e) {
                closeCause = e;
                channel.close();
            }
        }

        private void deliverFrameErrorIfIdle()
        {
            StreamEndpointListener l = listener;
            if (awaitingReply || l == null) {
                return;
            }
            Throwable cause = pendingFrameError;
            pendingFrameError = null;
            frameErrorDelivered = true;
            awaitingReply = true;
            closeCause = cause;
            try {
                l.onFrameError(connection, cause);
            } catch (RuntimeException e) {
                connection.close();
            }
        }
    }

    /**
     * StreamConnection view of one channel. Safe to use from any thread; Netty
     * hands writes to the channel's event loop and flushes them completely.
     */
    private static final class NettyStreamConnection implements StreamConnection
    {
        private final Channel channel;
        private final long id;
        private final ConnectionHandler handler;

        NettyStreamConnection(Channel channel, long id, ConnectionHandler handler)
        {
            this.channel = channel;
            this.id = id;
            this.handler = handler;
        }

        @Override
        public long id()
        {
            return id;
        }

        @Override
        public SocketAddress remoteAddress()
        {
            return channel.remoteAddress();
        }

        @Override
        public boolean isOpen()
        {
            return channel.isActive();
        }

        @Override
        public void reply(byte[] payload)
        {
            Objects.requireNonNull(payload, "payload");
            channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) f -> {
                // Listeners of channel futures run on the channel's event loop.
                if (f.isSuccess()) {
                    handler.replyWritten(f.channel());
                }
                else {
                    handler.replyFailed(f.channel(), f.cause());
                }
            });
        }

        @Override
        public void replyAndClose(byte[] payload)
        {
            Objects.requireNonNull(payload, "payload");
            channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void close()
        {
            channel.close();
        }

        @Override
        public String toString()
        {
            return "connection#" + id + " " + channel.remoteAddress();
        }
    }
}
