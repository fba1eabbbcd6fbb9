package com.questrail.remotedisplay.transport.netty;

import com.questrail.remotedisplay.auth.AuthenticationFailedException;
import com.questrail.remotedisplay.observability.DisplayErrorEvent;
import com.questrail.remotedisplay.observability.TransportObservabilityEvent;
import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.session.DisplaySession;
import com.questrail.remotedisplay.session.PacketHandler;
import com.questrail.remotedisplay.session.SessionEnvironment;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyDisplayServer
 * =============================================================================
 * TCP listener that runs one {@link DisplaySession} per accepted connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>transport adapter</strong>: it frames the byte
 * stream and hands frames to the session. It does not interpret handshake or
 * application packets.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Sessions see only
 * {@code StreamTransport} and {@code Frame}.
 *
 * <h2>Error policy</h2>
 * A {@link FrameFormatException} is a protocol desync: the channel is closed.
 * Any other exception closes the channel as well and is reported to the sink.
 */
public final class NettyDisplayServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyDisplayServer.class);

    private final InetSocketAddress bindAddress;
    private final SessionEnvironment env;
    private final PacketHandler handler;
    private final long maxPayloadSize;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private final Map<String, DisplaySession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();

    private volatile Channel serverChannel;

    public NettyDisplayServer(InetSocketAddress bindAddress, SessionEnvironment env, PacketHandler handler,
                              long maxPayloadSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.env = Objects.requireNonNull(env, "env");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.maxPayloadSize = maxPayloadSize;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new NettyFrameDecoder(new DefaultFrameDecoder(NettyDisplayServer.this.maxPayloadSize)));
                        p.addLast(new SessionHandler());
                    }
                });
    }

    /**
     * Binds the listening socket. Blocks until the bind completes.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start()
    {
        try {
            serverChannel = bootstrap.bind(bindAddress).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while binding " + bindAddress, e);
        } catch (RuntimeException e) {
            shutdownGroups();
            throw new IllegalStateException("cannot bind " + bindAddress, e);
        }
        log.info("listening on {}", serverChannel.localAddress());
    }

    /**
     * Closes every session and the listener, then shuts down the event loops.
     */
    public void stop()
    {
        for (DisplaySession s : sessions.values()) {
            s.close("server shutting down");
        }
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        shutdownGroups();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    /**
     * Address actually bound (useful with port 0).
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    public int sessionCount()
    {
        return sessions.size();
    }

    private void transportEvent(TransportObservabilityEvent.Kind kind, Channel ch, String detail)
    {
        env.sink().onTransportEvent(new TransportObservabilityEvent(
                env.wallClock().now(), kind, String.valueOf(ch.remoteAddress()), detail));
    }

    /**
     * SessionHandler
     * -------------------------------------------------------------------------
     * Binds one channel to one session.
     */
    private final class SessionHandler extends SimpleChannelInboundHandler<Frame>
    {
        private DisplaySession session;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            String id = "s" + sessionCounter.incrementAndGet();
            session = new DisplaySession(id, new NettyStreamTransport(ctx.channel()), env, handler);
            sessions.put(id, session);
            transportEvent(TransportObservabilityEvent.Kind.CONNECTED, ctx.channel(), id);
            session.start();
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Frame frame)
        {
            session.onFrame(frame);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (session != null) {
                session.close("connection closed");
                sessions.remove(session.id());
                transportEvent(TransportObservabilityEvent.Kind.DISCONNECTED, ctx.channel(), session.id());
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            Throwable root = (cause instanceof DecoderException && cause.getCause() != null)
                    ? cause.getCause()
                    : cause;

            if (root instanceof FrameFormatException) {
                log.warn("{}: protocol error: {}", ctx.channel().remoteAddress(), root.getMessage());
                transportEvent(TransportObservabilityEvent.Kind.FRAME_ERROR, ctx.channel(), root.getMessage());
                closeSession("protocol error");
            } else if (root instanceof AuthenticationFailedException) {
                log.info("{}: {}", ctx.channel().remoteAddress(), root.getMessage());
                closeSession("authentication failed");
            } else {
                log.error("{}: unexpected error", ctx.channel().remoteAddress(), root);
                env.sink().onError(new DisplayErrorEvent(env.wallClock().now(),
                        "connection " + ctx.channel().remoteAddress() + " failed", root));
                closeSession("internal error");
            }
            ctx.close();
        }

        private void closeSession(String reason)
        {
            if (session != null) {
                session.close(reason);
            }
        }
    }
}
