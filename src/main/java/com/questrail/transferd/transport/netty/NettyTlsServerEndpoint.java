package com.questrail.transferd.transport.netty;

import com.questrail.transferd.protocol.codec.impl.EnvelopeFraming;
import com.questrail.transferd.transport.ConnectionEndpoint;
import com.questrail.transferd.transport.ConnectionListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.util.concurrent.GlobalEventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTlsServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link ConnectionEndpoint} port: a TCP
 * server where every connection is wrapped in TLS.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode envelope payloads</li>
 *   <li>Interpret requests or manage sessions</li>
 *   <li>Apply idle or handler timeouts</li>
 * </ul>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   SslHandler → LengthFieldBasedFrameDecoder → ConnectionHandler
 * </pre>
 * The frame decoder cuts the stream at envelope boundaries using the length
 * field of the 8-byte header and rejects frames longer than the configured
 * maximum; the connection is then closed.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are copied into
 * {@code byte[]} before they reach the listener.
 */
public final class NettyTlsServerEndpoint implements ConnectionEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTlsServerEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final SslContext sslContext;
    private final int maxFrameLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup connections = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ConnectionListener listener;
    private volatile Channel serverChannel;

    /**
     * @param maxPayloadLength largest payload accepted in one envelope
     */
    public NettyTlsServerEndpoint(InetSocketAddress bindAddress, SslContext sslContext, int maxPayloadLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.sslContext = Objects.requireNonNull(sslContext, "sslContext");
        if (maxPayloadLength <= 0) {
            throw new IllegalArgumentException("maxPayloadLength must be positive");
        }
        this.maxFrameLength = EnvelopeFraming.HEADER_LENGTH + maxPayloadLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public void setListener(ConnectionListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (!running.compareAndSet(false, true)) {
            return;
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("tls", sslContext.newHandler(ch.alloc()));
                        p.addLast("frames", new LengthFieldBasedFrameDecoder(
                                maxFrameLength,
                                EnvelopeFraming.LENGTH_FIELD_OFFSET,
                                EnvelopeFraming.LENGTH_FIELD_LENGTH,
                                0,
                                0,
                                true));
                        p.addLast("connection", new ConnectionHandler());
                    }
                });

        serverChannel = bootstrap.bind(bindAddress).syncUninterruptibly().channel();
        log.info("Listening on {} (TLS)", serverChannel.localAddress());
    }

    @Override
    public void stop()
    {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        connections.close().awaitUninterruptibly();

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully().awaitUninterruptibly();
        log.info("Stopped listening on {}", bindAddress);
    }

    @Override
    public Optional<SocketAddress> localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    private ConnectionListener requireListener()
    {
        ConnectionListener l = listener;
        if (l == null) {
            throw new IllegalStateException("ConnectionListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One instance per accepted channel. Translates channel events into
     * {@link ConnectionListener} callbacks.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private NettyConnection connection;
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            connections.add(ctx.channel());
            connection = new NettyConnection(ctx.channel());
            listener.onConnectionOpened(connection);
            super.channelActive(ctx);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof SslHandshakeCompletionEvent handshake) {
                if (handshake.isSuccess()) {
                    listener.onConnectionSecured(connection);
                }
                else {
                    log.debug("TLS handshake with {} failed", ctx.channel().remoteAddress(), handshake.cause());
                    failure = handshake.cause();
                    ctx.close();
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            // Copy the frame into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            listener.onFrame(connection, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            if (connection != null) {
                listener.onConnectionClosed(connection, failure);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Closing {} after transport error", ctx.channel().remoteAddress(), cause);
            if (failure == null) {
                failure = cause;
            }
            ctx.close();
        }
    }
}
