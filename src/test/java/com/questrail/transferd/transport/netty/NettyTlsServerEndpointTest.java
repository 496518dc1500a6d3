package com.questrail.transferd.transport.netty;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.auth.InMemoryCredentialStore;
import com.questrail.transferd.config.DaemonConfig;
import com.questrail.transferd.protocol.codec.Envelope;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.transferd.protocol.codec.impl.EnvelopeFraming;
import com.questrail.transferd.protocol.codec.impl.JacksonPayloadCodec;
import com.questrail.transferd.protocol.model.MessageType;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.runtime.DaemonRuntime;
import com.questrail.transferd.transport.Connection;
import com.questrail.transferd.transport.ConnectionListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTlsServerEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback tests over real TLS with a self-signed server certificate and a
 * client that trusts anything.
 */
final class NettyTlsServerEndpointTest
{
    private static final InetSocketAddress LOOPBACK = new InetSocketAddress("127.0.0.1", 0);

    private final EventLoopGroup clientGroup = new NioEventLoopGroup(1);
    private final BlockingQueue<byte[]> clientFrames = new LinkedBlockingQueue<>();
    private final CountDownLatch clientClosed = new CountDownLatch(1);

    private NettyTlsServerEndpoint endpoint;
    private DaemonRuntime runtime;

    @AfterEach
    void tearDown()
    {
        if (endpoint != null) {
            endpoint.stop();
        }
        if (runtime != null) {
            runtime.stop();
        }
        clientGroup.shutdownGracefully().awaitUninterruptibly();
    }

    /** Server listener that echoes every frame back and records lifecycle callbacks. */
    private static final class EchoListener implements ConnectionListener
    {
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch secured = new CountDownLatch(1);
        final CountDownLatch closed = new CountDownLatch(1);

        @Override
        public void onConnectionOpened(Connection connection) {
            opened.countDown();
        }

        @Override
        public void onConnectionSecured(Connection connection) {
            secured.countDown();
        }

        @Override
        public void onFrame(Connection connection, byte[] frame) {
            connection.write(frame);
        }

        @Override
        public void onConnectionClosed(Connection connection, Throwable cause) {
            closed.countDown();
        }
    }

    private Channel connect(InetSocketAddress server) throws Exception
    {
        SslContext clientContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

        return new Bootstrap()
                .group(clientGroup)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(clientContext.newHandler(ch.alloc(), server.getHostString(), server.getPort()));
                        ch.pipeline().addLast(new LengthFieldBasedFrameDecoder(1 << 20,
                                EnvelopeFraming.LENGTH_FIELD_OFFSET, EnvelopeFraming.LENGTH_FIELD_LENGTH, 0, 0));
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<ByteBuf>() {
                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
                            {
                                byte[] bytes = new byte[msg.readableBytes()];
                                msg.readBytes(bytes);
                                clientFrames.add(bytes);
                            }

                            @Override
                            public void channelInactive(ChannelHandlerContext ctx)
                            {
                                clientClosed.countDown();
                            }
                        });
                    }
                })
                .connect(server)
                .sync()
                .channel();
    }

    private InetSocketAddress startEchoServer(EchoListener listener) throws Exception
    {
        endpoint = new NettyTlsServerEndpoint(LOOPBACK, TlsContextFactory.selfSigned(), 1024);
        endpoint.setListener(listener);
        endpoint.start();
        return (InetSocketAddress) endpoint.localAddress().orElseThrow();
    }

    @Test
    void framesTravelBothWaysOverTls() throws Exception
    {
        EchoListener listener = new EchoListener();
        InetSocketAddress server = startEchoServer(listener);
        byte[] frame = new DefaultEnvelopeEncoder().encode(new Envelope(EnvelopeFraming.PROTOCOL_VERSION,
                MessageType.REQUEST, false, "{\"id\":1,\"method\":\"daemon.info\"}".getBytes(StandardCharsets.UTF_8)));

        Channel client = connect(server);
        client.writeAndFlush(Unpooled.wrappedBuffer(frame)).sync();

        assertTrue(listener.opened.await(5, TimeUnit.SECONDS));
        assertTrue(listener.secured.await(5, TimeUnit.SECONDS));
        byte[] echoed = clientFrames.poll(5, TimeUnit.SECONDS);
        assertArrayEquals(frame, echoed);

        client.close().sync();
        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void oversizedFrameClosesConnection() throws Exception
    {
        EchoListener listener = new EchoListener();
        InetSocketAddress server = startEchoServer(listener);
        ByteBuffer header = ByteBuffer.allocate(EnvelopeFraming.HEADER_LENGTH);
        header.put((byte) EnvelopeFraming.MAGIC).put((byte) 1).put((byte) 1).put((byte) 0).putInt(1_000_000);

        Channel client = connect(server);
        client.writeAndFlush(Unpooled.wrappedBuffer(header.array())).sync();

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertTrue(clientClosed.await(5, TimeUnit.SECONDS));
        assertTrue(clientFrames.isEmpty());
    }

    @Test
    void stopIsIdempotentAndReleasesPort() throws Exception
    {
        startEchoServer(new EchoListener());

        endpoint.stop();
        endpoint.stop();
    }

    @Test
    void daemonAnswersLoginOverTls() throws Exception
    {
        runtime = DaemonRuntime.builder()
                .withConfig(DaemonConfig.builder().withBindAddress(LOOPBACK).build())
                .withCredentialStore(InMemoryCredentialStore.builder()
                        .addAccount("localclient", "pw", AuthLevel.ADMIN)
                        .build())
                .build();
        runtime.start();
        InetSocketAddress server = (InetSocketAddress) runtime.localAddress().orElseThrow();
        JacksonPayloadCodec codec = new JacksonPayloadCodec();
        DefaultEnvelopeEncoder encoder = new DefaultEnvelopeEncoder();

        Channel client = connect(server);
        byte[] login = encoder.encode(codec.encode(Request.of(1, "daemon.login", "localclient", "pw"), true));
        client.writeAndFlush(Unpooled.wrappedBuffer(login)).sync();

        byte[] reply = clientFrames.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply, "no reply from daemon");
        Envelope envelope = new DefaultEnvelopeDecoder().decode(reply);
        assertTrue(envelope.compressed(), "compressed request switches the session to compressed replies");
        Response response = (Response) codec.decode(envelope);
        assertEquals(1, response.requestId());
        assertEquals(10, response.result());
    }
}
