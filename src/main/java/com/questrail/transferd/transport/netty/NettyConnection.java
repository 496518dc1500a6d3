package com.questrail.transferd.transport.netty;

import com.questrail.transferd.transport.Connection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link Connection} over one accepted Netty channel.
 */
final class NettyConnection implements Connection
{
    private final Channel channel;

    NettyConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id()
    {
        return channel.id().asShortText();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public CompletionStage<Void> write(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!channel.isActive()) {
            done.completeExceptionally(new ClosedChannelException());
            return done;
        }

        ChannelFuture f = channel.writeAndFlush(Unpooled.wrappedBuffer(frame));
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                done.complete(null);
            }
            else {
                done.completeExceptionally(future.cause());
            }
        });
        return done;
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return "NettyConnection[" + id() + " " + remoteAddress() + "]";
    }
}
