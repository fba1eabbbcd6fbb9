package com.questrail.remotedisplay.transport.netty;

import com.questrail.remotedisplay.transport.StreamTransport;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

import java.util.Objects;

/**
 * {@link StreamTransport} over a connected Netty {@link Channel}. Writes are
 * handed to the channel's event loop, so {@link #send(byte[])} may be called
 * from any thread.
 */
final class NettyStreamTransport implements StreamTransport
{
    private final Channel channel;

    NettyStreamTransport(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void send(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(data));
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isOpen();
    }

    @Override
    public String remoteAddress()
    {
        return String.valueOf(channel.remoteAddress());
    }
}
