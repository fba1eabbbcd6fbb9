package com.questrail.remotedisplay.transport.netty;

import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.remotedisplay.protocol.frame.FrameHeader;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;
import java.util.Objects;

/**
 * NettyFrameDecoder
 * -----------------------------------------------------------------------------
 * Splits the inbound byte stream into {@code Frame}s.
 *
 * <p>Waits for the 8-byte header, validates it (magic, size limit) before the
 * payload has arrived, then waits for the announced payload. Validation
 * failures surface as a {@code DecoderException} wrapping the
 * {@code FrameFormatException}; the connection handler closes the channel.</p>
 */
final class NettyFrameDecoder extends ByteToMessageDecoder
{
    private final DefaultFrameDecoder decoder;

    NettyFrameDecoder(DefaultFrameDecoder decoder)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        if (in.readableBytes() < FrameHeader.LENGTH) {
            return;
        }

        byte[] headerBytes = new byte[FrameHeader.LENGTH];
        in.getBytes(in.readerIndex(), headerBytes);
        FrameHeader header = decoder.decodeHeader(headerBytes);

        int total = FrameHeader.LENGTH + (int) header.payloadSize();
        if (in.readableBytes() < total) {
            return;
        }

        byte[] wire = new byte[total];
        in.readBytes(wire);
        out.add(decoder.decode(wire));
    }
}
