package com.questrail.remotedisplay.transport.netty;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.FrameFlag;
import com.questrail.remotedisplay.protocol.frame.FrameFlags;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Stream framing: partial reads, back-to-back frames and early rejection.
 */
final class NettyFrameDecoderTest
{
    private final DefaultFrameEncoder encoder = new DefaultFrameEncoder();

    private EmbeddedChannel channel(long limit)
    {
        return new EmbeddedChannel(new NettyFrameDecoder(new DefaultFrameDecoder(limit)));
    }

    @Test
    void frameSplitAcrossReadsIsReassembled()
    {
        EmbeddedChannel ch = channel(1024);
        byte[] wire = encoder.encode(new Frame(FrameFlags.of(FrameFlag.NO_HEADER), 0, 2, new byte[] { 1, 2, 3, 4, 5 }));

        ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(wire, 0, 5)));
        assertNull(ch.readInbound());
        ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(wire, 5, 10)));
        assertNull(ch.readInbound());
        ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(wire, 10, wire.length)));

        Frame frame = ch.readInbound();
        assertEquals(2, frame.index());
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5 }, frame.payload());
        ch.finishAndReleaseAll();
    }

    @Test
    void consecutiveFramesInOneRead()
    {
        EmbeddedChannel ch = channel(1024);
        byte[] a = encoder.encode(new Frame(FrameFlags.NONE, 0, 0, new byte[] { 7 }));
        byte[] b = encoder.encode(new Frame(FrameFlags.NONE, 0, 0, new byte[0]));
        byte[] both = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, both, a.length, b.length);

        ch.writeInbound(Unpooled.wrappedBuffer(both));

        Frame first = ch.readInbound();
        Frame second = ch.readInbound();
        assertEquals(1, first.payloadSize());
        assertEquals(0, second.payloadSize());
        assertNull(ch.readInbound());
        ch.finishAndReleaseAll();
    }

    @Test
    void oversizedFrameIsRejectedBeforeItsPayloadArrives()
    {
        EmbeddedChannel ch = channel(16);
        byte[] header = encoder.encode(new Frame(FrameFlags.NONE, 0, 0, new byte[17]));

        DecoderException e = assertThrows(DecoderException.class,
                () -> ch.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOf(header, 8))));
        assertInstanceOf(FrameFormatException.class, e.getCause());
        ch.finishAndReleaseAll();
    }

    @Test
    void badMagicIsRejected()
    {
        EmbeddedChannel ch = channel(1024);

        DecoderException e = assertThrows(DecoderException.class,
                () -> ch.writeInbound(Unpooled.wrappedBuffer("GET / HTTP/1.1\r\n".getBytes())));
        assertInstanceOf(FrameFormatException.class, e.getCause());
        ch.finishAndReleaseAll();
    }
}
