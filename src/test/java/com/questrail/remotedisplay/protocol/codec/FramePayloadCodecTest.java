package com.questrail.remotedisplay.protocol.codec;

import com.questrail.remotedisplay.protocol.compression.CompressionPolicy;
import com.questrail.remotedisplay.protocol.compression.CompressionScheme;
import com.questrail.remotedisplay.protocol.crypto.CipherParameters;
import com.questrail.remotedisplay.protocol.crypto.PacketCipher;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.FrameFlag;
import com.questrail.remotedisplay.protocol.frame.FrameFlags;
import com.questrail.remotedisplay.protocol.frame.Packet;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FramePayloadCodecTest
 * -----------------------------------------------------------------------------
 * Compression and encryption of frame payloads.
 */
final class FramePayloadCodecTest
{
    private static final long LIMIT = 1 << 20;

    private static byte[] text(int repeat)
    {
        return "damage rectangle 0,0 640x480;".repeat(repeat).getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void levelZeroSendsPayloadUncompressed()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.defaults(0), LIMIT);

        Frame frame = codec.encode(text(4), 0);

        assertEquals(0, frame.level());
        assertEquals(FrameFlags.NONE, frame.flags());
        assertArrayEquals(text(4), codec.decode(frame));
    }

    @Test
    void lz4IsPreferredWhenEnabled()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.defaults(1), LIMIT);

        Frame frame = codec.encode(text(100), 0);

        assertTrue(frame.flags().has(FrameFlag.COMPRESSION_A));
        assertEquals(1, frame.level());
        assertTrue(frame.payloadSize() < text(100).length);
        assertArrayEquals(text(100), codec.decode(frame));
    }

    @Test
    void zlibCarriesNoSchemeBit()
    {
        CompressionPolicy zlibOnly = new CompressionPolicy(List.of(CompressionScheme.ZLIB), 6);
        FramePayloadCodec codec = new FramePayloadCodec(zlibOnly, LIMIT);

        Frame frame = codec.encode(text(50), 0);

        assertFalse(frame.flags().has(FrameFlag.COMPRESSION_A));
        assertFalse(frame.flags().has(FrameFlag.COMPRESSION_B));
        assertEquals(6, frame.level());
        assertArrayEquals(text(50), codec.decode(frame));
    }

    @Test
    void rawChunkIsPassedThroughEvenWithALevel()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.defaults(1), LIMIT);
        byte[] pixels = { 1, 2, 3, 4, 5 };

        Frame frame = codec.encodeRaw(pixels, 3);

        assertTrue(frame.flags().has(FrameFlag.NO_HEADER));
        assertTrue(frame.isChunk());
        assertArrayEquals(pixels, codec.decode(frame));
        assertArrayEquals(pixels, codec.decode(new Frame(FrameFlags.of(FrameFlag.NO_HEADER), 5, 3, pixels)));
    }

    @Test
    void lzoPayloadIsRejected()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT);
        Frame frame = new Frame(FrameFlags.of(FrameFlag.COMPRESSION_B), 1, 0, new byte[] { 1, 2, 3 });

        assertThrows(FrameFormatException.class, () -> codec.decode(frame));
    }

    @Test
    void corruptZlibPayloadIsAFormatError()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT);
        Frame frame = new Frame(FrameFlags.NONE, 3, 0, new byte[] { 0x11, 0x22, 0x33, 0x44 });

        assertThrows(FrameFormatException.class, () -> codec.decode(frame));
    }

    @Test
    void decompressionIsBoundedByTheLimit()
    {
        FramePayloadCodec big = new FramePayloadCodec(CompressionPolicy.defaults(1), LIMIT);
        FramePayloadCodec small = new FramePayloadCodec(CompressionPolicy.defaults(1), 64);

        Frame frame = big.encode(text(100), 0);

        assertThrows(FrameFormatException.class, () -> small.decode(frame));
    }

    @Test
    void encryptedRoundTripSetsCipherFlag()
    {
        PacketCipher cipher = PacketCipher.create("secret", CipherParameters.aes("remote-display"));
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.defaults(1), LIMIT).withCipher(cipher);

        Frame frame = codec.encode(text(20), 0);

        assertTrue(codec.encrypted());
        assertTrue(frame.flags().has(FrameFlag.CIPHER));
        assertArrayEquals(text(20), codec.decode(frame));
    }

    @Test
    void cipherMismatchIsRejectedBothWays()
    {
        PacketCipher cipher = PacketCipher.create("secret", CipherParameters.aes("remote-display"));
        FramePayloadCodec plain = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT);
        FramePayloadCodec secure = plain.withCipher(cipher);

        Frame encrypted = secure.encode(text(1), 0);
        Frame unencrypted = plain.encode(text(1), 0);

        assertThrows(FrameFormatException.class, () -> plain.decode(encrypted));
        assertThrows(FrameFormatException.class, () -> secure.decode(unencrypted));
    }

    @Test
    void wrongKeyFailsToDecrypt()
    {
        FramePayloadCodec a = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT)
                .withCipher(PacketCipher.create("one", CipherParameters.aes("salt")));
        FramePayloadCodec b = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT)
                .withCipher(PacketCipher.create("two", CipherParameters.aes("salt")));

        Frame frame = a.encode(text(3), 0);

        // A wrong key almost always breaks the padding; if it does not, the bytes still differ.
        try {
            assertFalse(Arrays.equals(text(3), b.decode(frame)));
        } catch (FrameFormatException expected) {
            assertNotNull(expected.getMessage());
        }
    }

    @Test
    void packetFramesPutChunksBeforeMain()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.NONE, LIMIT);
        Packet packet = new Packet(new byte[] { 0 }, Map.of(2, new byte[] { 2 }, 1, new byte[] { 1 }));

        List<Frame> frames = codec.encode(packet);

        assertEquals(3, frames.size());
        assertEquals(1, frames.get(0).index());
        assertEquals(2, frames.get(1).index());
        assertEquals(0, frames.get(2).index());
    }

    @Test
    void outboundPayloadLargerThanLimitIsRefused()
    {
        FramePayloadCodec codec = new FramePayloadCodec(CompressionPolicy.NONE, 4);

        assertThrows(IllegalArgumentException.class, () -> codec.encode(new byte[5], 0));
    }
}
