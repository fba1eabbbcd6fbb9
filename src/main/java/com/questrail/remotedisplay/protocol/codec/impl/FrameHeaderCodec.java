package com.questrail.remotedisplay.protocol.codec.impl;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.frame.FrameHeader;

/**
 * FrameHeaderCodec
 * -----------------------------------------------------------------------------
 * Bit-exact pack/unpack of the 8-byte frame header.
 *
 * <p>This class works on raw byte values. It does not apply the flag policy
 * (reserved bits) and does not validate the compression level range; those
 * belong to the frame encoder and the payload codec. Anything that fits the
 * field widths round-trips unchanged.</p>
 *
 * <p>Pure functions, no state: safe for any number of concurrent callers.</p>
 */
public final class FrameHeaderCodec
{
    private FrameHeaderCodec() {}

    /**
     * Packs a header.
     *
     * @param flags       flags byte, 0-255
     * @param level       compression level byte, 0-255
     * @param index       packet index, 0-255
     * @param payloadSize payload size, 0 to 2^32-1
     * @return the 8 header bytes
     * @throws IllegalArgumentException if a value does not fit its field
     */
    public static byte[] encodeHeader(int flags, int level, int index, long payloadSize)
    {
        requireByte("flags", flags);
        requireByte("level", level);
        requireByte("index", index);
        if (payloadSize < 0 || payloadSize > FrameHeader.MAX_PAYLOAD_SIZE) {
            throw new IllegalArgumentException("payloadSize out of range: " + payloadSize);
        }

        byte[] out = new byte[FrameHeader.LENGTH];
        out[0] = (byte) FrameHeader.MAGIC;
        out[1] = (byte) flags;
        out[2] = (byte) level;
        out[3] = (byte) index;
        out[4] = (byte) (payloadSize >>> 24);
        out[5] = (byte) (payloadSize >>> 16);
        out[6] = (byte) (payloadSize >>> 8);
        out[7] = (byte) payloadSize;
        return out;
    }

    /**
     * Unpacks a header from the start of {@code buf}. Bytes after the first
     * eight are ignored.
     *
     * @throws FrameFormatException if {@code buf} is shorter than 8 bytes or the
     *         first byte is not the magic byte
     */
    public static FrameHeader decodeHeader(byte[] buf)
    {
        return decodeHeader(buf, 0);
    }

    /**
     * Unpacks a header starting at {@code offset}.
     */
    public static FrameHeader decodeHeader(byte[] buf, int offset)
    {
        if (buf == null || offset < 0 || buf.length - offset < FrameHeader.LENGTH) {
            throw new FrameFormatException("frame header too short: need "
                    + FrameHeader.LENGTH + " bytes, got "
                    + (buf == null ? 0 : Math.max(0, buf.length - offset)));
        }

        final int magic = buf[offset] & 0xFF;
        if (magic != FrameHeader.MAGIC) {
            throw new FrameFormatException(String.format(
                    "invalid frame magic: expected 0x%02X, got 0x%02X", FrameHeader.MAGIC, magic));
        }

        final int flags = buf[offset + 1] & 0xFF;
        final int level = buf[offset + 2] & 0xFF;
        final int index = buf[offset + 3] & 0xFF;
        final long size = ((long) (buf[offset + 4] & 0xFF) << 24)
                | ((buf[offset + 5] & 0xFF) << 16)
                | ((buf[offset + 6] & 0xFF) << 8)
                |  (buf[offset + 7] & 0xFF);

        return new FrameHeader(magic, flags, level, index, size);
    }

    private static void requireByte(String name, int value)
    {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " out of range: " + value);
        }
    }
}
