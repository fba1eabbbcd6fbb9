package com.questrail.remotedisplay.protocol.frame;

/**
 * Decoded 8-byte frame header.
 *
 * <p>{@code flags} holds the raw byte exactly as it was on the wire; use
 * {@link #frameFlags()} for the interpreted view that ignores reserved bits.</p>
 *
 * @param magic       first header byte, always {@link #MAGIC} for a valid header
 * @param flags       raw flags byte (0-255)
 * @param level       compression level byte
 * @param index       packet index (0 = main packet, &gt;0 = raw chunk)
 * @param payloadSize size of the payload that follows, unsigned 32-bit
 */
public record FrameHeader(int magic, int flags, int level, int index, long payloadSize)
{
    /** Sentinel first byte: ASCII 'P'. */
    public static final int MAGIC = 0x50;

    /** Header length on the wire. */
    public static final int LENGTH = 8;

    /** Largest value the payload size field can carry. */
    public static final long MAX_PAYLOAD_SIZE = 0xFFFF_FFFFL;

    public FrameFlags frameFlags()
    {
        return FrameFlags.fromWire(flags);
    }
}
