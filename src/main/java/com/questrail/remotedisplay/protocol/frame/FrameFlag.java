package com.questrail.remotedisplay.protocol.frame;

/**
 * Individual bits of the header flags byte.
 *
 * <p>Bits {@code 0x08} and {@code 0x80} are reserved. They have no constant
 * here: they are never set on encode and are masked off on decode.</p>
 */
public enum FrameFlag
{
    /** Payload uses the alternate packet serialization. */
    ALT_SERIALIZATION(0x01),

    /** Payload is encrypted with the session cipher. */
    CIPHER(0x02),

    /** Payload uses the second alternate packet serialization. */
    ALT_SERIALIZATION_2(0x04),

    /** Payload is compressed with scheme A (LZ4 block). */
    COMPRESSION_A(0x10),

    /** Payload is compressed with scheme B (LZO). */
    COMPRESSION_B(0x20),

    /** Raw chunk: payload is used verbatim, compression bits are ignored. */
    NO_HEADER(0x40);

    private final int bit;

    FrameFlag(int bit)
    {
        this.bit = bit;
    }

    public int bit()
    {
        return bit;
    }
}
