package com.questrail.remotedisplay.protocol.frame;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * FrameFlags
 * -----------------------------------------------------------------------------
 * Immutable view of the header flags byte.
 *
 * <h2>Forward compatibility</h2>
 * <ul>
 *   <li>{@link #fromWire(int)} keeps only the known bits; reserved bits are
 *       ignored.</li>
 *   <li>{@link #of(FrameFlag...)} can only express known bits, so an encoder
 *       built on this type can never emit a reserved bit.</li>
 * </ul>
 *
 * <p>At most one compression bit may be set when building flags for encode.
 * On decode both may arrive; the payload codec resolves them in priority
 * order (scheme A first).</p>
 */
public final class FrameFlags
{
    /** All bits with an assigned meaning. */
    public static final int KNOWN_MASK = 0x01 | 0x02 | 0x04 | 0x10 | 0x20 | 0x40;

    public static final FrameFlags NONE = new FrameFlags(0);

    private final int value;

    private FrameFlags(int value)
    {
        this.value = value;
    }

    /**
     * Interprets a flags byte received from the wire. Reserved bits are dropped.
     */
    public static FrameFlags fromWire(int wireValue)
    {
        return new FrameFlags(wireValue & KNOWN_MASK);
    }

    /**
     * Builds flags for an outbound frame.
     *
     * @throws IllegalArgumentException if both compression bits are requested
     */
    public static FrameFlags of(FrameFlag... flags)
    {
        int v = 0;
        for (FrameFlag f : flags) {
            v |= Objects.requireNonNull(f, "flag").bit();
        }
        return checked(v);
    }

    public FrameFlags with(FrameFlag flag)
    {
        return checked(value | flag.bit());
    }

    public FrameFlags without(FrameFlag flag)
    {
        return new FrameFlags(value & ~flag.bit());
    }

    public boolean has(FrameFlag flag)
    {
        return (value & flag.bit()) != 0;
    }

    /**
     * Raw byte value as written to the wire.
     */
    public int value()
    {
        return value;
    }

    public Set<FrameFlag> asSet()
    {
        EnumSet<FrameFlag> set = EnumSet.noneOf(FrameFlag.class);
        for (FrameFlag f : FrameFlag.values()) {
            if (has(f)) {
                set.add(f);
            }
        }
        return set;
    }

    private static FrameFlags checked(int v)
    {
        int compression = FrameFlag.COMPRESSION_A.bit() | FrameFlag.COMPRESSION_B.bit();
        if ((v & compression) == compression) {
            throw new IllegalArgumentException("at most one compression scheme may be set");
        }
        return new FrameFlags(v);
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof FrameFlags other && other.value == value;
    }

    @Override
    public int hashCode()
    {
        return Integer.hashCode(value);
    }

    @Override
    public String toString()
    {
        return "FrameFlags[0x" + Integer.toHexString(value) + " " + asSet() + "]";
    }
}
