package com.questrail.remotedisplay.protocol.frame;

import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * Immutable frame: interpreted header fields plus the payload bytes exactly as
 * they travel on the wire (possibly compressed and/or encrypted).
 *
 * <p>The payload size is never stored separately; it is always the length of
 * the payload array, so the two cannot disagree.</p>
 *
 * The payload array is copied on the way in and on the way out.
 */
public final class Frame
{
    private final FrameFlags flags;
    private final int level;
    private final int index;
    private final byte[] payload;

    public Frame(FrameFlags flags, int level, int index, byte[] payload)
    {
        this.flags = Objects.requireNonNull(flags, "flags");
        if (level < 0 || level > 0xFF) {
            throw new IllegalArgumentException("level out of range: " + level);
        }
        if (index < 0 || index > 0xFF) {
            throw new IllegalArgumentException("index out of range: " + index);
        }
        this.level = level;
        this.index = index;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public FrameFlags flags()
    {
        return flags;
    }

    public int level()
    {
        return level;
    }

    public int index()
    {
        return index;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadSize()
    {
        return payload.length;
    }

    /**
     * True for frames carrying a raw chunk of a larger packet.
     */
    public boolean isChunk()
    {
        return index > 0;
    }

    @Override
    public String toString()
    {
        return "Frame[" +
                "flags=0x" + Integer.toHexString(flags.value()) +
                ", level=" + level +
                ", index=" + index +
                ", payloadSize=" + payload.length +
                ']';
    }
}
