package com.questrail.remotedisplay.protocol.codec.impl;

import com.questrail.remotedisplay.protocol.codec.FrameEncoder;
import com.questrail.remotedisplay.protocol.frame.Frame;

import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameEncoder}; the mechanical inverse of
 * {@link DefaultFrameDecoder}.
 *
 * <p>Flags come from a {@code FrameFlags} value, which can only carry known
 * bits, so reserved bits are always zero on the wire. The level must be a
 * valid compression level (0-9).</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    /** Highest compression level a frame may announce. */
    public static final int MAX_LEVEL = 9;

    @Override
    public byte[] encode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.level() > MAX_LEVEL) {
            throw new IllegalArgumentException("compression level out of range: " + frame.level());
        }

        final byte[] payload = frame.payload();
        final byte[] header = FrameHeaderCodec.encodeHeader(
                frame.flags().value(), frame.level(), frame.index(), payload.length);

        byte[] wire = new byte[header.length + payload.length];
        System.arraycopy(header, 0, wire, 0, header.length);
        System.arraycopy(payload, 0, wire, header.length, payload.length);
        return wire;
    }
}
