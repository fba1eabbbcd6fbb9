package com.questrail.remotedisplay.protocol.codec.impl;

import com.questrail.remotedisplay.protocol.codec.FrameDecoder;
import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.FrameHeader;

import java.util.Arrays;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header validation via {@link FrameHeaderCodec}</li>
 *   <li>Payload size bound check against {@link #maxPayloadSize()}</li>
 *   <li>Exact length check: header + payloadSize bytes, nothing more</li>
 *   <li>Construction of a {@link Frame} with reserved flag bits dropped</li>
 * </ol>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    /** Default payload bound: 256 MiB. */
    public static final long DEFAULT_MAX_PAYLOAD_SIZE = 256L * 1024 * 1024;

    private final long maxPayloadSize;

    public DefaultFrameDecoder()
    {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public DefaultFrameDecoder(long maxPayloadSize)
    {
        if (maxPayloadSize < 0 || maxPayloadSize > Integer.MAX_VALUE - FrameHeader.LENGTH) {
            throw new IllegalArgumentException("maxPayloadSize out of range: " + maxPayloadSize);
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    public long maxPayloadSize()
    {
        return maxPayloadSize;
    }

    /**
     * Validates a header and its announced size without touching the payload.
     * Stream transports call this once 8 bytes are buffered to learn how many
     * more bytes to wait for.
     */
    public FrameHeader decodeHeader(byte[] headerBytes)
    {
        FrameHeader header = FrameHeaderCodec.decodeHeader(headerBytes);
        if (header.payloadSize() > maxPayloadSize) {
            throw new FrameFormatException("payload size " + header.payloadSize()
                    + " exceeds limit " + maxPayloadSize);
        }
        return header;
    }

    @Override
    public Frame decode(byte[] wire)
    {
        final FrameHeader header = decodeHeader(wire);

        final long expected = FrameHeader.LENGTH + header.payloadSize();
        if (wire.length != expected) {
            throw new FrameFormatException("frame length mismatch: header announces "
                    + header.payloadSize() + " payload bytes, got "
                    + (wire.length - FrameHeader.LENGTH));
        }

        byte[] payload = Arrays.copyOfRange(wire, FrameHeader.LENGTH, wire.length);
        return new Frame(header.frameFlags(), header.level(), header.index(), payload);
    }
}
