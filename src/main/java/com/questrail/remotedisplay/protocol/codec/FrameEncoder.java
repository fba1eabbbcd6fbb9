package com.questrail.remotedisplay.protocol.codec;

import com.questrail.remotedisplay.protocol.frame.Frame;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a structured {@link Frame} and wire bytes.
 *
 * <p>The encoder writes the 8-byte header followed by the payload. It does not
 * compress or encrypt; the payload is expected to be in its final wire form
 * already (see {@code FramePayloadCodec}).</p>
 */
public interface FrameEncoder
{
    /**
     * @param frame frame to serialize
     * @return header and payload bytes, ready for the transport
     */
    byte[] encode(Frame frame);
}
