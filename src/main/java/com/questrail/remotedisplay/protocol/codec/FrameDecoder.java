package com.questrail.remotedisplay.protocol.codec;

import com.questrail.remotedisplay.protocol.frame.Frame;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between wire bytes and a structured {@link Frame}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the header (length, magic byte, payload size bound)</li>
 *   <li>Checking that exactly {@code payloadSize} payload bytes follow</li>
 *   <li>Interpreting the flags byte (reserved bits are ignored)</li>
 * </ul>
 *
 * <p>It does not decompress, decrypt or interpret packets. Stream splitting
 * (finding frame boundaries in a TCP byte stream) is the transport's job; this
 * method is handed exactly one frame.</p>
 */
public interface FrameDecoder
{
    /**
     * @param wire bytes of exactly one frame: header followed by its payload
     * @return the decoded frame
     * @throws FrameFormatException if the bytes are not a well-formed frame
     */
    Frame decode(byte[] wire);
}
