/**
 * Frame Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>Every unit on the wire is an 8-byte header followed by its payload:</p>
 *
 * <pre>
 *   byte 0     magic, always 'P' (0x50)
 *   byte 1     flags (see FrameFlag)
 *   byte 2     compression level, 0-9
 *   byte 3     packet index, 0-255 (0 = main packet, &gt;0 = raw chunk)
 *   bytes 4-7  payload size, unsigned 32-bit big-endian
 *   ...        payload
 * </pre>
 *
 * <h2>Layering</h2>
 * <pre>
 *   byte stream (transport)
 *        → FrameDecoder        (header validation, payload extraction)
 *            → Frame           (flags interpreted, payload still on-wire form)
 *                → FramePayloadCodec   (decrypt, then decompress)
 *                    → PacketAssembler (chunks + main packet)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <p>A bad magic byte or short header means the two ends disagree on where a
 * frame starts. There is no resynchronisation: {@link
 * com.questrail.remotedisplay.protocol.codec.FrameFormatException} is thrown
 * and the connection owner closes the connection.</p>
 *
 * <p>All codec types are stateless apart from their construction-time
 * limits and may be shared by any number of threads.</p>
 */
package com.questrail.remotedisplay.protocol.codec;
