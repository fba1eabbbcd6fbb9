package com.questrail.remotedisplay.protocol.codec;

/**
 * Raised when bytes on the wire cannot be a valid frame: short header, magic
 * mismatch, oversized payload, or a payload that cannot be decompressed or
 * decrypted.
 *
 * <p>This is a protocol desync. The connection owner must close the
 * connection; there is no recovery.</p>
 */
public final class FrameFormatException extends RuntimeException
{
    public FrameFormatException(String message)
    {
        super(message);
    }

    public FrameFormatException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
