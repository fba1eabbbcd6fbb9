package com.questrail.remotedisplay.protocol.frame;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * PacketAssembler
 * -----------------------------------------------------------------------------
 * Collects raw chunks (index &gt; 0) until the main packet (index 0) arrives,
 * then releases them together as one {@link Packet}.
 *
 * <p>One instance per connection, driven by the connection's single worker.
 * Not thread-safe.</p>
 */
public final class PacketAssembler
{
    private final long maxPendingBytes;
    private final Map<Integer, byte[]> pending = new HashMap<>();
    private long pendingBytes;

    public PacketAssembler(long maxPendingBytes)
    {
        if (maxPendingBytes <= 0) {
            throw new IllegalArgumentException("maxPendingBytes must be positive");
        }
        this.maxPendingBytes = maxPendingBytes;
    }

    /**
     * Accepts one decoded payload.
     *
     * @param index the frame's packet index
     * @param data  decoded (decrypted, decompressed) payload
     * @return the completed packet when {@code index == 0}, otherwise empty
     * @throws FrameFormatException on a repeated chunk index or when buffered
     *         chunks exceed the size limit
     */
    public Optional<Packet> accept(int index, byte[] data)
    {
        if (index == 0) {
            Packet packet = new Packet(data, pending);
            reset();
            return Optional.of(packet);
        }

        if (pending.containsKey(index)) {
            throw new FrameFormatException("duplicate chunk index " + index);
        }
        pendingBytes += data.length;
        if (pendingBytes > maxPendingBytes) {
            throw new FrameFormatException("pending chunks exceed " + maxPendingBytes + " bytes");
        }
        pending.put(index, data.clone());
        return Optional.empty();
    }

    public int pendingChunks()
    {
        return pending.size();
    }

    /**
     * Drops buffered chunks. Called on teardown.
     */
    public void reset()
    {
        pending.clear();
        pendingBytes = 0;
    }
}
