package com.questrail.remotedisplay.protocol.frame;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Packet
 * -----------------------------------------------------------------------------
 * Application packet after decryption, decompression and chunk assembly.
 *
 * <p>Large binary items (pixel data, file chunks) travel as separate raw
 * chunks with a non-zero index ahead of the main packet, which is always sent
 * last with index 0. The main payload stays opaque at this layer; packet
 * serialization belongs to the application.</p>
 */
public final class Packet
{
    private final byte[] main;
    private final Map<Integer, byte[]> chunks;

    public Packet(byte[] main)
    {
        this(main, Map.of());
    }

    public Packet(byte[] main, Map<Integer, byte[]> chunks)
    {
        this.main = (main == null) ? new byte[0] : main.clone();
        TreeMap<Integer, byte[]> copy = new TreeMap<>();
        chunks.forEach((index, data) -> {
            if (index <= 0 || index > 0xFF) {
                throw new IllegalArgumentException("chunk index must be 1-255: " + index);
            }
            copy.put(index, data.clone());
        });
        this.chunks = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy of the main payload.
     */
    public byte[] main()
    {
        return main.clone();
    }

    /**
     * Returns a copy of the chunk with the given index.
     */
    public Optional<byte[]> chunk(int index)
    {
        byte[] c = chunks.get(index);
        return c == null ? Optional.empty() : Optional.of(c.clone());
    }

    /**
     * Chunk indexes in ascending order.
     */
    public Iterable<Integer> chunkIndexes()
    {
        return chunks.keySet();
    }

    public int chunkCount()
    {
        return chunks.size();
    }

    @Override
    public String toString()
    {
        return "Packet[mainLength=" + main.length + ", chunks=" + chunks.keySet() + "]";
    }
}
