package com.questrail.remotedisplay.protocol.codec;

import com.questrail.remotedisplay.protocol.compression.CompressionPolicy;
import com.questrail.remotedisplay.protocol.compression.CompressionScheme;
import com.questrail.remotedisplay.protocol.crypto.PacketCipher;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.FrameFlag;
import com.questrail.remotedisplay.protocol.frame.FrameFlags;
import com.questrail.remotedisplay.protocol.frame.Packet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FramePayloadCodec
 * -----------------------------------------------------------------------------
 * Turns packet bytes into frame payloads and back: compression, then
 * encryption on the way out; decryption, then decompression on the way in.
 *
 * <h2>Inbound resolution</h2>
 * <ol>
 *   <li>CIPHER flag: decrypt (a session without a cipher rejects the frame,
 *       and a session with one rejects unflagged frames)</li>
 *   <li>{@link CompressionScheme#resolve}: NO_HEADER verbatim, scheme A before
 *       scheme B, otherwise zlib when level &gt; 0</li>
 * </ol>
 *
 * <p>Instances are immutable. Enabling encryption produces a new codec via
 * {@link #withCipher(PacketCipher)}.</p>
 */
public final class FramePayloadCodec
{
    private final CompressionPolicy compression;
    private final PacketCipher cipher;
    private final long maxPayloadSize;

    public FramePayloadCodec(CompressionPolicy compression, long maxPayloadSize)
    {
        this(compression, null, maxPayloadSize);
    }

    private FramePayloadCodec(CompressionPolicy compression, PacketCipher cipher, long maxPayloadSize)
    {
        this.compression = Objects.requireNonNull(compression, "compression");
        this.cipher = cipher;
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive");
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    public FramePayloadCodec withCipher(PacketCipher cipher)
    {
        return new FramePayloadCodec(compression, Objects.requireNonNull(cipher, "cipher"), maxPayloadSize);
    }

    public FramePayloadCodec withCompression(CompressionPolicy compression)
    {
        return new FramePayloadCodec(compression, cipher, maxPayloadSize);
    }

    public boolean encrypted()
    {
        return cipher != null;
    }

    public CompressionPolicy compression()
    {
        return compression;
    }

    /**
     * Builds the outbound frame for one payload, compressing it with the
     * policy's scheme.
     */
    public Frame encode(byte[] data, int index)
    {
        Objects.requireNonNull(data, "data");

        FrameFlags flags = FrameFlags.NONE;
        int level = 0;
        byte[] body = data;

        Optional<CompressionScheme> scheme = compression.select();
        if (scheme.isPresent()) {
            CompressionScheme s = scheme.get();
            level = compression.level();
            body = s.compress(data, level);
            if (s.flag().isPresent()) {
                flags = flags.with(s.flag().get());
            }
        }
        return seal(flags, level, index, body);
    }

    /**
     * Builds a frame whose payload is sent verbatim (NO_HEADER).
     */
    public Frame encodeRaw(byte[] data, int index)
    {
        Objects.requireNonNull(data, "data");
        return seal(FrameFlags.of(FrameFlag.NO_HEADER), 0, index, data);
    }

    /**
     * Frames for a whole packet: chunks first in index order, main packet last.
     */
    public List<Frame> encode(Packet packet)
    {
        List<Frame> frames = new ArrayList<>(packet.chunkCount() + 1);
        for (int index : packet.chunkIndexes()) {
            frames.add(encode(packet.chunk(index).orElseThrow(), index));
        }
        frames.add(encode(packet.main(), 0));
        return frames;
    }

    /**
     * Recovers the packet bytes carried by a frame.
     *
     * @throws FrameFormatException if the payload cannot be decrypted or
     *         decompressed
     */
    public byte[] decode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        byte[] body = frame.payload();
        FrameFlags flags = frame.flags();

        if (flags.has(FrameFlag.CIPHER)) {
            if (cipher == null) {
                throw new FrameFormatException("encrypted frame received but no cipher is configured");
            }
            body = cipher.decrypt(body);
        } else if (cipher != null) {
            throw new FrameFormatException("unencrypted frame received on an encrypted session");
        }

        Optional<CompressionScheme> scheme = CompressionScheme.resolve(flags, frame.level());
        if (scheme.isEmpty()) {
            return body;
        }
        return scheme.get().decompress(body, maxPayloadSize);
    }

    private Frame seal(FrameFlags flags, int level, int index, byte[] body)
    {
        if (cipher != null) {
            body = cipher.encrypt(body);
            flags = flags.with(FrameFlag.CIPHER);
        }
        if (body.length > maxPayloadSize) {
            throw new IllegalArgumentException("payload of " + body.length
                    + " bytes exceeds limit " + maxPayloadSize);
        }
        return new Frame(flags, level, index, body);
    }
}
