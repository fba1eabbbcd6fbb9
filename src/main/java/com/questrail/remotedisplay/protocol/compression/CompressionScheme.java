package com.questrail.remotedisplay.protocol.compression;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.frame.FrameFlag;
import com.questrail.remotedisplay.protocol.frame.FrameFlags;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import java.io.ByteArrayOutputStream;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * CompressionScheme
 * -----------------------------------------------------------------------------
 * Packet compressors known to the wire format.
 *
 * <ul>
 *   <li>{@link #ZLIB} is the implicit default: no compression bit, level &gt; 0.</li>
 *   <li>{@link #LZ4} is scheme A. Block format, prefixed by the uncompressed
 *       size as a 4-byte little-endian integer.</li>
 *   <li>{@link #LZO} is scheme B. Recognised on the wire but there is no JVM
 *       implementation; {@link #isAvailable()} is false.</li>
 * </ul>
 */
public enum CompressionScheme
{
    ZLIB("zlib", null)
    {
        @Override
        public byte[] compress(byte[] data, int level)
        {
            Deflater deflater = new Deflater(Math.max(0, Math.min(9, level)));
            try {
                deflater.setInput(data);
                deflater.finish();
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
                byte[] buf = new byte[8192];
                while (!deflater.finished()) {
                    int n = deflater.deflate(buf);
                    out.write(buf, 0, n);
                }
                return out.toByteArray();
            } finally {
                deflater.end();
            }
        }

        @Override
        public byte[] decompress(byte[] data, long maxSize)
        {
            Inflater inflater = new Inflater();
            try {
                inflater.setInput(data);
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length * 2));
                byte[] buf = new byte[8192];
                while (!inflater.finished()) {
                    int n = inflater.inflate(buf);
                    if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                        throw new FrameFormatException("truncated zlib payload");
                    }
                    if (out.size() + (long) n > maxSize) {
                        throw new FrameFormatException("decompressed payload exceeds limit " + maxSize);
                    }
                    out.write(buf, 0, n);
                }
                return out.toByteArray();
            } catch (DataFormatException e) {
                throw new FrameFormatException("invalid zlib payload", e);
            } finally {
                inflater.end();
            }
        }
    },

    LZ4("lz4", FrameFlag.COMPRESSION_A)
    {
        @Override
        public byte[] compress(byte[] data, int level)
        {
            LZ4Compressor compressor = level >= 7
                    ? LZ4_FACTORY.highCompressor(level)
                    : LZ4_FACTORY.fastCompressor();
            byte[] compressed = compressor.compress(data);

            byte[] out = new byte[SIZE_PREFIX + compressed.length];
            writeIntLE(out, data.length);
            System.arraycopy(compressed, 0, out, SIZE_PREFIX, compressed.length);
            return out;
        }

        @Override
        public byte[] decompress(byte[] data, long maxSize)
        {
            if (data.length < SIZE_PREFIX) {
                throw new FrameFormatException("lz4 payload too short");
            }
            final long size = readIntLE(data) & 0xFFFF_FFFFL;
            if (size > maxSize) {
                throw new FrameFormatException("decompressed payload exceeds limit " + maxSize);
            }
            long compressedLength = data.length - SIZE_PREFIX;
            if (size > compressedLength * LZ4_MAX_RATIO) {
                throw new FrameFormatException("lz4 payload of " + compressedLength
                        + " bytes cannot expand to announced " + size);
            }

            byte[] out = new byte[(int) size];
            try {
                LZ4SafeDecompressor decompressor = LZ4_FACTORY.safeDecompressor();
                int n = decompressor.decompress(data, SIZE_PREFIX, data.length - SIZE_PREFIX, out, 0);
                if (n != size) {
                    throw new FrameFormatException("lz4 size mismatch: announced " + size + ", got " + n);
                }
                return out;
            } catch (LZ4Exception e) {
                throw new FrameFormatException("invalid lz4 payload", e);
            }
        }
    },

    LZO("lzo", FrameFlag.COMPRESSION_B)
    {
        @Override
        public boolean isAvailable()
        {
            return false;
        }

        @Override
        public byte[] compress(byte[] data, int level)
        {
            throw new UnsupportedOperationException("lzo compression is not available");
        }

        @Override
        public byte[] decompress(byte[] data, long maxSize)
        {
            throw new FrameFormatException("lzo compressed payloads are not supported");
        }
    };

    private static final int SIZE_PREFIX = 4;
    /** An LZ4 block byte never expands to more than 255 bytes. */
    private static final long LZ4_MAX_RATIO = 255;
    private static final LZ4Factory LZ4_FACTORY = LZ4Factory.fastestInstance();

    private final String wireName;
    private final FrameFlag flag;

    CompressionScheme(String wireName, FrameFlag flag)
    {
        this.wireName = wireName;
        this.flag = flag;
    }

    /**
     * Name used in capability negotiation and configuration ("zlib", "lz4", "lzo").
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Flag announcing this scheme, empty for the implicit default.
     */
    public Optional<FrameFlag> flag()
    {
        return Optional.ofNullable(flag);
    }

    public boolean isAvailable()
    {
        return true;
    }

    public abstract byte[] compress(byte[] data, int level);

    /**
     * @param maxSize upper bound on the decompressed size
     * @throws FrameFormatException if the payload is corrupt, too large or unsupported
     */
    public abstract byte[] decompress(byte[] data, long maxSize);

    /**
     * Resolves how a received payload was compressed.
     *
     * <ol>
     *   <li>NO_HEADER: raw chunk, nothing to undo.</li>
     *   <li>Scheme A bit, then scheme B bit, in that order.</li>
     *   <li>Level &gt; 0 without a scheme bit: the implicit default (zlib).</li>
     *   <li>Level 0: not compressed.</li>
     * </ol>
     *
     * @return the scheme to decompress with, or empty if the payload is raw
     */
    public static Optional<CompressionScheme> resolve(FrameFlags flags, int level)
    {
        if (flags.has(FrameFlag.NO_HEADER)) {
            return Optional.empty();
        }
        if (flags.has(FrameFlag.COMPRESSION_A)) {
            return Optional.of(LZ4);
        }
        if (flags.has(FrameFlag.COMPRESSION_B)) {
            return Optional.of(LZO);
        }
        return level > 0 ? Optional.of(ZLIB) : Optional.empty();
    }

    public static Optional<CompressionScheme> forName(String name)
    {
        for (CompressionScheme s : values()) {
            if (s.wireName.equalsIgnoreCase(name)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    private static void writeIntLE(byte[] out, int v)
    {
        out[0] = (byte) v;
        out[1] = (byte) (v >>> 8);
        out[2] = (byte) (v >>> 16);
        out[3] = (byte) (v >>> 24);
    }

    private static int readIntLE(byte[] in)
    {
        return (in[0] & 0xFF)
                | ((in[1] & 0xFF) << 8)
                | ((in[2] & 0xFF) << 16)
                | ((in[3] & 0xFF) << 24);
    }
}
