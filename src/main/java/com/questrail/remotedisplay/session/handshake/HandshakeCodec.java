package com.questrail.remotedisplay.session.handshake;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * HandshakeCodec
 * -----------------------------------------------------------------------------
 * Byte layout of {@link HandshakeMessage}s, carried as the payload of index-0
 * frames.
 *
 * <pre>
 *   [type:1] fields...
 *   string : [len:2 BE] UTF-8 bytes     (len 0xFFFF = null)
 *   bytes  : [len:2 BE] raw bytes
 *   list   : [count:1] string*
 * </pre>
 *
 * <table>
 *   <caption>Message types</caption>
 *   <tr><th>type</th><th>message</th><th>fields</th></tr>
 *   <tr><td>0x01</td><td>Hello</td><td>username, digests (list), compressors (list)</td></tr>
 *   <tr><td>0x02</td><td>Challenge</td><td>salt, digest</td></tr>
 *   <tr><td>0x03</td><td>ChallengeResponse</td><td>response (bytes), clientSalt</td></tr>
 *   <tr><td>0x04</td><td>Accepted</td><td>compression</td></tr>
 *   <tr><td>0x05</td><td>Rejected</td><td>reason</td></tr>
 * </table>
 */
public final class HandshakeCodec
{
    static final int HELLO = 0x01;
    static final int CHALLENGE = 0x02;
    static final int CHALLENGE_RESPONSE = 0x03;
    static final int ACCEPTED = 0x04;
    static final int REJECTED = 0x05;

    private static final int NULL_LENGTH = 0xFFFF;
    private static final int MAX_FIELD = 0xFFFE;
    private static final int MAX_LIST = 0xFF;

    private HandshakeCodec() {}

    public static byte[] encode(HandshakeMessage message)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (message instanceof HandshakeMessage.Hello h) {
            out.write(HELLO);
            writeString(out, h.username());
            writeList(out, h.digests());
            writeList(out, h.compressors());
        } else if (message instanceof HandshakeMessage.Challenge c) {
            out.write(CHALLENGE);
            writeString(out, c.salt());
            writeString(out, c.digest());
        } else if (message instanceof HandshakeMessage.ChallengeResponse r) {
            out.write(CHALLENGE_RESPONSE);
            writeBytes(out, r.response());
            writeString(out, r.clientSalt());
        } else if (message instanceof HandshakeMessage.Accepted a) {
            out.write(ACCEPTED);
            writeString(out, a.compression());
        } else if (message instanceof HandshakeMessage.Rejected r) {
            out.write(REJECTED);
            writeString(out, r.reason());
        } else {
            throw new IllegalArgumentException("unknown handshake message: " + message);
        }
        return out.toByteArray();
    }

    /**
     * @throws FrameFormatException for an unknown type, a truncated field or
     *         trailing bytes
     */
    public static HandshakeMessage decode(byte[] data)
    {
        if (data.length == 0) {
            throw new FrameFormatException("empty handshake message");
        }
        ByteBuffer in = ByteBuffer.wrap(data);
        int type = in.get() & 0xFF;
        try {
            HandshakeMessage m;
            switch (type) {
                case HELLO:
                    m = new HandshakeMessage.Hello(requireString(in), readList(in), readList(in));
                    break;
                case CHALLENGE:
                    m = new HandshakeMessage.Challenge(requireString(in), requireString(in));
                    break;
                case CHALLENGE_RESPONSE:
                    m = new HandshakeMessage.ChallengeResponse(readBytes(in), readString(in));
                    break;
                case ACCEPTED:
                    m = new HandshakeMessage.Accepted(requireString(in));
                    break;
                case REJECTED:
                    m = new HandshakeMessage.Rejected(requireString(in));
                    break;
                default:
                    throw new FrameFormatException(String.format("unknown handshake message type 0x%02X", type));
            }
            if (in.hasRemaining()) {
                throw new FrameFormatException(in.remaining() + " trailing byte(s) after handshake message");
            }
            return m;
        } catch (BufferUnderflowException e) {
            throw new FrameFormatException("truncated handshake message of type " + type, e);
        }
    }

    private static void writeString(ByteArrayOutputStream out, String s)
    {
        if (s == null) {
            writeLength(out, NULL_LENGTH);
            return;
        }
        writeBytes(out, s.getBytes(StandardCharsets.UTF_8));
    }

    private static void writeBytes(ByteArrayOutputStream out, byte[] b)
    {
        if (b.length > MAX_FIELD) {
            throw new IllegalArgumentException("handshake field too long: " + b.length);
        }
        writeLength(out, b.length);
        out.write(b, 0, b.length);
    }

    private static void writeList(ByteArrayOutputStream out, List<String> items)
    {
        if (items.size() > MAX_LIST) {
            throw new IllegalArgumentException("too many list entries: " + items.size());
        }
        out.write(items.size());
        for (String s : items) {
            writeString(out, s);
        }
    }

    private static void writeLength(ByteArrayOutputStream out, int len)
    {
        out.write((len >> 8) & 0xFF);
        out.write(len & 0xFF);
    }

    private static byte[] readBytes(ByteBuffer in)
    {
        int len = in.getShort() & 0xFFFF;
        if (len == NULL_LENGTH) {
            throw new FrameFormatException("missing byte field");
        }
        byte[] b = new byte[len];
        in.get(b);
        return b;
    }

    private static String readString(ByteBuffer in)
    {
        int len = in.getShort() & 0xFFFF;
        if (len == NULL_LENGTH) {
            return null;
        }
        byte[] b = new byte[len];
        in.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }

    private static String requireString(ByteBuffer in)
    {
        String s = readString(in);
        if (s == null) {
            throw new FrameFormatException("missing string field");
        }
        return s;
    }

    private static List<String> readList(ByteBuffer in)
    {
        int count = in.get() & 0xFF;
        List<String> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(requireString(in));
        }
        return items;
    }
}
