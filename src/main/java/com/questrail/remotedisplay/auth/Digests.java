package com.questrail.remotedisplay.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Digests
 * -----------------------------------------------------------------------------
 * Salt generation and challenge response computation shared by the server side
 * verifiers and by clients.
 *
 * <h2>Response formats</h2>
 * <ul>
 *   <li>hmac digests: lowercase hex of {@code HMAC(password, salt)}, as ASCII
 *       bytes</li>
 *   <li>{@code xor}: {@code password XOR salt}, with the salt zero-padded or
 *       truncated to the password length</li>
 * </ul>
 *
 * <p>The salt used in both cases is {@link #effectiveSalt(String, String)}.</p>
 */
public final class Digests
{
    /** Random bytes per server salt; rendered as twice as many hex chars. */
    public static final int SALT_BYTES = 64;

    /** Shortest client salt accepted. */
    public static final int MIN_CLIENT_SALT_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private Digests() {}

    /**
     * Fresh server salt: {@link #SALT_BYTES} random bytes in lowercase hex.
     */
    public static String newSalt()
    {
        byte[] raw = new byte[SALT_BYTES];
        RANDOM.nextBytes(raw);
        return HEX.formatHex(raw);
    }

    /**
     * {@code serverSalt XOR clientSalt} over their ASCII bytes, truncated to
     * the shorter of the two. A {@code null} client salt leaves the server
     * salt unchanged.
     */
    public static byte[] effectiveSalt(String serverSalt, String clientSalt)
    {
        byte[] server = serverSalt.getBytes(StandardCharsets.US_ASCII);
        if (clientSalt == null) {
            return server;
        }
        return xor(server, clientSalt.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Byte-wise xor, truncated to the shorter input.
     */
    public static byte[] xor(byte[] a, byte[] b)
    {
        int n = Math.min(a.length, b.length);
        byte[] out = new byte[n];
        for (int i = 0; i < n; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }

    /**
     * Expected response for {@code digest}.
     */
    public static byte[] response(Digest digest, byte[] password, byte[] salt)
    {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(salt, "salt");

        if (!digest.isHmac()) {
            return xor(password, Arrays.copyOf(salt, password.length));
        }
        try {
            Mac mac = Mac.getInstance(digest.macAlgorithm());
            mac.init(new SecretKeySpec(password.length == 0 ? new byte[1] : password, digest.macAlgorithm()));
            return HEX.formatHex(mac.doFinal(salt)).getBytes(StandardCharsets.US_ASCII);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("digest " + digest + " not available", e);
        }
    }

    /**
     * Reverses an {@code xor} response into the password it carries.
     */
    public static byte[] unmaskXor(byte[] response, byte[] salt)
    {
        return xor(response, Arrays.copyOf(salt, response.length));
    }

    /**
     * Constant-time comparison; {@code false} when either side is {@code null}.
     */
    public static boolean matches(byte[] expected, byte[] actual)
    {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, actual);
    }
}
