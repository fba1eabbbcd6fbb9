package com.questrail.remotedisplay.protocol.crypto;

import java.util.Objects;

/**
 * Key-derivation parameters exchanged when a session turns encryption on.
 *
 * <p>Only "AES" is supported. The key is stretched from the shared secret with
 * PBKDF2-HMAC-SHA1 using {@code keySalt} and {@code iterations}.</p>
 *
 * @param cipher     cipher name, always "AES"
 * @param keySalt    salt for key stretching
 * @param iterations PBKDF2 iterations, at least {@link #MIN_ITERATIONS}
 * @param keySize    derived key size in bytes (16, 24 or 32)
 */
public record CipherParameters(String cipher, String keySalt, int iterations, int keySize)
{
    public static final String AES = "AES";
    public static final int MIN_ITERATIONS = 100;
    public static final int DEFAULT_ITERATIONS = 1000;
    public static final int DEFAULT_KEY_SIZE = 32;

    public CipherParameters
    {
        Objects.requireNonNull(cipher, "cipher");
        Objects.requireNonNull(keySalt, "keySalt");
        if (!AES.equals(cipher)) {
            throw new IllegalArgumentException("unsupported cipher: " + cipher);
        }
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException("too few key stretching iterations: " + iterations);
        }
        if (keySize != 16 && keySize != 24 && keySize != 32) {
            throw new IllegalArgumentException("invalid AES key size: " + keySize);
        }
        if (keySalt.isEmpty()) {
            throw new IllegalArgumentException("keySalt must not be empty");
        }
    }

    public static CipherParameters aes(String keySalt)
    {
        return new CipherParameters(AES, keySalt, DEFAULT_ITERATIONS, DEFAULT_KEY_SIZE);
    }
}
