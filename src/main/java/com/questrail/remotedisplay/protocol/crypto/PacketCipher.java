package com.questrail.remotedisplay.protocol.crypto;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * PacketCipher
 * -----------------------------------------------------------------------------
 * Encrypts and decrypts frame payloads for sessions with the CIPHER flag.
 *
 * <p>AES/CBC with PKCS#7 padding. Every payload carries its own random 16-byte
 * IV as a prefix, so packets can be decrypted independently and in any
 * order:</p>
 *
 * <pre>
 *   [ IV (16 bytes) ][ ciphertext ... ]
 * </pre>
 *
 * <p>Instances are immutable; a fresh {@link Cipher} is created per call.</p>
 */
public final class PacketCipher
{
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final String KDF = "PBKDF2WithHmacSHA1";
    private static final int IV_LENGTH = 16;

    private final SecretKeySpec key;
    private final SecureRandom random;

    private PacketCipher(SecretKeySpec key, SecureRandom random)
    {
        this.key = key;
        this.random = random;
    }

    /**
     * Derives the session key from the shared secret.
     *
     * @throws IllegalStateException if the JVM lacks the required algorithms
     */
    public static PacketCipher create(String secret, CipherParameters params)
    {
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(params, "params");
        if (secret.isEmpty()) {
            throw new IllegalArgumentException("encryption requires a non-empty secret");
        }

        PBEKeySpec spec = new PBEKeySpec(
                secret.toCharArray(),
                params.keySalt().getBytes(StandardCharsets.UTF_8),
                params.iterations(),
                params.keySize() * 8);
        try {
            byte[] derived = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new PacketCipher(new SecretKeySpec(derived, CipherParameters.AES), new SecureRandom());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot derive packet cipher key", e);
        } finally {
            spec.clearPassword();
        }
    }

    public byte[] encrypt(byte[] plain)
    {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] body = c.doFinal(plain);

            byte[] out = Arrays.copyOf(iv, IV_LENGTH + body.length);
            System.arraycopy(body, 0, out, IV_LENGTH, body.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("packet encryption failed", e);
        }
    }

    /**
     * @throws FrameFormatException if the payload is too short or fails to decrypt
     */
    public byte[] decrypt(byte[] wire)
    {
        if (wire.length < IV_LENGTH * 2) {
            throw new FrameFormatException("encrypted payload too short: " + wire.length);
        }
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(wire, 0, IV_LENGTH));
            return c.doFinal(wire, IV_LENGTH, wire.length - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new FrameFormatException("cannot decrypt payload", e);
        }
    }
}
