package com.questrail.remotedisplay.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Password digests a client may be asked to use, strongest first.
 *
 * <p>{@code hmac+md5} and {@code hmac+sha1} are never offered or accepted. A
 * client that offers plain {@link #ANY_HMAC} leaves the hash to the server,
 * which picks its strongest SHA-2 variant; md5 is never the answer.</p>
 */
public enum Digest
{
    HMAC_SHA512("hmac+sha512", "HmacSHA512"),
    HMAC_SHA384("hmac+sha384", "HmacSHA384"),
    HMAC_SHA256("hmac+sha256", "HmacSHA256"),
    HMAC_SHA224("hmac+sha224", "HmacSHA224"),

    /**
     * Sends the password itself, masked with the salt. Only for verifiers that
     * need the clear password, and only over an encrypted connection.
     */
    XOR("xor", null);

    /** Offer that accepts any hmac digest the server chooses. */
    public static final String ANY_HMAC = "hmac";

    private final String wireName;
    private final String macAlgorithm;

    Digest(String wireName, String macAlgorithm)
    {
        this.wireName = wireName;
        this.macAlgorithm = macAlgorithm;
    }

    public String wireName()
    {
        return wireName;
    }

    public boolean isHmac()
    {
        return macAlgorithm != null;
    }

    /**
     * JCA {@code Mac} algorithm name; only defined for HMAC digests.
     */
    String macAlgorithm()
    {
        if (macAlgorithm == null) {
            throw new IllegalStateException(wireName + " is not an hmac digest");
        }
        return macAlgorithm;
    }

    public static Optional<Digest> forName(String name)
    {
        if (name == null) {
            return Optional.empty();
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (Digest d : values()) {
            if (d.wireName.equals(n)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
