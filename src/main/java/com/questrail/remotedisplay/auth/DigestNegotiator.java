package com.questrail.remotedisplay.auth;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the digest to use from what the client offered.
 */
public final class DigestNegotiator
{
    private DigestNegotiator() {}

    /**
     * Strongest hmac digest present in both sets, then {@code xor}. A plain
     * {@value Digest#ANY_HMAC} offer matches every hmac digest. Names the
     * server does not know are ignored.
     *
     * @return empty when nothing matches; the caller must reject, never
     *         downgrade
     */
    public static Optional<Digest> choose(Collection<String> offered, Set<Digest> supported)
    {
        boolean anyHmac = offered.contains(Digest.ANY_HMAC);
        for (Digest d : Digest.values()) {
            if (!supported.contains(d)) {
                continue;
            }
            if (offered.contains(d.wireName()) || (anyHmac && d.isHmac())) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
