package com.questrail.remotedisplay.auth;

import java.util.Objects;

/**
 * A challenge sent to the client: the salt and the digest to answer with.
 *
 * @param issuedAtNanos monotonic time of issue, for the session's timeout
 */
public record AuthChallenge(String salt, Digest digest, long issuedAtNanos)
{
    public AuthChallenge
    {
        Objects.requireNonNull(salt, "salt");
        Objects.requireNonNull(digest, "digest");
    }
}
