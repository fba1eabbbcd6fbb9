package com.questrail.remotedisplay.auth;

import com.questrail.remotedisplay.internal.time.MonotonicClock;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed shared secret, verified with hmac digests only.
 */
public final class PasswordAuthenticator extends AbstractChallengeAuthenticator
{
    static final Set<Digest> HMAC_DIGESTS = EnumSet.of(
            Digest.HMAC_SHA512, Digest.HMAC_SHA384, Digest.HMAC_SHA256, Digest.HMAC_SHA224);

    private final byte[] secret;

    public PasswordAuthenticator(String username, String secret)
    {
        super(username);
        this.secret = Objects.requireNonNull(secret, "secret").getBytes(StandardCharsets.UTF_8);
    }

    public PasswordAuthenticator(String username, String secret, MonotonicClock clock)
    {
        super(username, clock);
        this.secret = Objects.requireNonNull(secret, "secret").getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String name()
    {
        return "password";
    }

    @Override
    protected Set<Digest> supportedDigests()
    {
        return HMAC_DIGESTS;
    }

    @Override
    protected boolean verify(AuthChallenge challenge, byte[] salt, byte[] response)
    {
        return checkPassword(challenge, salt, secret, response);
    }
}
