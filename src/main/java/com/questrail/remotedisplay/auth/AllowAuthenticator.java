package com.questrail.remotedisplay.auth;

import java.util.EnumSet;
import java.util.Set;

/**
 * Runs the full challenge exchange and accepts any response. Useful for
 * testing clients.
 */
public final class AllowAuthenticator extends AbstractChallengeAuthenticator
{
    public AllowAuthenticator(String username)
    {
        super(username);
    }

    @Override
    public String name()
    {
        return "allow";
    }

    @Override
    protected Set<Digest> supportedDigests()
    {
        return EnumSet.allOf(Digest.class);
    }

    @Override
    protected boolean verify(AuthChallenge challenge, byte[] salt, byte[] response)
    {
        return true;
    }
}
