package com.questrail.remotedisplay.auth;

import java.util.EnumSet;
import java.util.Set;

/**
 * Runs the full challenge exchange and rejects every response.
 */
public final class RejectAuthenticator extends AbstractChallengeAuthenticator
{
    public RejectAuthenticator(String username)
    {
        super(username);
    }

    @Override
    public String name()
    {
        return "reject";
    }

    @Override
    protected Set<Digest> supportedDigests()
    {
        return EnumSet.allOf(Digest.class);
    }

    @Override
    protected boolean verify(AuthChallenge challenge, byte[] salt, byte[] response)
    {
        return false;
    }
}
