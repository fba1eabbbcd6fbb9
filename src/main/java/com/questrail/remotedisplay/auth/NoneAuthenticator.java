package com.questrail.remotedisplay.auth;

import java.util.Optional;
import java.util.Set;

/**
 * Accepts without a challenge. For connections that are already trusted
 * (local sockets, authenticated tunnels).
 */
public final class NoneAuthenticator implements Authenticator
{
    private AuthState state = AuthState.INIT;

    @Override
    public String name()
    {
        return "none";
    }

    @Override
    public boolean requiresChallenge()
    {
        return false;
    }

    @Override
    public Optional<AuthChallenge> getChallenge(Set<String> requestedDigests)
    {
        return Optional.empty();
    }

    @Override
    public boolean authenticate(byte[] response, String clientSalt)
    {
        state = AuthState.AUTHENTICATED;
        return true;
    }

    @Override
    public AuthState state()
    {
        return state;
    }

    @Override
    public void discardChallenge()
    {
    }
}
