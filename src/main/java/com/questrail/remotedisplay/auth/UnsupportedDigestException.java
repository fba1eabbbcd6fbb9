package com.questrail.remotedisplay.auth;

import java.util.Set;

/**
 * No digest requested by the client is acceptable to the authenticator.
 * The session must be rejected.
 */
public final class UnsupportedDigestException extends RuntimeException
{
    private final Set<String> requested;

    public UnsupportedDigestException(String authenticator, Set<String> requested, Set<Digest> supported)
    {
        super(authenticator + ": none of the requested digests " + requested
                + " is supported (supported: " + supported + ")");
        this.requested = Set.copyOf(requested);
    }

    public Set<String> requested()
    {
        return requested;
    }
}
