package com.questrail.remotedisplay.auth;

/**
 * Lifecycle of one {@link Authenticator} instance.
 */
public enum AuthState
{
    INIT,
    CHALLENGE_ISSUED,
    AUTHENTICATED,
    REJECTED;

    public boolean isTerminal()
    {
        return this == AUTHENTICATED || this == REJECTED;
    }
}
