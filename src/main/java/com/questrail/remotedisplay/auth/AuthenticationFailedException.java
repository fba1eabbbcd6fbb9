package com.questrail.remotedisplay.auth;

/**
 * A client used up its authentication attempts.
 */
public final class AuthenticationFailedException extends RuntimeException
{
    private final String username;
    private final int attempts;

    public AuthenticationFailedException(String username, int attempts)
    {
        super("authentication failed for '" + username + "' after " + attempts + " attempt(s)");
        this.username = username;
        this.attempts = attempts;
    }

    public String username()
    {
        return username;
    }

    public int attempts()
    {
        return attempts;
    }
}
