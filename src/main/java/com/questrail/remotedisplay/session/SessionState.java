package com.questrail.remotedisplay.session;

/**
 * Connection lifecycle as seen by {@link DisplaySession}.
 */
public enum SessionState
{
    AWAITING_HELLO,
    CHALLENGE_ISSUED,
    AUTHENTICATED,
    REJECTED,
    CLOSED;

    public boolean isTerminal()
    {
        return this == REJECTED || this == CLOSED;
    }
}
