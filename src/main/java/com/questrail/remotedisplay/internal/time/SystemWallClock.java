package com.questrail.remotedisplay.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 * Observability only.
 */
public enum SystemWallClock implements WallClock
{
    INSTANCE;

    @Override
    public Instant now()
    {
        return Instant.now();
    }
}
