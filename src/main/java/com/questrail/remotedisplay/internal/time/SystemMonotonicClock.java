package com.questrail.remotedisplay.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>For deterministic tests use a manual clock instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos()
    {
        return System.nanoTime();
    }
}
