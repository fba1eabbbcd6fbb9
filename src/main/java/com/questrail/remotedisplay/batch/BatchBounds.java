package com.questrail.remotedisplay.batch;

import com.questrail.remotedisplay.config.ConfigSource;
import com.questrail.remotedisplay.config.IntSetting;

/**
 * BatchBounds
 * -----------------------------------------------------------------------------
 * Immutable batch delay bounds and damage limits, resolved once at startup and
 * shared read-only by every session.
 *
 * <p>Delays are in milliseconds. {@code timeUnit} divides the event window used
 * for damage accounting; {@code historySize} is the capacity of every bounded
 * history kept per window.</p>
 */
public record BatchBounds(
        int minDelay,
        int startDelay,
        int maxDelay,
        int expireDelay,
        int timeoutDelay,
        int maxEvents,
        int maxPixels,
        int timeUnit,
        int historySize,
        boolean always)
{
    public static final IntSetting MIN_DELAY = new IntSetting("BATCH_MIN_DELAY", 5, 0, 1000);
    public static final IntSetting START_DELAY = new IntSetting("BATCH_START_DELAY", 50, 1, 1000);
    public static final IntSetting MAX_DELAY = new IntSetting("BATCH_MAX_DELAY", 500, 1, 15000);
    public static final IntSetting EXPIRE_DELAY = new IntSetting("BATCH_EXPIRE_DELAY", 1000, 10, 10000);
    public static final IntSetting TIMEOUT_DELAY = new IntSetting("BATCH_TIMEOUT_DELAY", 15000, 1, 100000);
    public static final IntSetting MAX_EVENTS = new IntSetting("BATCH_MAX_EVENTS", 50, 1, 1000);
    public static final IntSetting MAX_PIXELS = new IntSetting("BATCH_MAX_PIXELS", 1024 * 1024 * 50, 1, 1 << 30);
    public static final IntSetting TIME_UNIT = new IntSetting("BATCH_TIME_UNIT", 1, 1, 1000);
    public static final IntSetting HISTORY = new IntSetting("BATCH_HISTORY", 64, 4, 1024);
    public static final IntSetting ALWAYS = new IntSetting("BATCH_ALWAYS", 0, 0, 1);

    public BatchBounds
    {
        if (minDelay < 0) {
            throw new IllegalArgumentException("minDelay must be >= 0: " + minDelay);
        }
        if (maxDelay < minDelay) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " < minDelay " + minDelay);
        }
        if (maxEvents <= 0 || maxPixels <= 0 || timeUnit <= 0 || historySize <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
        if (expireDelay <= 0 || timeoutDelay <= 0) {
            throw new IllegalArgumentException("expire and timeout delays must be positive");
        }
    }

    /**
     * Resolves every bound from {@code source}. Invalid overrides are logged
     * and replaced (see {@link IntSetting}); a max delay resolved below the min
     * delay is raised to it.
     */
    public static BatchBounds resolve(ConfigSource source)
    {
        int min = MIN_DELAY.resolve(source);
        int max = Math.max(min, MAX_DELAY.resolve(source));
        return new BatchBounds(
                min,
                START_DELAY.resolve(source),
                max,
                EXPIRE_DELAY.resolve(source),
                TIMEOUT_DELAY.resolve(source),
                MAX_EVENTS.resolve(source),
                MAX_PIXELS.resolve(source),
                TIME_UNIT.resolve(source),
                HISTORY.resolve(source),
                ALWAYS.resolveFlag(source));
    }

    public static BatchBounds defaults()
    {
        return resolve(ConfigSource.EMPTY);
    }

    /**
     * Start delay clamped into {@code [minDelay, maxDelay]}.
     */
    public double initialDelay()
    {
        return Math.min(maxDelay, Math.max(minDelay, startDelay));
    }
}
