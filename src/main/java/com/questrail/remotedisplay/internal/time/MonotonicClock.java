package com.questrail.remotedisplay.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for batch delay computation, sample timestamps and timeouts.
 *
 * <h2>Binding invariant</h2>
 * Every timing decision (challenge timeouts, delay histories, time-weighted
 * averages) MUST use a monotonic time source. Wall-clock time is permitted
 * only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Same instant as {@link #nowNanos()}, expressed in seconds.
     *
     * <p>Statistics samples carry their timestamps in seconds so that the
     * age-based weights stay in a sensible numeric range.</p>
     */
    default double nowSeconds()
    {
        return nowNanos() / 1_000_000_000.0;
    }
}
