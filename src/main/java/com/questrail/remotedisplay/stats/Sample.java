package com.questrail.remotedisplay.stats;

/**
 * One timestamped observation.
 *
 * @param timestamp monotonic time in seconds
 * @param value     observed value (milliseconds, packet count, ...)
 */
public record Sample(double timestamp, double value)
{
}
