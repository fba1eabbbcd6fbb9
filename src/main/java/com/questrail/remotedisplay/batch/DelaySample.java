package com.questrail.remotedisplay.batch;

/**
 * One observation made after an update went out.
 *
 * @param timestamp     monotonic seconds
 * @param actualDelayMs time from first damage to the update being sent
 * @param pixels        area of the update
 * @param queueDepth    packets still waiting in the connection's send queue
 */
public record DelaySample(double timestamp, double actualDelayMs, long pixels, int queueDepth)
{
    public double megapixels()
    {
        return pixels / 1_000_000.0;
    }
}
