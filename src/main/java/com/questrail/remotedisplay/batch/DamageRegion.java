package com.questrail.remotedisplay.batch;

/**
 * A changed screen rectangle reported by the capture back end.
 *
 * @param timestamp monotonic seconds at which the change was observed
 */
public record DamageRegion(int x, int y, int width, int height, double timestamp)
{
    public DamageRegion
    {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("negative size: " + width + "x" + height);
        }
    }

    public long pixels()
    {
        return (long) width * height;
    }

    public double megapixels()
    {
        return pixels() / 1_000_000.0;
    }
}
