package com.questrail.remotedisplay.batch.factor;

import com.questrail.remotedisplay.batch.BatchConfig;
import com.questrail.remotedisplay.stats.Adjustment;

/**
 * One named contribution to the batch delay.
 *
 * <p>A factor reads the histories of a {@link BatchConfig} and returns a
 * multiplier with a weight. It must not mutate the config and must not throw
 * for empty or degenerate histories; returning
 * {@link Adjustment#neutral(String)} is always acceptable.</p>
 */
public interface BatchFactor
{
    /**
     * Stable name, used as the metric of the returned adjustment and in
     * {@link BatchConfig#getInfo()} keys.
     */
    String metric();

    Adjustment compute(BatchConfig config, double now);
}
