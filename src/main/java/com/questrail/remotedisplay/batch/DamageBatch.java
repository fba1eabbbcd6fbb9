package com.questrail.remotedisplay.batch;

import java.util.List;
import java.util.Objects;

/**
 * Damage regions coalesced into one update request.
 *
 * @param firstDamage monotonic seconds of the oldest region in the batch
 * @param flushedAt   monotonic seconds at which the batch was released
 * @param expired     {@code true} when the expire timer forced the flush
 */
public record DamageBatch(int windowId, List<DamageRegion> regions, double firstDamage, double flushedAt,
                          boolean expired)
{
    public DamageBatch
    {
        regions = List.copyOf(Objects.requireNonNull(regions, "regions"));
    }

    public long pixels()
    {
        long total = 0;
        for (DamageRegion r : regions) {
            total += r.pixels();
        }
        return total;
    }

    /**
     * Milliseconds the oldest region waited.
     */
    public double waitedMs()
    {
        return Math.max(0.0, (flushedAt - firstDamage) * 1000.0);
    }
}
