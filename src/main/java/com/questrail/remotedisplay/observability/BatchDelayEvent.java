package com.questrail.remotedisplay.observability;

import com.questrail.remotedisplay.stats.Adjustment;

import java.time.Instant;
import java.util.List;

/**
 * Record representing one delay recomputation of a window's batch controller.
 */
public record BatchDelayEvent(
    Instant timestamp,
    int windowId,
    double oldDelay,
    double newDelay,
    boolean locked,
    List<Adjustment> factors
) {
    public BatchDelayEvent {
        factors = List.copyOf(factors);
    }

    public boolean changed() {
        return Double.compare(oldDelay, newDelay) != 0;
    }
}
