package com.questrail.remotedisplay.batch.factor;

import com.questrail.remotedisplay.batch.BatchConfig;
import com.questrail.remotedisplay.stats.Adjustment;
import com.questrail.remotedisplay.stats.Statistics;

import java.util.List;

/**
 * DelayFactor
 * -----------------------------------------------------------------------------
 * The closed set of delay factors. Each one is a pure function of the
 * window's histories.
 */
public enum DelayFactor implements BatchFactor
{
    /**
     * Observed update latency against the delay that was asked for. Updates
     * taking longer than requested push the delay up.
     */
    DAMAGE_LATENCY("damage-latency") {
        @Override
        public Adjustment compute(BatchConfig config, double now)
        {
            double target = Math.max(1.0, config.requestedDelay());
            return Statistics.calculateForTarget(metric(), config.lastActualDelays().toList(), target, now);
        }
    },

    /**
     * Recent requested delays against their long-term average; smooths out
     * oscillation.
     */
    DELAY_TREND("delay-trend") {
        @Override
        public Adjustment compute(BatchConfig config, double now)
        {
            return Statistics.calculateForAverage(metric(), config.lastDelays().toList(), now);
        }
    },

    /**
     * Send queue backlog: a growing queue means the client or the network is
     * not keeping up.
     */
    PACKET_QUEUE("packet-queue") {
        @Override
        public Adjustment compute(BatchConfig config, double now)
        {
            return Statistics.queueInspect(metric(), config.queueSizes().toList(), now);
        }
    },

    /**
     * Observed cost per megapixel against the current estimate.
     */
    PIXEL_RATE("pixel-rate") {
        @Override
        public Adjustment compute(BatchConfig config, double now)
        {
            double estimate = config.delayPerMegapixel();
            if (!(estimate > 0)) {
                return Adjustment.neutral(metric());
            }
            return Statistics.calculateForTarget(metric(), config.pixelCosts().toList(), estimate, now);
        }
    };

    /** Every factor, in evaluation order. */
    public static final List<BatchFactor> ALL = List.of(values());

    private final String metric;

    DelayFactor(String metric)
    {
        this.metric = metric;
    }

    @Override
    public String metric()
    {
        return metric;
    }
}
