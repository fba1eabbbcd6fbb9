package com.questrail.remotedisplay.batch;

import com.questrail.remotedisplay.batch.factor.BatchFactor;
import com.questrail.remotedisplay.internal.time.Cancellable;
import com.questrail.remotedisplay.stats.Adjustment;
import com.questrail.remotedisplay.stats.BoundedHistory;
import com.questrail.remotedisplay.stats.Sample;
import com.questrail.remotedisplay.stats.Statistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * BatchConfig
 * =============================================================================
 * Batch delay state of one window.
 *
 * <h2>Ownership</h2>
 * A config belongs to exactly one window's update pipeline, which is the only
 * writer. Anything else reads it through {@link #clone()} or
 * {@link #getInfo()}; both take the instance lock, so they are safe to call
 * from a reporting thread while the pipeline is recomputing.
 *
 * <h2>Recompute</h2>
 * {@link #recompute(DelaySample, Collection)} appends the sample to the
 * bounded histories and, unless {@link #isLocked() locked}, replaces the delay
 * with the weighted combination of the factor recommendations, raised to the
 * per-megapixel cost of the update and clamped to {@code [minDelay, maxDelay]}.
 * Invalid numbers never reach {@code delay}: a NaN or infinite candidate
 * leaves it unchanged.
 */
public final class BatchConfig implements Cloneable
{
    private double delay;
    private double minDelay;
    private double maxDelay;
    private double expireDelay;
    private double timeoutDelay;
    private int maxEvents;
    private int maxPixels;
    private int timeUnit;
    private boolean always;

    /** Milliseconds per megapixel; negative until the first measurement. */
    private double delayPerMegapixel = -1.0;

    private double lastEvent;
    private double lastUpdated;
    private double saved = Double.NaN;
    private boolean locked;

    private BoundedHistory<Sample> lastDelays;
    private BoundedHistory<Sample> lastActualDelays;
    private BoundedHistory<Sample> queueSizes;
    private BoundedHistory<Sample> pixelCosts;

    private List<Adjustment> factors = List.of();

    /** Expire timer of the pending batch; never cloned. */
    private Cancellable timer = Cancellable.NONE;

    private BatchConfig(BatchBounds bounds)
    {
        this.delay = bounds.initialDelay();
        this.minDelay = bounds.minDelay();
        this.maxDelay = bounds.maxDelay();
        this.expireDelay = bounds.expireDelay();
        this.timeoutDelay = bounds.timeoutDelay();
        this.maxEvents = bounds.maxEvents();
        this.maxPixels = bounds.maxPixels();
        this.timeUnit = bounds.timeUnit();
        this.always = bounds.always();

        int n = bounds.historySize();
        this.lastDelays = new BoundedHistory<>(n);
        this.lastActualDelays = new BoundedHistory<>(n);
        this.queueSizes = new BoundedHistory<>(n);
        this.pixelCosts = new BoundedHistory<>(n);
    }

    /**
     * Fresh config at the start delay. The server keeps one of these as the
     * template and clones it for each new window.
     */
    public static BatchConfig defaults(BatchBounds bounds)
    {
        return new BatchConfig(Objects.requireNonNull(bounds, "bounds"));
    }

    // -------------------------------------------------------------------------
    // Recompute
    // -------------------------------------------------------------------------

    /**
     * Records {@code sample} and recomputes the delay.
     *
     * @return the delay in effect after the call
     */
    public synchronized double recompute(DelaySample sample, Collection<? extends BatchFactor> active)
    {
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(active, "active");

        double now = sample.timestamp();
        lastUpdated = now;

        if (Double.isFinite(sample.actualDelayMs()) && sample.actualDelayMs() >= 0) {
            lastActualDelays.add(new Sample(now, sample.actualDelayMs()));
        }
        queueSizes.add(new Sample(now, Math.max(0, sample.queueDepth())));

        double megapixels = sample.megapixels();
        if (megapixels > 0 && Double.isFinite(sample.actualDelayMs()) && sample.actualDelayMs() >= 0) {
            pixelCosts.add(new Sample(now, sample.actualDelayMs() / megapixels));
        }

        if (locked) {
            return delay;
        }

        List<Adjustment> computed = new ArrayList<>(active.size());
        for (BatchFactor f : active) {
            computed.add(f.compute(this, now));
        }
        factors = Collections.unmodifiableList(computed);

        OptionalDouble cost = Statistics.timeWeightedAverage(pixelCosts.toList(), now);
        if (cost.isPresent() && cost.getAsDouble() > 0) {
            delayPerMegapixel = cost.getAsDouble();
        }

        double candidate = delay * combine(computed);
        if (delayPerMegapixel > 0 && megapixels > 0) {
            candidate = Math.max(candidate, delayPerMegapixel * megapixels);
        }
        if (Double.isFinite(candidate)) {
            delay = clamp(candidate);
        }

        lastDelays.add(new Sample(now, delay));
        return delay;
    }

    /**
     * Weighted mean of the factor multipliers. Adjustments with a non-finite
     * factor or a non-positive weight are ignored; with nothing left the
     * result is 1 (no change).
     */
    static double combine(List<Adjustment> adjustments)
    {
        double tv = 0.0;
        double tw = 0.0;
        for (Adjustment a : adjustments) {
            if (!Double.isFinite(a.factor()) || !Double.isFinite(a.weight()) || a.weight() <= 0) {
                continue;
            }
            tv += a.factor() * a.weight();
            tw += a.weight();
        }
        if (tw <= 0) {
            return 1.0;
        }
        return tv / tw;
    }

    private double clamp(double value)
    {
        return Math.min(maxDelay, Math.max(minDelay, value));
    }

    // -------------------------------------------------------------------------
    // Lock
    // -------------------------------------------------------------------------

    /**
     * Freezes the delay; samples are still recorded. The current delay is kept
     * in {@code saved}.
     */
    public synchronized void lock()
    {
        if (!locked) {
            saved = delay;
            locked = true;
        }
    }

    /**
     * Releases the lock and restores the delay saved by {@link #lock()}.
     */
    public synchronized void unlock()
    {
        if (locked) {
            locked = false;
            if (!Double.isNaN(saved)) {
                delay = saved;
            }
            saved = Double.NaN;
        }
    }

    public synchronized boolean isLocked()
    {
        return locked;
    }

    // -------------------------------------------------------------------------
    // Snapshot, introspection, teardown
    // -------------------------------------------------------------------------

    /**
     * Deep copy. Histories and the factor list are copied; the pending timer
     * is not, so cleaning up a clone never cancels the original's timer.
     */
    @Override
    public synchronized BatchConfig clone()
    {
        final BatchConfig c;
        try {
            c = (BatchConfig) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
        c.lastDelays = lastDelays.copy();
        c.lastActualDelays = lastActualDelays.copy();
        c.queueSizes = queueSizes.copy();
        c.pixelCosts = pixelCosts.copy();
        c.factors = List.copyOf(factors);
        c.timer = Cancellable.NONE;
        return c;
    }

    /**
     * Flat, sorted snapshot of every field, for reporting and tests. Series
     * are summarised as {@code .cur/.min/.max/.avg}; factors appear as
     * {@code factor.<metric>} and {@code factor.<metric>.weight}.
     */
    public synchronized Map<String, Object> getInfo()
    {
        Map<String, Object> info = new TreeMap<>();
        info.put("delay", delay);
        info.put("min-delay", minDelay);
        info.put("max-delay", maxDelay);
        info.put("expire-delay", expireDelay);
        info.put("timeout-delay", timeoutDelay);
        info.put("max-events", maxEvents);
        info.put("max-pixels", maxPixels);
        info.put("time-unit", timeUnit);
        info.put("always", always);
        info.put("locked", locked);
        info.put("delay-per-megapixel", delayPerMegapixel);
        info.put("last-event", lastEvent);
        info.put("last-updated", lastUpdated);
        if (!Double.isNaN(saved)) {
            info.put("saved", saved);
        }

        summarise(info, "delay", lastDelays);
        summarise(info, "actual-delay", lastActualDelays);
        summarise(info, "queue-size", queueSizes);
        summarise(info, "pixel-cost", pixelCosts);

        for (Adjustment a : factors) {
            info.put("factor." + a.metric(), a.factor());
            info.put("factor." + a.metric() + ".weight", a.weight());
        }
        return Collections.unmodifiableMap(info);
    }

    private static void summarise(Map<String, Object> info, String prefix, BoundedHistory<Sample> series)
    {
        if (series.isEmpty()) {
            return;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (Sample s : series) {
            min = Math.min(min, s.value());
            max = Math.max(max, s.value());
            sum += s.value();
        }
        info.put(prefix + ".cur", series.last().map(Sample::value).orElse(0.0));
        info.put(prefix + ".min", min);
        info.put(prefix + ".max", max);
        info.put(prefix + ".avg", sum / series.size());
    }

    /**
     * Cancels the pending timer and drops the factor results. Safe to call
     * more than once.
     */
    public synchronized void cleanup()
    {
        cancelTimer();
        factors = List.of();
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public synchronized double delay()
    {
        return delay;
    }

    /**
     * Sets the delay, clamped to the bounds. Ignored while locked.
     */
    public synchronized void setDelay(double value)
    {
        if (!locked && Double.isFinite(value)) {
            delay = clamp(value);
        }
    }

    /**
     * Delay most recently handed out by {@link #recompute}, or the current
     * delay before the first recompute.
     */
    public synchronized double requestedDelay()
    {
        return lastDelays.last().map(Sample::value).orElse(delay);
    }

    public synchronized double minDelay()
    {
        return minDelay;
    }

    public synchronized double maxDelay()
    {
        return maxDelay;
    }

    public synchronized double expireDelay()
    {
        return expireDelay;
    }

    public synchronized double timeoutDelay()
    {
        return timeoutDelay;
    }

    public synchronized int maxEvents()
    {
        return maxEvents;
    }

    public synchronized int maxPixels()
    {
        return maxPixels;
    }

    public synchronized int timeUnit()
    {
        return timeUnit;
    }

    public synchronized boolean always()
    {
        return always;
    }

    public synchronized double delayPerMegapixel()
    {
        return delayPerMegapixel;
    }

    public synchronized double lastEvent()
    {
        return lastEvent;
    }

    public synchronized void setLastEvent(double timestamp)
    {
        this.lastEvent = timestamp;
    }

    public synchronized double lastUpdated()
    {
        return lastUpdated;
    }

    public synchronized double saved()
    {
        return saved;
    }

    public synchronized BoundedHistory<Sample> lastDelays()
    {
        return lastDelays.copy();
    }

    public synchronized BoundedHistory<Sample> lastActualDelays()
    {
        return lastActualDelays.copy();
    }

    public synchronized BoundedHistory<Sample> queueSizes()
    {
        return queueSizes.copy();
    }

    public synchronized BoundedHistory<Sample> pixelCosts()
    {
        return pixelCosts.copy();
    }

    public synchronized List<Adjustment> factors()
    {
        return factors;
    }

    synchronized void setTimer(Cancellable timer)
    {
        this.timer.cancel();
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    synchronized void clearTimer()
    {
        this.timer = Cancellable.NONE;
    }

    synchronized void cancelTimer()
    {
        timer.cancel();
        timer = Cancellable.NONE;
    }
}
