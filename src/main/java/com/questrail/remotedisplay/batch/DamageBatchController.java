package com.questrail.remotedisplay.batch;

import com.questrail.remotedisplay.batch.factor.BatchFactor;
import com.questrail.remotedisplay.internal.time.MonotonicClock;
import com.questrail.remotedisplay.internal.time.MonotonicScheduler;
import com.questrail.remotedisplay.internal.time.WallClock;
import com.questrail.remotedisplay.observability.BatchDelayEvent;
import com.questrail.remotedisplay.observability.DisplayErrorEvent;
import com.questrail.remotedisplay.observability.DisplayObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * DamageBatchController
 * =============================================================================
 * Decides when a window's damage is turned into an update.
 *
 * <h2>Damage</h2>
 * While the damage rate stays under {@code maxEvents} regions and
 * {@code maxPixels} pixels per time unit, each region is flushed immediately.
 * Above that (or when {@code always} is set) regions are coalesced and a timer
 * releases the batch after the current delay, capped by the expire delay.
 *
 * <h2>Delay</h2>
 * The owning pipeline reports each sent update through
 * {@link #onDelaySample(DelaySample)}; the controller recomputes the delay on
 * its {@link BatchConfig} and publishes a {@link BatchDelayEvent}.
 *
 * <h2>Threading</h2>
 * Damage and samples arrive on the session's worker; the flush timer fires on
 * the scheduler's thread. All entry points are synchronized. The flush target
 * is invoked while holding the controller lock and must not call back into
 * this controller from another thread.
 */
public final class DamageBatchController
{
    private static final Logger log = LoggerFactory.getLogger(DamageBatchController.class);

    private final int windowId;
    private final BatchConfig config;
    private final List<BatchFactor> factors;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final DisplayObservabilitySink sink;
    private final Consumer<DamageBatch> flushTarget;

    private final List<DamageRegion> pending = new ArrayList<>();
    private final ArrayDeque<Event> recentEvents = new ArrayDeque<>();
    private long recentPixels;

    private double firstDamage = Double.NaN;
    private double lastFlush = Double.NaN;
    private long generation;
    private boolean closed;

    private record Event(double timestamp, long pixels) {}

    public DamageBatchController(int windowId,
                                 BatchConfig config,
                                 List<? extends BatchFactor> factors,
                                 MonotonicClock clock,
                                 MonotonicScheduler scheduler,
                                 WallClock wallClock,
                                 DisplayObservabilitySink sink,
                                 Consumer<DamageBatch> flushTarget)
    {
        this.windowId = windowId;
        this.config = Objects.requireNonNull(config, "config");
        this.factors = List.copyOf(Objects.requireNonNull(factors, "factors"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.flushTarget = Objects.requireNonNull(flushTarget, "flushTarget");
    }

    public int windowId()
    {
        return windowId;
    }

    // -------------------------------------------------------------------------
    // Damage
    // -------------------------------------------------------------------------

    /**
     * Reports a changed region. Either flushes it right away or adds it to the
     * pending batch.
     */
    public synchronized void damage(DamageRegion region)
    {
        Objects.requireNonNull(region, "region");
        if (closed) {
            log.debug("window {}: damage after cleanup ignored", windowId);
            return;
        }

        double now = clock.nowSeconds();
        config.setLastEvent(now);
        recordEvent(now, region.pixels());

        if (!pending.isEmpty()) {
            pending.add(region);
            return;
        }

        if (!shouldBatch(now)) {
            emit(new DamageBatch(windowId, List.of(region), now, now, false));
            return;
        }

        pending.add(region);
        firstDamage = now;
        schedule();
    }

    /**
     * {@code true} when damage should be coalesced: the window is configured
     * to always batch, a batch is already pending, or the damage rate over the
     * last time unit exceeds either limit.
     */
    public synchronized boolean shouldBatch(double now)
    {
        if (config.always() || !pending.isEmpty()) {
            return true;
        }
        evictEvents(now);
        return recentEvents.size() > config.maxEvents() || recentPixels > config.maxPixels();
    }

    private void recordEvent(double now, long pixels)
    {
        recentEvents.addLast(new Event(now, pixels));
        recentPixels += pixels;
        evictEvents(now);
    }

    private void evictEvents(double now)
    {
        double horizon = now - config.timeUnit();
        while (!recentEvents.isEmpty() && recentEvents.peekFirst().timestamp() <= horizon) {
            recentPixels -= recentEvents.removeFirst().pixels();
        }
    }

    private void schedule()
    {
        double delayMs = Math.min(config.delay(), config.expireDelay());
        boolean expiring = config.expireDelay() <= config.delay();
        long token = ++generation;

        Duration wait = Duration.ofNanos(Math.max(0L, (long) (delayMs * 1_000_000.0)));
        config.setTimer(scheduler.scheduleAfter(wait, clock, () -> timerFired(token, expiring)));
    }

    private synchronized void timerFired(long token, boolean expiring)
    {
        if (closed || token != generation || pending.isEmpty()) {
            return;
        }
        config.clearTimer();
        flushPending(expiring);
    }

    /**
     * Releases the pending batch now, if there is one.
     *
     * @return {@code true} if a batch was flushed
     */
    public synchronized boolean flushNow()
    {
        if (closed || pending.isEmpty()) {
            return false;
        }
        generation++;
        config.cancelTimer();
        flushPending(false);
        return true;
    }

    private void flushPending(boolean expired)
    {
        DamageBatch batch = new DamageBatch(windowId, pending, firstDamage, clock.nowSeconds(), expired);
        pending.clear();
        firstDamage = Double.NaN;
        emit(batch);
    }

    private void emit(DamageBatch batch)
    {
        lastFlush = batch.flushedAt();
        try {
            flushTarget.accept(batch);
        } catch (RuntimeException e) {
            log.error("window {}: flush of {} region(s) failed", windowId, batch.regions().size(), e);
            sink.onError(new DisplayErrorEvent(wallClock.now(), "flush failed for window " + windowId, e));
        }
    }

    public synchronized int pendingRegions()
    {
        return pending.size();
    }

    /**
     * {@code true} when an update went out more than {@code timeoutDelay} ago
     * and no delay sample has been reported since.
     */
    public synchronized boolean isStalled(double now)
    {
        if (Double.isNaN(lastFlush) || config.lastUpdated() >= lastFlush) {
            return false;
        }
        return (now - lastFlush) * 1000.0 > config.timeoutDelay();
    }

    // -------------------------------------------------------------------------
    // Delay
    // -------------------------------------------------------------------------

    /**
     * Feeds one observation into the delay computation.
     *
     * @return the delay now in effect
     */
    public synchronized double onDelaySample(DelaySample sample)
    {
        double before = config.delay();
        double after = config.recompute(sample, factors);
        sink.onBatchDelayChanged(new BatchDelayEvent(
                wallClock.now(), windowId, before, after, config.isLocked(), config.factors()));
        return after;
    }

    public synchronized void lock()
    {
        config.lock();
    }

    public synchronized void unlock()
    {
        config.unlock();
    }

    /**
     * Independent snapshot of the batch state.
     */
    public BatchConfig snapshot()
    {
        return config.clone();
    }

    public Map<String, Object> getInfo()
    {
        return config.getInfo();
    }

    /**
     * Drops pending damage and cancels the timer. Idempotent; damage reported
     * afterwards is ignored.
     */
    public synchronized void cleanup()
    {
        if (closed) {
            return;
        }
        closed = true;
        generation++;
        pending.clear();
        recentEvents.clear();
        recentPixels = 0;
        config.cleanup();
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }
}
