package com.questrail.remotedisplay.batch;

import com.questrail.remotedisplay.batch.factor.DelayFactor;
import com.questrail.remotedisplay.config.MapConfigSource;
import com.questrail.remotedisplay.stats.Adjustment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchConfigTest
 * -----------------------------------------------------------------------------
 * Delay recomputation, locking and snapshot semantics of {@link BatchConfig}.
 */
final class BatchConfigTest
{
    private static BatchConfig fresh()
    {
        return BatchConfig.defaults(BatchBounds.defaults());
    }

    private static void feed(BatchConfig config, int n, double actualDelayMs)
    {
        for (int i = 0; i < n; i++) {
            config.recompute(new DelaySample(i * 0.1, actualDelayMs, 100_000, 1), DelayFactor.ALL);
        }
    }

    @Test
    void startsAtStartDelayWithinBounds()
    {
        BatchConfig config = fresh();

        assertEquals(50.0, config.delay());
        assertEquals(5.0, config.minDelay());
        assertEquals(500.0, config.maxDelay());
        assertFalse(config.isLocked());
        assertTrue(config.delayPerMegapixel() < 0);
    }

    @Test
    void startDelayIsClampedIntoBounds()
    {
        BatchBounds bounds = BatchBounds.resolve(new MapConfigSource(Map.of(
                "BATCH_MIN_DELAY", "100", "BATCH_START_DELAY", "20", "BATCH_MAX_DELAY", "400")));

        assertEquals(100.0, BatchConfig.defaults(bounds).delay());
    }

    @Test
    void delayAlwaysStaysWithinBounds()
    {
        BatchConfig slow = fresh();
        feed(slow, 60, 5_000.0);
        BatchConfig fast = fresh();
        feed(fast, 60, 0.0);

        assertTrue(slow.delay() <= slow.maxDelay());
        assertTrue(slow.delay() > 50.0);
        assertTrue(fast.delay() >= fast.minDelay());
    }

    @Test
    void slowUpdatesRaiseTheDelay()
    {
        BatchConfig config = fresh();

        double after = config.recompute(new DelaySample(1.0, 400.0, 10_000, 0), List.of(DelayFactor.DAMAGE_LATENCY));

        assertTrue(after > 50.0, "delay should grow, was " + after);
        assertEquals(1, config.factors().size());
        assertEquals("damage-latency", config.factors().get(0).metric());
    }

    @Test
    void lockedConfigKeepsDelayButRecordsSamples()
    {
        BatchConfig config = fresh();
        config.lock();

        feed(config, 10, 2_000.0);
        config.setDelay(300.0);

        assertEquals(50.0, config.delay());
        assertEquals(50.0, config.saved());
        assertEquals(10, config.lastActualDelays().size());
        assertTrue(config.factors().isEmpty());
        assertEquals(true, config.getInfo().get("locked"));
        assertEquals(50.0, config.getInfo().get("saved"));
    }

    @Test
    void unlockRestoresSavedDelay()
    {
        BatchConfig config = fresh();
        config.lock();
        config.unlock();
        config.setDelay(120.0);

        assertFalse(config.isLocked());
        assertEquals(120.0, config.delay());
        assertTrue(Double.isNaN(config.saved()));
        assertFalse(config.getInfo().containsKey("saved"));
    }

    @Test
    void cloneIsIndependent()
    {
        BatchConfig original = fresh();
        feed(original, 5, 80.0);
        Map<String, Object> before = original.getInfo();

        BatchConfig copy = original.clone();
        feed(copy, 20, 900.0);
        copy.lock();
        copy.cleanup();

        assertEquals(before, original.getInfo());
        assertEquals(5, original.lastActualDelays().size());
        assertEquals(25, copy.lastActualDelays().size());
        assertFalse(original.isLocked());
    }

    @Test
    void combineIsWeightedMeanIgnoringInvalidEntries()
    {
        List<Adjustment> adjustments = List.of(
                new Adjustment("a", Map.of(), 2.0, 1.0),
                new Adjustment("b", Map.of(), 0.5, 3.0),
                new Adjustment("c", Map.of(), Double.NaN, 5.0),
                new Adjustment("d", Map.of(), 9.0, 0.0));

        assertEquals((2.0 + 1.5) / 4.0, BatchConfig.combine(adjustments), 1e-12);
        assertEquals(1.0, BatchConfig.combine(List.of()), 0.0);
    }

    @Test
    void pixelCostRaisesDelayFloor()
    {
        BatchConfig config = fresh();
        for (int i = 0; i < 5; i++) {
            config.recompute(new DelaySample(i, 200.0, 1_000_000, 0), List.of());
        }

        assertEquals(200.0, config.delayPerMegapixel(), 1e-9);
        assertTrue(config.delay() >= 200.0);
    }

    @Test
    void infoSummarisesSeriesAndFactors()
    {
        BatchConfig config = fresh();
        feed(config, 3, 40.0);

        Map<String, Object> info = config.getInfo();

        assertEquals(40.0, info.get("actual-delay.cur"));
        assertEquals(40.0, info.get("actual-delay.avg"));
        assertTrue(info.containsKey("queue-size.max"));
        for (DelayFactor f : DelayFactor.values()) {
            assertTrue(info.containsKey("factor." + f.metric()), f.metric());
            assertTrue(info.containsKey("factor." + f.metric() + ".weight"), f.metric());
        }
        assertThrows(UnsupportedOperationException.class, () -> info.put("delay", 1.0));
    }

    @Test
    void cleanupIsIdempotent()
    {
        BatchConfig config = fresh();
        feed(config, 2, 10.0);

        config.cleanup();
        config.cleanup();

        assertTrue(config.factors().isEmpty());
    }
}
