package com.questrail.remotedisplay.stats;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatisticsTest
 * -----------------------------------------------------------------------------
 * Numerical behaviour of the averaging and recommendation helpers.
 */
final class StatisticsTest
{
    private static final double EPS = 1e-9;

    private static List<Sample> constant(double value, int n)
    {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            samples.add(new Sample(i * 0.25, value));
        }
        return samples;
    }

    @Test
    void logpIsNeutralAtOneAndZeroAtZero()
    {
        assertEquals(0.0, Statistics.logp(0), EPS);
        assertEquals(1.0, Statistics.logp(1), EPS);
        assertEquals(2.0, Statistics.logp(3), EPS);
        assertEquals(0.0, Statistics.logp(-4), EPS);
        assertEquals(0.0, Statistics.logp(Double.NaN), EPS);
    }

    @Test
    void constantSeriesAveragesToItsValue()
    {
        for (double v : new double[] { 0.0, 0.1, 17.0, 1e9 }) {
            List<Sample> samples = constant(v, 40);
            WeightedAverages w = Statistics.calculateTimeWeightedAverage(samples, 12.0).orElseThrow();

            assertEquals(v, w.average(), 0.0);
            assertEquals(v, w.recent(), 0.0);
            assertEquals(v, Statistics.timeWeightedAverage(samples, 12.0).getAsDouble(), 0.0);
        }
    }

    @Test
    void recentAverageFavoursNewestSamples()
    {
        List<Sample> samples = List.of(new Sample(0, 10), new Sample(1, 10), new Sample(2, 10), new Sample(10, 100));

        WeightedAverages w = Statistics.calculateTimeWeightedAverage(samples, 10.0).orElseThrow();

        assertTrue(w.recent() > w.average());
        assertTrue(w.recent() > 90);
    }

    @Test
    void emptyOrInvalidSeriesHasNoAverage()
    {
        assertTrue(Statistics.calculateTimeWeightedAverage(List.of(), 1.0).isEmpty());
        assertTrue(Statistics.timeWeightedAverage(List.of(new Sample(0, Double.NaN)), 1.0).isEmpty());
    }

    @Test
    void weightParametersAreValidated()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Statistics.timeWeightedAverage(List.of(), 0, 0.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> Statistics.timeWeightedAverage(List.of(), 0, 0.1, -1.0));
    }

    @Test
    void onTargetMetricIsNeutralWithNoWeight()
    {
        Adjustment a = Statistics.calculateForTarget("latency", 40, 40, 40, 0.5, 1, 0.1, 1);

        assertEquals(1.0, a.factor(), EPS);
        assertEquals(0.0, a.weight(), EPS);
        assertEquals(40.0, a.info().get("target"));
    }

    @Test
    void aboveTargetRaisesFactorAndWeight()
    {
        Adjustment a = Statistics.calculateForTarget("latency", 40, 40, 120, 0.5, 1, 0.1, 1);

        assertTrue(a.factor() > 1.0);
        assertTrue(a.weight() > 0.0);
    }

    @Test
    void aimOutsideOpenIntervalIsRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Statistics.calculateForTarget("m", 1, 1, 1, 1.0, 1, 0.1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> Statistics.calculateForTarget("m", 1, 1, 1, 0.0, 1, 0.1, 1));
    }

    @Test
    void averageComparisonOfSteadySeries()
    {
        Adjustment a = Statistics.calculateForAverage("trend", constant(25, 10), 3.0);

        assertEquals(1.0, a.factor(), EPS);
        assertEquals(0.5, a.weight(), EPS);
    }

    @Test
    void averageComparisonWithZeroAverageIsNeutral()
    {
        Adjustment a = Statistics.calculateForAverage("trend", 0.0, 5.0, 0.5, 1.0);

        assertEquals(Adjustment.neutral("trend"), a);
    }

    @Test
    void growingQueueIsPenalised()
    {
        List<Sample> flat = constant(2, 8);
        List<Sample> growing = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            growing.add(new Sample(i * 0.25, i * 2.0));
        }

        Adjustment steady = Statistics.queueInspect("queue", flat, 2.0);
        Adjustment rising = Statistics.queueInspect("queue", growing, 2.0);

        assertTrue(rising.factor() > steady.factor());
        assertTrue(rising.weight() > steady.weight());
        assertEquals(8.0, rising.info().get("slope"));
        assertEquals(0.0, steady.info().get("slope"));
    }

    @Test
    void emptyQueueSeriesIsNeutral()
    {
        assertEquals(Adjustment.neutral("queue"), Statistics.queueInspect("queue", List.of(), 1.0));
    }

    @Test
    void slopeOfLine()
    {
        List<Sample> line = List.of(new Sample(0, 1), new Sample(1, 3), new Sample(2, 5));

        assertEquals(2.0, Statistics.slope(line), EPS);
        assertEquals(0.0, Statistics.slope(List.of(new Sample(1, 1))), EPS);
        assertEquals(0.0, Statistics.slope(List.of(new Sample(1, 1), new Sample(1, 9))), EPS);
    }

    @Test
    void explanationIsStable()
    {
        Adjustment a = Statistics.calculateForTarget("latency", 40, 40, 40, 0.5, 1, 0.1, 1);

        assertTrue(a.explanation().startsWith("latency: factor=1.000 weight=0.000 (avg=40.0"));
    }
}
