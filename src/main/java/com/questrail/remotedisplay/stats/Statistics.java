package com.questrail.remotedisplay.stats;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Statistics
 * -----------------------------------------------------------------------------
 * Time-weighted averaging and trend inspection over timestamped samples. The
 * damage batch factors are built from these functions.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>Weights are strictly positive and decrease with sample age, so a
 *       series of identical values averages to exactly that value and a
 *       single sample averages to itself.</li>
 *   <li>An empty series has no average ({@link OptionalDouble#empty()}); the
 *       recommendation functions return a neutral {@link Adjustment}.</li>
 *   <li>Samples with non-finite values are skipped. Samples from the future
 *       count as age zero.</li>
 *   <li>Nothing here throws for numeric edge cases: zero targets, zero
 *       averages and NaN inputs resolve to neutral recommendations.</li>
 * </ul>
 *
 * <p>All methods are pure and thread-safe.</p>
 */
public final class Statistics
{
    /** 1 / ln(2). */
    private static final double INV_LN2 = 1.4426950408889634;

    /** Lower bound for averages used as divisors. */
    private static final double MIN_DIVISOR = 1e-6;

    private Statistics() {}

    /**
     * Log-scaled damping: {@code log2(1 + x)}.
     *
     * <p>Maps 0 to 0 and 1 to 1, so a neutral ratio stays neutral, while a
     * single extreme ratio only grows the result logarithmically. Negative and
     * NaN inputs are treated as 0.</p>
     */
    public static double logp(double x)
    {
        if (!(x > 0)) {
            return 0.0;
        }
        return Math.log1p(x) * INV_LN2;
    }

    /**
     * Time-weighted average with weights {@code 1/(0.1 + age^2)}.
     */
    public static OptionalDouble timeWeightedAverage(Collection<Sample> samples, double now)
    {
        return timeWeightedAverage(samples, now, 0.1, 2.0);
    }

    /**
     * Time-weighted average with weights {@code 1/(minOffset + age^rpow)}.
     *
     * @param minOffset strictly positive offset, bounds the weight of a sample
     *                  taken "now"
     * @param rpow      decay exponent, &gt;= 0
     */
    public static OptionalDouble timeWeightedAverage(Collection<Sample> samples, double now,
                                                     double minOffset, double rpow)
    {
        if (!(minOffset > 0)) {
            throw new IllegalArgumentException("minOffset must be positive: " + minOffset);
        }
        if (!(rpow >= 0)) {
            throw new IllegalArgumentException("rpow must be >= 0: " + rpow);
        }

        // Averaging deviations from the first value keeps a constant series exact.
        double reference = Double.NaN;
        double tv = 0.0;
        double tw = 0.0;
        for (Sample s : samples) {
            if (!Double.isFinite(s.value())) {
                continue;
            }
            if (Double.isNaN(reference)) {
                reference = s.value();
            }
            double w = 1.0 / (minOffset + Math.pow(age(now, s), rpow));
            tv += (s.value() - reference) * w;
            tw += w;
        }
        if (tw == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(reference + tv / tw);
    }

    /**
     * Long-term and recent averages in one pass.
     *
     * @return empty for an empty series
     */
    public static Optional<WeightedAverages> calculateTimeWeightedAverage(Collection<Sample> samples,
                                                                                    double now)
    {
        double reference = Double.NaN;
        double tv = 0.0, tw = 0.0;
        double rv = 0.0, rw = 0.0;
        for (Sample s : samples) {
            if (!Double.isFinite(s.value())) {
                continue;
            }
            if (Double.isNaN(reference)) {
                reference = s.value();
            }
            double delta = age(now, s);
            double d = s.value() - reference;

            double w = 1.0 / (1.0 + delta);
            tv += d * w;
            tw += w;

            w = 1.0 / (0.1 + delta * delta);
            rv += d * w;
            rw += w;
        }
        if (tw == 0.0) {
            return Optional.empty();
        }
        return Optional.of(new WeightedAverages(reference + tv / tw, reference + rv / rw));
    }

    /**
     * Recommendation that moves a metric towards {@code target}.
     *
     * <p>The factor blends how far the recent value is from the target with
     * whether things are getting better or worse than average; {@code aim}
     * sets the proportion (0.5 uses both equally). The weight grows with the
     * larger of the two deviations, so a metric that sits on its target has
     * no say.</p>
     *
     * @param aim              blend between target distance and trend, in (0, 1)
     * @param div              divisor applied to the blended ratio; larger values
     *                         make the factor less aggressive
     * @param slope            floor for target and average, avoids division by zero
     * @param weightMultiplier scales the resulting weight
     */
    public static Adjustment calculateForTarget(String metric, double target, double avg, double recent,
                                                double aim, double div, double slope, double weightMultiplier)
    {
        if (!(aim > 0 && aim < 1)) {
            throw new IllegalArgumentException("aim must be in (0, 1): " + aim);
        }
        if (!Double.isFinite(target) || !Double.isFinite(avg) || !Double.isFinite(recent) || !(div > 0)) {
            return Adjustment.neutral(metric);
        }

        double floor = Math.max(MIN_DIVISOR, slope);
        double t = Math.max(floor, target);
        double a = Math.max(floor, avg);
        double r = Math.max(0.0, recent);

        double targetRatio = r / t;
        double trendRatio = r / a;
        double factor = logp((aim * targetRatio + (1.0 - aim) * trendRatio) / div);
        double weight = logp(Math.max(Math.abs(1.0 - targetRatio), Math.abs(1.0 - trendRatio))) * weightMultiplier;

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("avg", round(avg));
        info.put("recent", round(recent));
        info.put("target", round(target));
        info.put("aim", aim);
        info.put("div", div);
        return new Adjustment(metric, info, factor, Math.max(0.0, weight));
    }

    /**
     * {@link #calculateForTarget(String, double, double, double, double, double, double, double)}
     * with {@code aim=0.5, div=1, slope=0.1, weightMultiplier=1}, averages taken
     * from {@code observed}.
     */
    public static Adjustment calculateForTarget(String metric, Collection<Sample> observed, double target, double now)
    {
        return calculateTimeWeightedAverage(observed, now)
                .map(w -> calculateForTarget(metric, target, w.average(), w.recent(), 0.5, 1.0, 0.1, 1.0))
                .orElseGet(() -> Adjustment.neutral(metric));
    }

    /**
     * Recommendation from comparing the recent value with the average: the
     * factor is {@code logp(recent/avg)}, and the weight grows with how far
     * the factor is from 1.
     *
     * @param weightOffset base weight added to the deviation
     * @param weightDiv    divisor applied to the weight
     */
    public static Adjustment calculateForAverage(String metric, double avg, double recent,
                                                 double weightOffset, double weightDiv)
    {
        if (!Double.isFinite(avg) || !Double.isFinite(recent) || avg <= MIN_DIVISOR || !(weightDiv > 0)) {
            return Adjustment.neutral(metric);
        }

        double factor = Math.max(0.1, logp(Math.max(0.0, recent) / avg));
        double weight = Math.max(0.0, Math.max(factor, 1.0 / factor) - 1.0 + weightOffset) / weightDiv;

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("avg", round(avg));
        info.put("recent", round(recent));
        return new Adjustment(metric, info, factor, weight);
    }

    /**
     * {@link #calculateForAverage(String, double, double, double, double)} with
     * {@code weightOffset=0.5, weightDiv=1}, averages taken from {@code observed}.
     */
    public static Adjustment calculateForAverage(String metric, Collection<Sample> observed, double now)
    {
        return calculateTimeWeightedAverage(observed, now)
                .map(w -> calculateForAverage(metric, w.average(), w.recent(), 0.5, 1.0))
                .orElseGet(() -> Adjustment.neutral(metric));
    }

    /**
     * Congestion signal for a backlog series (queued packets, pending pixels).
     *
     * <p>Combines distance to {@code target} (with the trend blended in at
     * one quarter) with the growth rate of the series: a positive slope
     * pushes the factor and the weight up by {@code logp(slope)}.</p>
     *
     * @param target acceptable backlog level
     * @param div    divisor applied to the factor
     */
    public static Adjustment queueInspect(String metric, Collection<Sample> series, double target, double div,
                                          double now)
    {
        Optional<WeightedAverages> avgs = calculateTimeWeightedAverage(series, now);
        if (avgs.isEmpty()) {
            return Adjustment.neutral(metric);
        }

        Adjustment base = calculateForTarget(metric, target, avgs.get().average(), avgs.get().recent(),
                0.25, div, 1.0, 1.0);

        double growth = slope(series);
        if (!(growth > 0)) {
            Map<String, Object> info = new LinkedHashMap<>(base.info());
            info.put("slope", round(growth));
            return new Adjustment(metric, info, base.factor(), base.weight());
        }

        double boost = logp(growth);
        Map<String, Object> info = new LinkedHashMap<>(base.info());
        info.put("slope", round(growth));
        return new Adjustment(metric, info, base.factor() + boost / div, base.weight() + boost);
    }

    /**
     * {@link #queueInspect(String, Collection, double, double, double)} with
     * {@code target=1, div=1}.
     */
    public static Adjustment queueInspect(String metric, Collection<Sample> series, double now)
    {
        return queueInspect(metric, series, 1.0, 1.0, now);
    }

    /**
     * Least-squares slope of value over time (units per second). Zero for
     * fewer than two usable samples or when all samples share a timestamp.
     */
    public static double slope(Collection<Sample> series)
    {
        int n = 0;
        double st = 0.0, sv = 0.0;
        for (Sample s : series) {
            if (Double.isFinite(s.value()) && Double.isFinite(s.timestamp())) {
                n++;
                st += s.timestamp();
                sv += s.value();
            }
        }
        if (n < 2) {
            return 0.0;
        }
        double mt = st / n;
        double mv = sv / n;
        double num = 0.0, den = 0.0;
        for (Sample s : series) {
            if (Double.isFinite(s.value()) && Double.isFinite(s.timestamp())) {
                double dt = s.timestamp() - mt;
                num += dt * (s.value() - mv);
                den += dt * dt;
            }
        }
        return den == 0.0 ? 0.0 : num / den;
    }

    private static double age(double now, Sample s)
    {
        double delta = now - s.timestamp();
        return (delta > 0) ? delta : 0.0;
    }

    private static double round(double v)
    {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
