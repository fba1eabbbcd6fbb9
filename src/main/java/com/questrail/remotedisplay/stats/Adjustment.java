package com.questrail.remotedisplay.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Adjustment
 * -----------------------------------------------------------------------------
 * One recommendation from the statistics engine.
 *
 * <ul>
 *   <li>{@code factor}: multiplier to apply; 1.0 means "no change"</li>
 *   <li>{@code weight}: how much this recommendation should count when
 *       combined with others; 0 means "no opinion"</li>
 *   <li>{@code info}: the inputs that produced it, for observability</li>
 * </ul>
 */
public record Adjustment(String metric, Map<String, Object> info, double factor, double weight)
{
    public Adjustment
    {
        Objects.requireNonNull(metric, "metric");
        info = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(info, "info")));
    }

    /**
     * Neutral recommendation: factor 1, weight 0.
     */
    public static Adjustment neutral(String metric)
    {
        return new Adjustment(metric, Map.of(), 1.0, 0.0);
    }

    /**
     * Human-readable one-liner, e.g.
     * {@code damage-latency: factor=1.250 weight=0.415 (avg=40.0, recent=50.0, target=40.0)}.
     */
    public String explanation()
    {
        String inputs = info.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, "%s: factor=%.3f weight=%.3f (%s)", metric, factor, weight, inputs);
    }
}
