package com.questrail.remotedisplay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * IntSetting
 * -----------------------------------------------------------------------------
 * A named, overridable integer with a default and an inclusive range.
 *
 * <h2>Resolution rule</h2>
 * <ul>
 *   <li>unset: default</li>
 *   <li>not a number: default (logged)</li>
 *   <li>below {@code min}: {@code min} (logged)</li>
 *   <li>above {@code max}: {@code max} (logged)</li>
 *   <li>in range: the value as given</li>
 * </ul>
 *
 * <p>Resolution never throws: a bad override must not prevent startup.</p>
 */
public record IntSetting(String name, int defaultValue, int min, int max)
{
    private static final Logger log = LoggerFactory.getLogger(IntSetting.class);

    public IntSetting
    {
        Objects.requireNonNull(name, "name");
        if (min > max) {
            throw new IllegalArgumentException(name + ": min " + min + " > max " + max);
        }
    }

    public int resolve(ConfigSource source)
    {
        Optional<String> raw = source.get(name);
        if (raw.isEmpty()) {
            return defaultValue;
        }

        final int parsed;
        try {
            parsed = Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            log.warn("invalid value for setting {}: '{}', using default {}", name, raw.get(), defaultValue);
            return defaultValue;
        }

        if (parsed < min) {
            log.warn("value for setting {} is too small: {} (minimum is {})", name, parsed, min);
            return min;
        }
        if (parsed > max) {
            log.warn("value for setting {} is too large: {} (maximum is {})", name, parsed, max);
            return max;
        }
        return parsed;
    }

    public boolean resolveFlag(ConfigSource source)
    {
        return resolve(source) != 0;
    }
}
