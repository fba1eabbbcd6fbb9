package com.questrail.remotedisplay.config;

import java.util.Optional;

/**
 * ConfigSource
 * -----------------------------------------------------------------------------
 * Key to string lookup for named overrides (batch bounds, discovery toggles).
 *
 * <p>Values are read once at startup into immutable configuration records;
 * nothing in the protocol engine consults a {@code ConfigSource} while
 * sessions are running.</p>
 */
public interface ConfigSource
{
    /**
     * @param key setting name without any source-specific prefix
     * @return the raw value, or empty when unset
     */
    Optional<String> get(String key);

    /**
     * Source with nothing set: every setting resolves to its default.
     */
    ConfigSource EMPTY = key -> Optional.empty();
}
