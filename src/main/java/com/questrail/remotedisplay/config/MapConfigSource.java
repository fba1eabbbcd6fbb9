package com.questrail.remotedisplay.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ConfigSource} over an in-memory map. Used when embedding the engine
 * and in tests.
 */
public final class MapConfigSource implements ConfigSource
{
    private final Map<String, String> values;

    public MapConfigSource(Map<String, String> values)
    {
        this.values = Map.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static MapConfigSource of(String key, String value)
    {
        return new MapConfigSource(Map.of(key, value));
    }

    @Override
    public Optional<String> get(String key)
    {
        return Optional.ofNullable(values.get(key));
    }
}
