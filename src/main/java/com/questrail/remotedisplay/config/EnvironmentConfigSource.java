package com.questrail.remotedisplay.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ConfigSource} backed by the process environment.
 *
 * <p>Keys are prefixed, so {@code BATCH_MIN_DELAY} is read from
 * {@code REMOTE_DISPLAY_BATCH_MIN_DELAY} with the default prefix.</p>
 */
public final class EnvironmentConfigSource implements ConfigSource
{
    public static final String DEFAULT_PREFIX = "REMOTE_DISPLAY_";

    private final String prefix;
    private final Map<String, String> environment;

    public EnvironmentConfigSource()
    {
        this(DEFAULT_PREFIX, System.getenv());
    }

    public EnvironmentConfigSource(String prefix, Map<String, String> environment)
    {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    @Override
    public Optional<String> get(String key)
    {
        return Optional.ofNullable(environment.get(prefix + key));
    }
}
