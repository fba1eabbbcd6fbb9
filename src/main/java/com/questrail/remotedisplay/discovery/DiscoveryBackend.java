package com.questrail.remotedisplay.discovery;

import java.util.Objects;

/**
 * One candidate discovery back end.
 *
 * @param enabled whether configuration allows this back end at all
 */
public record DiscoveryBackend(String name, boolean enabled, DiscoveryProbe probe)
{
    public DiscoveryBackend
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(probe, "probe");
    }

    /**
     * Same back end with its flag taken from {@code config}.
     */
    public DiscoveryBackend configuredBy(DiscoveryConfig config)
    {
        return new DiscoveryBackend(name, config.isEnabled(name, enabled), probe);
    }
}
