package com.questrail.remotedisplay.discovery;

/**
 * Checks whether a discovery back end can run in this process (library
 * present, daemon reachable). Called once at startup.
 */
@FunctionalInterface
public interface DiscoveryProbe
{
    ProbeResult probe();
}
