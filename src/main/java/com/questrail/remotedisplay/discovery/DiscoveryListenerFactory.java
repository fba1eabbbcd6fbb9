package com.questrail.remotedisplay.discovery;

/**
 * Constructor for a back end's {@link DiscoveryListener}, returned by a
 * successful probe.
 */
@FunctionalInterface
public interface DiscoveryListenerFactory
{
    DiscoveryListener create();
}
