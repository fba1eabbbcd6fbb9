package com.questrail.remotedisplay.discovery;

/**
 * Service advertisement and browsing through one discovery back end.
 */
public interface DiscoveryListener
{
    /**
     * Callbacks for services seen on the network.
     */
    interface ServiceCallback
    {
        void serviceAdded(String name, String host, int port);

        void serviceRemoved(String name);
    }

    /**
     * Starts advertising {@code serviceName} on {@code port} and browsing for
     * peers.
     */
    void start(String serviceName, int port, ServiceCallback callback);

    /**
     * Stops advertising and browsing. Idempotent.
     */
    void stop();
}
