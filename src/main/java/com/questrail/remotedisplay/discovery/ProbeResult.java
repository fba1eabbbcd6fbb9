package com.questrail.remotedisplay.discovery;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of probing one discovery back end.
 */
public final class ProbeResult
{
    private final DiscoveryListenerFactory factory;
    private final String failureReason;

    private ProbeResult(DiscoveryListenerFactory factory, String failureReason)
    {
        this.factory = factory;
        this.failureReason = failureReason;
    }

    public static ProbeResult success(DiscoveryListenerFactory factory)
    {
        return new ProbeResult(Objects.requireNonNull(factory, "factory"), null);
    }

    public static ProbeResult failure(String reason)
    {
        return new ProbeResult(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isSuccess()
    {
        return factory != null;
    }

    public Optional<DiscoveryListenerFactory> factory()
    {
        return Optional.ofNullable(factory);
    }

    public Optional<String> failureReason()
    {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString()
    {
        return isSuccess() ? "ProbeResult[success]" : "ProbeResult[failure: " + failureReason + "]";
    }
}
