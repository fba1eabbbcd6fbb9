package com.questrail.remotedisplay.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DiscoveryRegistry
 * -----------------------------------------------------------------------------
 * Priority-ordered discovery back ends, built once at startup and read-only
 * afterwards.
 *
 * <p>Discovery is optional: when no back end is enabled or every probe fails
 * the registry reports nothing and the server runs without advertising.
 * Probe failures, including exceptions thrown by a probe, are logged and the
 * next back end is tried.</p>
 */
public final class DiscoveryRegistry
{
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRegistry.class);

    private final List<DiscoveryBackend> backends;

    public DiscoveryRegistry(List<DiscoveryBackend> backends)
    {
        this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
    }

    /**
     * Registry whose enable flags come from {@code config}.
     */
    public static DiscoveryRegistry configured(List<DiscoveryBackend> backends, DiscoveryConfig config)
    {
        return new DiscoveryRegistry(backends.stream()
                .map(b -> b.configuredBy(config))
                .collect(Collectors.toList()));
    }

    public static DiscoveryRegistry empty()
    {
        return new DiscoveryRegistry(List.of());
    }

    public List<DiscoveryBackend> backends()
    {
        return backends;
    }

    /**
     * First enabled back end whose probe succeeds.
     */
    public Optional<DiscoveryListenerFactory> getListenerClass()
    {
        for (DiscoveryBackend b : backends) {
            if (!b.enabled()) {
                log.debug("discovery back end {} is disabled", b.name());
                continue;
            }

            ProbeResult result;
            try {
                result = b.probe().probe();
            } catch (RuntimeException | LinkageError e) {
                log.warn("discovery back end {} failed to initialize", b.name(), e);
                continue;
            }

            if (result != null && result.isSuccess()) {
                log.debug("using discovery back end {}", b.name());
                return result.factory();
            }
            log.info("discovery back end {} is not available: {}", b.name(),
                    result == null ? "no result" : result.failureReason().orElse("unknown"));
        }
        log.debug("no discovery back end available");
        return Optional.empty();
    }
}
