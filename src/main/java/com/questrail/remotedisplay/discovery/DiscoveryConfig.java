package com.questrail.remotedisplay.discovery;

import com.questrail.remotedisplay.config.ConfigSource;
import com.questrail.remotedisplay.config.IntSetting;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per back end enable flags, read once at startup from {@code MDNS_<NAME>}
 * settings ({@code 0} or {@code 1}). A back end with no setting keeps its
 * built-in default.
 */
public final class DiscoveryConfig
{
    public static final DiscoveryConfig DEFAULTS = new DiscoveryConfig(Map.of());

    private final Map<String, Boolean> flags;

    public DiscoveryConfig(Map<String, Boolean> flags)
    {
        this.flags = Map.copyOf(Objects.requireNonNull(flags, "flags"));
    }

    public static DiscoveryConfig resolve(ConfigSource source, Collection<DiscoveryBackend> backends)
    {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (DiscoveryBackend b : backends) {
            String key = settingName(b.name());
            if (source.get(key).isPresent()) {
                flags.put(b.name(), new IntSetting(key, b.enabled() ? 1 : 0, 0, 1).resolveFlag(source));
            }
        }
        return new DiscoveryConfig(flags);
    }

    static String settingName(String backend)
    {
        return "MDNS_" + backend.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    public boolean isEnabled(String backend, boolean defaultValue)
    {
        return flags.getOrDefault(backend, defaultValue);
    }

    @Override
    public String toString()
    {
        return "DiscoveryConfig" + flags;
    }
}
