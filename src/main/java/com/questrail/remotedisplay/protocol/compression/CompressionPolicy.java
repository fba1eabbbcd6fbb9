package com.questrail.remotedisplay.protocol.compression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CompressionPolicy
 * -----------------------------------------------------------------------------
 * Outbound compression choice for one session.
 *
 * <p>The scheme is the first available entry of {@link #PERFORMANCE_ORDER}
 * that both ends enabled. A level of 0 disables compression entirely.</p>
 *
 * @param enabled schemes usable on this session
 * @param level   compression level, 0-9
 */
public record CompressionPolicy(List<CompressionScheme> enabled, int level)
{
    /** Preference when several schemes are enabled. */
    public static final List<CompressionScheme> PERFORMANCE_ORDER =
            List.of(CompressionScheme.LZ4, CompressionScheme.LZO, CompressionScheme.ZLIB);

    public static final CompressionPolicy NONE = new CompressionPolicy(List.of(), 0);

    public CompressionPolicy
    {
        enabled = List.copyOf(Objects.requireNonNull(enabled, "enabled"));
        if (level < 0 || level > 9) {
            throw new IllegalArgumentException("level must be 0-9: " + level);
        }
    }

    /**
     * Every available scheme at the given level.
     */
    public static CompressionPolicy defaults(int level)
    {
        return new CompressionPolicy(List.of(CompressionScheme.values()), level);
    }

    /**
     * Restricts this policy to the schemes the peer announced by name.
     */
    public CompressionPolicy negotiate(Collection<String> peerSchemes)
    {
        List<CompressionScheme> common = new ArrayList<>();
        for (CompressionScheme s : enabled) {
            if (peerSchemes.stream().anyMatch(s.wireName()::equalsIgnoreCase)) {
                common.add(s);
            }
        }
        return new CompressionPolicy(common, level);
    }

    /**
     * The scheme to compress outbound packets with, or empty when packets go
     * out uncompressed.
     */
    public Optional<CompressionScheme> select()
    {
        if (level == 0) {
            return Optional.empty();
        }
        for (CompressionScheme s : PERFORMANCE_ORDER) {
            if (s.isAvailable() && enabled.contains(s)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
