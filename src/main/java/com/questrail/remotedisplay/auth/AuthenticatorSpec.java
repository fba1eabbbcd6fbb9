package com.questrail.remotedisplay.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed authenticator option: {@code name[:key=value[,key=value...]]}.
 *
 * <p>Examples: {@code none}, {@code password:value=secret},
 * {@code file:filename=/etc/display.pw}. Names are case-insensitive; option
 * keys are kept as given.</p>
 */
public record AuthenticatorSpec(String name, Map<String, String> options)
{
    public AuthenticatorSpec
    {
        Objects.requireNonNull(name, "name");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(options, "options")));
    }

    /**
     * @throws IllegalArgumentException for an empty name or an option without
     *         {@code =}
     */
    public static AuthenticatorSpec parse(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        String name = (colon < 0 ? trimmed : trimmed.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("missing authenticator name in '" + text + "'");
        }

        Map<String, String> options = new LinkedHashMap<>();
        if (colon >= 0) {
            for (String part : trimmed.substring(colon + 1).split(",")) {
                if (part.isBlank()) {
                    continue;
                }
                int eq = part.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("invalid authenticator option '" + part + "' in '" + text + "'");
                }
                options.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
            }
        }
        return new AuthenticatorSpec(name, options);
    }

    public Optional<String> option(String key)
    {
        return Optional.ofNullable(options.get(key));
    }

    /**
     * Spec text with option values masked, safe to log.
     */
    @Override
    public String toString()
    {
        if (options.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append(':');
        boolean first = true;
        for (String key : options.keySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(key).append("=***");
            first = false;
        }
        return sb.toString();
    }
}
