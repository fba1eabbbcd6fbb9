package com.questrail.remotedisplay.auth;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds authenticators from {@link AuthenticatorSpec}s.
 *
 * <table>
 *   <caption>Supported names</caption>
 *   <tr><th>name</th><th>options</th></tr>
 *   <tr><td>{@code none}</td><td></td></tr>
 *   <tr><td>{@code allow}</td><td></td></tr>
 *   <tr><td>{@code reject}</td><td></td></tr>
 *   <tr><td>{@code password}</td><td>{@code value} (required)</td></tr>
 *   <tr><td>{@code file}</td><td>{@code filename} (required)</td></tr>
 *   <tr><td>{@code system}, {@code sys}</td><td></td></tr>
 * </table>
 */
public final class Authenticators
{
    private Authenticators() {}

    public static Authenticator create(AuthenticatorSpec spec, String username, IdentityCheck identityCheck)
    {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(identityCheck, "identityCheck");

        switch (spec.name()) {
            case "none":
                return new NoneAuthenticator();
            case "allow":
                return new AllowAuthenticator(username);
            case "reject":
                return new RejectAuthenticator(username);
            case "password":
                return new PasswordAuthenticator(username, required(spec, "value"));
            case "file":
                return new FileAuthenticator(username, Path.of(required(spec, "filename")));
            case "system":
            case "sys":
                return new SystemAuthenticator(username, identityCheck);
            default:
                throw new IllegalArgumentException("unknown authenticator '" + spec.name() + "'");
        }
    }

    /**
     * One authenticator per spec; more than one spec builds a chain in the
     * given order. No spec at all means {@code none}.
     */
    public static Authenticator create(List<AuthenticatorSpec> specs, String username, IdentityCheck identityCheck)
    {
        Objects.requireNonNull(specs, "specs");
        if (specs.isEmpty()) {
            return new NoneAuthenticator();
        }
        if (specs.size() == 1) {
            return create(specs.get(0), username, identityCheck);
        }
        List<Authenticator> members = new ArrayList<>(specs.size());
        for (AuthenticatorSpec spec : specs) {
            members.add(create(spec, username, identityCheck));
        }
        return new AuthenticatorChain(members);
    }

    /**
     * Factory that builds from {@code specs} for each attempt. The specs are
     * validated once here so a bad configuration fails at startup.
     */
    public static AuthenticatorFactory factory(List<AuthenticatorSpec> specs, IdentityCheck identityCheck)
    {
        List<AuthenticatorSpec> copy = List.copyOf(specs);
        create(copy, "", identityCheck);
        return username -> create(copy, username, identityCheck);
    }

    private static String required(AuthenticatorSpec spec, String key)
    {
        return spec.option(key).orElseThrow(() ->
                new IllegalArgumentException("authenticator '" + spec.name() + "' needs option '" + key + "'"));
    }
}
