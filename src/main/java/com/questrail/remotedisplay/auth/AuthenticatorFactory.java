package com.questrail.remotedisplay.auth;

/**
 * Creates the authenticator for one attempt. Sessions call it again for every
 * retry, so no state carries over between attempts.
 */
@FunctionalInterface
public interface AuthenticatorFactory
{
    Authenticator create(String username);
}
