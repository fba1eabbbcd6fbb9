package com.questrail.remotedisplay.auth;

/**
 * External identity back end (system accounts, PAM, a directory service).
 */
@FunctionalInterface
public interface IdentityCheck
{
    /**
     * @return {@code true} if the credentials are valid
     */
    boolean check(String username, byte[] password);

    /**
     * Back end for deployments without one; rejects everyone.
     */
    IdentityCheck DENY_ALL = (username, password) -> false;
}
