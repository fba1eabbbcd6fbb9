package com.questrail.remotedisplay.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Delegates the password check to an {@link IdentityCheck}.
 *
 * <p>The back end needs the clear password, so only the {@code xor} digest is
 * accepted; a client that does not offer it is rejected.</p>
 */
public final class SystemAuthenticator extends AbstractChallengeAuthenticator
{
    private static final Logger log = LoggerFactory.getLogger(SystemAuthenticator.class);

    private static final Set<Digest> XOR_ONLY = EnumSet.of(Digest.XOR);

    private final IdentityCheck identityCheck;

    public SystemAuthenticator(String username, IdentityCheck identityCheck)
    {
        super(username);
        this.identityCheck = Objects.requireNonNull(identityCheck, "identityCheck");
    }

    @Override
    public String name()
    {
        return "system";
    }

    @Override
    protected Set<Digest> supportedDigests()
    {
        return XOR_ONLY;
    }

    @Override
    protected boolean verify(AuthChallenge challenge, byte[] salt, byte[] response)
    {
        byte[] password = Digests.unmaskXor(response, salt);
        try {
            return identityCheck.check(username(), password);
        } catch (RuntimeException e) {
            log.error("identity check failed for '{}'", username(), e);
            return false;
        }
    }
}
