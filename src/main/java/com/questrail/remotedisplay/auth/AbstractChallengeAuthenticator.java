package com.questrail.remotedisplay.auth;

import com.questrail.remotedisplay.internal.time.MonotonicClock;
import com.questrail.remotedisplay.internal.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AbstractChallengeAuthenticator
 * -----------------------------------------------------------------------------
 * State machine shared by every challenging verifier: digest negotiation, salt
 * issue, single-use challenge, terminal state. Subclasses only decide which
 * digests they accept and how a response is checked.
 *
 * <p>Instances are confined to the session's worker and are not
 * thread-safe.</p>
 */
public abstract class AbstractChallengeAuthenticator implements Authenticator
{
    private static final Logger log = LoggerFactory.getLogger(AbstractChallengeAuthenticator.class);

    private final String username;
    private final MonotonicClock clock;

    private AuthState state = AuthState.INIT;
    private AuthChallenge challenge;
    private boolean challengeSent;

    protected AbstractChallengeAuthenticator(String username, MonotonicClock clock)
    {
        this.username = Objects.requireNonNull(username, "username");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    protected AbstractChallengeAuthenticator(String username)
    {
        this(username, SystemMonotonicClock.INSTANCE);
    }

    public final String username()
    {
        return username;
    }

    /**
     * Digests this verifier can check.
     */
    protected abstract Set<Digest> supportedDigests();

    /**
     * Checks one response against the consumed challenge.
     *
     * @param salt effective salt (server salt combined with the client salt)
     */
    protected abstract boolean verify(AuthChallenge challenge, byte[] salt, byte[] response);

    @Override
    public boolean requiresChallenge()
    {
        return true;
    }

    @Override
    public final Optional<AuthChallenge> getChallenge(Set<String> requestedDigests)
    {
        Objects.requireNonNull(requestedDigests, "requestedDigests");

        if (challengeSent) {
            log.error("{}: challenge already sent for '{}', rejecting", name(), username);
            challenge = null;
            state = AuthState.REJECTED;
            return Optional.empty();
        }
        challengeSent = true;

        Optional<Digest> digest = DigestNegotiator.choose(requestedDigests, supportedDigests());
        if (digest.isEmpty()) {
            state = AuthState.REJECTED;
            log.error("{}: unsupported digests {} requested by '{}'", name(), requestedDigests, username);
            throw new UnsupportedDigestException(name(), requestedDigests, supportedDigests());
        }

        challenge = new AuthChallenge(Digests.newSalt(), digest.get(), clock.nowNanos());
        state = AuthState.CHALLENGE_ISSUED;
        log.debug("{}: issued {} challenge for '{}'", name(), digest.get(), username);
        return Optional.of(challenge);
    }

    @Override
    public final boolean authenticate(byte[] response, String clientSalt)
    {
        if (state.isTerminal()) {
            log.warn("{}: response for '{}' after authentication completed ({})", name(), username, state);
            return false;
        }
        AuthChallenge c = challenge;
        if (c == null) {
            log.warn("{}: response from '{}' without a challenge", name(), username);
            return false;
        }
        challenge = null;

        if (response == null || response.length == 0) {
            state = AuthState.REJECTED;
            return false;
        }
        if (clientSalt != null && clientSalt.length() < Digests.MIN_CLIENT_SALT_LENGTH) {
            log.warn("{}: client salt from '{}' is too short ({} chars)", name(), username, clientSalt.length());
            state = AuthState.REJECTED;
            return false;
        }

        boolean ok = verify(c, Digests.effectiveSalt(c.salt(), clientSalt), response);
        state = ok ? AuthState.AUTHENTICATED : AuthState.REJECTED;
        if (!ok) {
            log.info("{}: authentication failed for '{}'", name(), username);
        }
        return ok;
    }

    @Override
    public final AuthState state()
    {
        return state;
    }

    @Override
    public final void discardChallenge()
    {
        challenge = null;
    }

    /**
     * Compares {@code response} with the expected response for
     * {@code password} in constant time.
     */
    protected static boolean checkPassword(AuthChallenge challenge, byte[] salt, byte[] password, byte[] response)
    {
        if (password == null || password.length == 0) {
            return false;
        }
        return Digests.matches(Digests.response(challenge.digest(), password, salt), response);
    }

    @Override
    public String toString()
    {
        return name() + "(" + username + ")";
    }
}
