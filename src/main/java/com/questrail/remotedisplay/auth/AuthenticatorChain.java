package com.questrail.remotedisplay.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AuthenticatorChain
 * -----------------------------------------------------------------------------
 * Every member must accept, in order; the first rejection stops evaluation.
 * This is how several factors are required together.
 *
 * <h2>Rounds</h2>
 * Each challenging member gets its own round:
 * <ol>
 *   <li>{@link #getChallenge(Set)} runs the pass-through members up to the
 *       next challenging one and returns that member's challenge.</li>
 *   <li>{@link #authenticate(byte[], String)} hands the response to that
 *       member only, then runs the pass-through members that follow it.</li>
 *   <li>If another challenging member remains, the round returns
 *       {@code true} and the chain goes back to {@code INIT}, ready for the
 *       next {@code getChallenge}. The chain is {@code AUTHENTICATED} only
 *       once every member has accepted.</li>
 * </ol>
 * A chain without challenging members is settled by a single
 * {@code authenticate} call.
 *
 * <p>Not thread-safe; confined to the session's worker like its members.</p>
 */
public final class AuthenticatorChain implements Authenticator
{
    private static final Logger log = LoggerFactory.getLogger(AuthenticatorChain.class);

    private final List<Authenticator> members;

    private AuthState state = AuthState.INIT;
    private int current;

    public AuthenticatorChain(List<? extends Authenticator> members)
    {
        Objects.requireNonNull(members, "members");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("chain needs at least one authenticator");
        }
        this.members = List.copyOf(members);
    }

    /**
     * Wraps a single authenticator; a chain is returned as is.
     */
    public static AuthenticatorChain of(Authenticator authenticator)
    {
        Objects.requireNonNull(authenticator, "authenticator");
        if (authenticator instanceof AuthenticatorChain chain) {
            return chain;
        }
        return new AuthenticatorChain(List.of(authenticator));
    }

    public List<Authenticator> members()
    {
        return members;
    }

    /**
     * The member the next challenge or response belongs to, if any is left.
     */
    public Optional<Authenticator> currentMember()
    {
        return current < members.size() ? Optional.of(members.get(current)) : Optional.empty();
    }

    @Override
    public String name()
    {
        return members.stream().map(Authenticator::name).collect(Collectors.joining("+"));
    }

    @Override
    public boolean requiresChallenge()
    {
        return members.stream().anyMatch(Authenticator::requiresChallenge);
    }

    @Override
    public Optional<AuthChallenge> getChallenge(Set<String> requestedDigests)
    {
        Objects.requireNonNull(requestedDigests, "requestedDigests");

        if (state == AuthState.CHALLENGE_ISSUED) {
            log.error("{}: challenge already outstanding, rejecting", name());
            discardChallenge();
            state = AuthState.REJECTED;
            return Optional.empty();
        }
        if (state.isTerminal()) {
            log.warn("{}: challenge requested after authentication completed ({})", name(), state);
            return Optional.empty();
        }

        if (!runPassThrough(null, null)) {
            return Optional.empty();
        }
        if (current == members.size()) {
            state = AuthState.AUTHENTICATED;
            return Optional.empty();
        }

        Optional<AuthChallenge> challenge;
        try {
            challenge = members.get(current).getChallenge(requestedDigests);
        } catch (UnsupportedDigestException e) {
            state = AuthState.REJECTED;
            throw e;
        }
        state = challenge.isPresent() ? AuthState.CHALLENGE_ISSUED : AuthState.REJECTED;
        return challenge;
    }

    /**
     * Verifies one round.
     *
     * @return {@code true} if the round passed; check {@link #state()} to tell
     *         a completed chain from one waiting for its next challenge
     */
    @Override
    public boolean authenticate(byte[] response, String clientSalt)
    {
        if (state.isTerminal()) {
            log.warn("{}: response after authentication completed ({})", name(), state);
            return false;
        }

        boolean answered = state == AuthState.CHALLENGE_ISSUED;
        if (answered) {
            if (!members.get(current).authenticate(response, clientSalt)) {
                state = AuthState.REJECTED;
                return false;
            }
            current++;
        }

        if (!runPassThrough(response, clientSalt)) {
            return false;
        }
        if (current == members.size()) {
            state = AuthState.AUTHENTICATED;
            return true;
        }
        if (!answered) {
            log.warn("{}: response for '{}' before its challenge was issued",
                    name(), members.get(current).name());
            state = AuthState.REJECTED;
            return false;
        }
        state = AuthState.INIT;
        return true;
    }

    /**
     * Runs members that accept without a challenge, from {@code current} up to
     * the next challenging one.
     */
    private boolean runPassThrough(byte[] response, String clientSalt)
    {
        while (current < members.size() && !members.get(current).requiresChallenge()) {
            if (!members.get(current).authenticate(response, clientSalt)) {
                state = AuthState.REJECTED;
                return false;
            }
            current++;
        }
        return true;
    }

    @Override
    public AuthState state()
    {
        return state;
    }

    @Override
    public void discardChallenge()
    {
        members.forEach(Authenticator::discardChallenge);
    }

    @Override
    public String toString()
    {
        return "chain" + members;
    }
}
