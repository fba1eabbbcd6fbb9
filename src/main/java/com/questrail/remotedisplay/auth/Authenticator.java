package com.questrail.remotedisplay.auth;

import java.util.Optional;
import java.util.Set;

/**
 * Authenticator
 * =============================================================================
 * Challenge/response verifier for one connection attempt.
 *
 * <h2>Lifecycle</h2>
 * {@code INIT -> CHALLENGE_ISSUED -> AUTHENTICATED | REJECTED}. Verifiers that
 * do not challenge go straight from {@code INIT} to a terminal state.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>An instance serves one attempt. The session creates a fresh one for
 *       every retry.</li>
 *   <li>{@link #getChallenge(Set)} may be called once. A second call returns
 *       empty and the instance rejects from then on. {@link AuthenticatorChain}
 *       allows one call per round.</li>
 *   <li>{@link #authenticate(byte[], String)} consumes the challenge: only the
 *       first response is evaluated.</li>
 *   <li>Timeouts are the session's business, not the authenticator's.</li>
 * </ul>
 */
public interface Authenticator
{
    /**
     * Name used in logs and authenticator specs.
     */
    String name();

    /**
     * {@code false} for pass-through verifiers that accept without a challenge.
     */
    boolean requiresChallenge();

    /**
     * Issues the challenge.
     *
     * @param requestedDigests digest names offered by the client
     * @return the challenge, or empty when this verifier does not challenge or
     *         a challenge was already issued
     * @throws UnsupportedDigestException when no offered digest is acceptable;
     *         the instance is rejected permanently
     */
    Optional<AuthChallenge> getChallenge(Set<String> requestedDigests);

    /**
     * {@link #getChallenge(Set)} for callers that prefer not to catch:
     * negotiation failure is reported as empty, with the instance rejected.
     */
    default Optional<AuthChallenge> offerChallenge(Set<String> requestedDigests)
    {
        try {
            return getChallenge(requestedDigests);
        } catch (UnsupportedDigestException e) {
            return Optional.empty();
        }
    }

    /**
     * Verifies the client's response to the outstanding challenge.
     *
     * @param response   digest response bytes
     * @param clientSalt salt chosen by the client, or {@code null}
     * @return {@code true} if the response verifies
     */
    boolean authenticate(byte[] response, String clientSalt);

    AuthState state();

    /**
     * Drops any outstanding challenge. Called on teardown.
     */
    void discardChallenge();
}
