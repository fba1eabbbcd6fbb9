package com.questrail.remotedisplay.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class AuthenticatorChainTest
{
    /** Records every response it is asked to check. */
    private static final class CountingAuthenticator implements Authenticator
    {
        private final String name;
        private final boolean accept;
        private final List<byte[]> seen = new ArrayList<>();
        private AuthState state = AuthState.INIT;

        CountingAuthenticator(String name, boolean accept)
        {
            this.name = name;
            this.accept = accept;
        }

        @Override
        public String name()
        {
            return name;
        }

        @Override
        public boolean requiresChallenge()
        {
            return false;
        }

        @Override
        public Optional<AuthChallenge> getChallenge(Set<String> requestedDigests)
        {
            return Optional.empty();
        }

        @Override
        public boolean authenticate(byte[] response, String clientSalt)
        {
            seen.add(response);
            state = accept ? AuthState.AUTHENTICATED : AuthState.REJECTED;
            return accept;
        }

        @Override
        public AuthState state()
        {
            return state;
        }

        @Override
        public void discardChallenge()
        {
        }
    }

    private static final Set<String> OFFERED = Set.of("xor", "hmac+sha512");

    /** Answers {@code challenge} with {@code password} under a fresh client salt. */
    private static boolean respond(Authenticator auth, AuthChallenge challenge, String password)
    {
        String clientSalt = Digests.newSalt();
        byte[] salt = Digests.effectiveSalt(challenge.salt(), clientSalt);
        byte[] response = Digests.response(challenge.digest(), password.getBytes(StandardCharsets.UTF_8), salt);
        return auth.authenticate(response, clientSalt);
    }

    @Test
    void allMembersSeeTheSameResponse()
    {
        CountingAuthenticator a = new CountingAuthenticator("a", true);
        CountingAuthenticator b = new CountingAuthenticator("b", true);
        AuthenticatorChain chain = new AuthenticatorChain(List.of(a, b));
        byte[] response = { 4, 2 };

        assertTrue(chain.authenticate(response, null));
        assertSame(response, a.seen.get(0));
        assertSame(response, b.seen.get(0));
        assertEquals(AuthState.AUTHENTICATED, chain.state());
        assertEquals("a+b", chain.name());
    }

    @Test
    void firstFailureStopsTheChain()
    {
        CountingAuthenticator a = new CountingAuthenticator("a", false);
        CountingAuthenticator b = new CountingAuthenticator("b", true);
        AuthenticatorChain chain = new AuthenticatorChain(List.of(a, b));

        assertFalse(chain.authenticate(new byte[] { 1 }, null));
        assertEquals(1, a.seen.size());
        assertTrue(b.seen.isEmpty());
        assertEquals(AuthState.REJECTED, chain.state());
    }

    @Test
    void challengeComesFromFirstChallengingMember()
    {
        AuthenticatorChain chain = new AuthenticatorChain(List.of(
                new NoneAuthenticator(), new PasswordAuthenticator("carol", "pw")));

        assertTrue(chain.requiresChallenge());
        AuthChallenge c = chain.getChallenge(Set.of("hmac+sha512")).orElseThrow();
        assertEquals(Digest.HMAC_SHA512, c.digest());
        assertEquals(AuthState.CHALLENGE_ISSUED, chain.state());
    }

    @Test
    void twoPasswordMembersEachGetTheirOwnRound()
    {
        PasswordAuthenticator first = new PasswordAuthenticator("dave", "pw");
        PasswordAuthenticator second = new PasswordAuthenticator("dave", "pw");
        AuthenticatorChain chain = new AuthenticatorChain(List.of(first, second));

        AuthChallenge c1 = chain.getChallenge(OFFERED).orElseThrow();
        assertSame(first, chain.currentMember().orElseThrow());
        assertTrue(respond(chain, c1, "pw"));
        assertEquals(AuthState.INIT, chain.state());
        assertEquals(AuthState.AUTHENTICATED, first.state());

        AuthChallenge c2 = chain.getChallenge(OFFERED).orElseThrow();
        assertNotEquals(c1.salt(), c2.salt());
        assertEquals(AuthState.CHALLENGE_ISSUED, chain.state());
        assertTrue(respond(chain, c2, "pw"));

        assertEquals(AuthState.AUTHENTICATED, chain.state());
        assertEquals(AuthState.AUTHENTICATED, second.state());
        assertTrue(chain.currentMember().isEmpty());
    }

    @Test
    void failedSecondRoundRejectsTheChain()
    {
        AuthenticatorChain chain = new AuthenticatorChain(List.of(
                new PasswordAuthenticator("dave", "pw"), new PasswordAuthenticator("dave", "other")));

        assertTrue(respond(chain, chain.getChallenge(OFFERED).orElseThrow(), "pw"));
        assertFalse(respond(chain, chain.getChallenge(OFFERED).orElseThrow(), "pw"));
        assertEquals(AuthState.REJECTED, chain.state());
    }

    @Test
    void failingSystemCheckStopsBeforePassword()
    {
        SystemAuthenticator system = new SystemAuthenticator("erin", IdentityCheck.DENY_ALL);
        PasswordAuthenticator password = new PasswordAuthenticator("erin", "pw");
        AuthenticatorChain chain = new AuthenticatorChain(List.of(system, password));

        AuthChallenge c = chain.getChallenge(OFFERED).orElseThrow();
        assertEquals(Digest.XOR, c.digest());

        assertFalse(respond(chain, c, "pw"));
        assertEquals(AuthState.REJECTED, chain.state());
        assertEquals(AuthState.REJECTED, system.state());
        assertEquals(AuthState.INIT, password.state());
    }

    @Test
    void noneAloneAcceptsWithoutChallenge()
    {
        AuthenticatorChain chain = new AuthenticatorChain(List.of(new NoneAuthenticator()));

        assertFalse(chain.requiresChallenge());
        assertTrue(chain.authenticate(null, null));
        assertEquals(AuthState.AUTHENTICATED, chain.state());
    }

    @Test
    void responseBeforeChallengeIsRejected()
    {
        AuthenticatorChain chain = new AuthenticatorChain(List.of(new PasswordAuthenticator("dave", "pw")));

        assertFalse(chain.authenticate(new byte[] { 1 }, null));
        assertEquals(AuthState.REJECTED, chain.state());
    }

    @Test
    void secondChallengeWhileOneIsOutstandingPoisonsTheChain()
    {
        AuthenticatorChain chain = new AuthenticatorChain(List.of(new PasswordAuthenticator("dave", "pw")));
        AuthChallenge c = chain.getChallenge(OFFERED).orElseThrow();

        assertTrue(chain.getChallenge(OFFERED).isEmpty());
        assertEquals(AuthState.REJECTED, chain.state());
        assertFalse(respond(chain, c, "pw"));
    }

    @Test
    void emptyChainIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new AuthenticatorChain(List.of()));
    }
}
