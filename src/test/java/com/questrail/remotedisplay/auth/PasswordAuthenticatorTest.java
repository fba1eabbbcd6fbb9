package com.questrail.remotedisplay.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PasswordAuthenticatorTest
 * -----------------------------------------------------------------------------
 * Challenge/response with a shared secret, plus the state rules common to
 * every challenge authenticator.
 */
final class PasswordAuthenticatorTest
{
    private static final Set<String> HMAC_SHA256 = Set.of("hmac+sha256");

    private static byte[] answer(AuthChallenge challenge, String secret, String clientSalt)
    {
        byte[] salt = Digests.effectiveSalt(challenge.salt(), clientSalt);
        return Digests.response(challenge.digest(), secret.getBytes(StandardCharsets.UTF_8), salt);
    }

    @Test
    void correctResponseAuthenticates()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(HMAC_SHA256).orElseThrow();
        String clientSalt = Digests.newSalt();

        assertEquals(Digest.HMAC_SHA256, challenge.digest());
        assertEquals(AuthState.CHALLENGE_ISSUED, auth.state());
        assertTrue(auth.authenticate(answer(challenge, "s3cret", clientSalt), clientSalt));
        assertEquals(AuthState.AUTHENTICATED, auth.state());
    }

    @Test
    void plainHmacOfferGetsStrongestHash()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(Set.of("hmac")).orElseThrow();
        String clientSalt = Digests.newSalt();

        assertEquals(Digest.HMAC_SHA512, challenge.digest());
        assertTrue(auth.authenticate(answer(challenge, "s3cret", clientSalt), clientSalt));
    }

    @Test
    void plainHmacOfferStillRejectsWrongPassword()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(Set.of("hmac")).orElseThrow();
        String clientSalt = Digests.newSalt();

        assertFalse(auth.authenticate(answer(challenge, "guess", clientSalt), clientSalt));
        assertEquals(AuthState.REJECTED, auth.state());
    }

    @Test
    void wrongPasswordIsRejected()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(HMAC_SHA256).orElseThrow();
        String clientSalt = Digests.newSalt();

        assertFalse(auth.authenticate(answer(challenge, "guess", clientSalt), clientSalt));
        assertEquals(AuthState.REJECTED, auth.state());
    }

    @Test
    void challengeIsSingleUse()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(HMAC_SHA256).orElseThrow();
        auth.discardChallenge();

        assertFalse(auth.authenticate(answer(challenge, "s3cret", null), null));
        assertEquals(AuthState.CHALLENGE_ISSUED, auth.state());
    }

    @Test
    void secondChallengeRequestRejects()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        auth.getChallenge(HMAC_SHA256);

        assertTrue(auth.getChallenge(HMAC_SHA256).isEmpty());
        assertEquals(AuthState.REJECTED, auth.state());
    }

    @Test
    void unsupportedDigestFailsWithoutDowngrade()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");

        UnsupportedDigestException e = assertThrows(UnsupportedDigestException.class,
                () -> auth.getChallenge(Set.of("xor", "md5")));
        assertEquals(Set.of("xor", "md5"), e.requested());
        assertEquals(AuthState.REJECTED, auth.state());
    }

    @Test
    void shortClientSaltIsRejected()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        AuthChallenge challenge = auth.getChallenge(HMAC_SHA256).orElseThrow();
        String clientSalt = "0123456789";

        assertFalse(auth.authenticate(answer(challenge, "s3cret", clientSalt), clientSalt));
        assertEquals(AuthState.REJECTED, auth.state());
    }

    @Test
    void emptyResponseIsRejected()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");
        auth.getChallenge(HMAC_SHA256);

        assertFalse(auth.authenticate(new byte[0], null));
        assertFalse(auth.authenticate(new byte[] { 1 }, null));
    }

    @Test
    void responseWithoutChallengeIsIgnored()
    {
        PasswordAuthenticator auth = new PasswordAuthenticator("alice", "s3cret");

        assertFalse(auth.authenticate("anything".getBytes(StandardCharsets.US_ASCII), null));
        assertEquals(AuthState.INIT, auth.state());
    }

    @Test
    void noneAndAllowAndReject()
    {
        NoneAuthenticator none = new NoneAuthenticator();
        assertFalse(none.requiresChallenge());
        assertTrue(none.getChallenge(HMAC_SHA256).isEmpty());
        assertTrue(none.authenticate(null, null));
        assertEquals(AuthState.AUTHENTICATED, none.state());

        AllowAuthenticator allow = new AllowAuthenticator("bob");
        allow.getChallenge(Set.of("xor"));
        assertTrue(allow.authenticate(new byte[] { 0 }, null));

        RejectAuthenticator reject = new RejectAuthenticator("bob");
        reject.getChallenge(HMAC_SHA256);
        assertFalse(reject.authenticate(new byte[] { 0 }, null));
        assertEquals(AuthState.REJECTED, reject.state());
    }
}
