package com.questrail.remotedisplay.session.handshake;

import java.util.List;
import java.util.Objects;

/**
 * Messages exchanged before a session is authenticated.
 *
 * <pre>
 *   client                      server
 *   Hello           --------->
 *                   <---------  Challenge       (once per challenging verifier)
 *   ChallengeResponse -------->
 *                   <---------  Accepted | Rejected
 * </pre>
 */
public sealed interface HandshakeMessage
        permits HandshakeMessage.Hello,
                HandshakeMessage.Challenge,
                HandshakeMessage.ChallengeResponse,
                HandshakeMessage.Accepted,
                HandshakeMessage.Rejected
{
    /**
     * @param digests     digest names the client can answer with
     * @param compressors compression scheme names the client can decode
     */
    record Hello(String username, List<String> digests, List<String> compressors) implements HandshakeMessage
    {
        public Hello
        {
            Objects.requireNonNull(username, "username");
            digests = List.copyOf(digests);
            compressors = List.copyOf(compressors);
        }
    }

    record Challenge(String salt, String digest) implements HandshakeMessage
    {
        public Challenge
        {
            Objects.requireNonNull(salt, "salt");
            Objects.requireNonNull(digest, "digest");
        }
    }

    /**
     * @param clientSalt salt chosen by the client, or {@code null}
     */
    record ChallengeResponse(byte[] response, String clientSalt) implements HandshakeMessage
    {
        public ChallengeResponse
        {
            response = Objects.requireNonNull(response, "response").clone();
        }

        @Override
        public byte[] response()
        {
            return response.clone();
        }
    }

    /**
     * @param compression scheme the server will compress with, or {@code "none"}
     */
    record Accepted(String compression) implements HandshakeMessage
    {
        public Accepted
        {
            Objects.requireNonNull(compression, "compression");
        }
    }

    record Rejected(String reason) implements HandshakeMessage
    {
        public Rejected
        {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
