package com.questrail.remotedisplay.session;

import com.questrail.remotedisplay.auth.AuthChallenge;
import com.questrail.remotedisplay.auth.AuthState;
import com.questrail.remotedisplay.auth.AuthenticationFailedException;
import com.questrail.remotedisplay.auth.Authenticator;
import com.questrail.remotedisplay.auth.AuthenticatorChain;
import com.questrail.remotedisplay.auth.UnsupportedDigestException;
import com.questrail.remotedisplay.batch.DamageBatchController;
import com.questrail.remotedisplay.batch.DamageRegion;
import com.questrail.remotedisplay.batch.DelaySample;
import com.questrail.remotedisplay.internal.time.Cancellable;
import com.questrail.remotedisplay.observability.DisplayErrorEvent;
import com.questrail.remotedisplay.observability.SessionTransitionEvent;
import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import com.questrail.remotedisplay.protocol.codec.FramePayloadCodec;
import com.questrail.remotedisplay.protocol.compression.CompressionPolicy;
import com.questrail.remotedisplay.protocol.compression.CompressionScheme;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.Packet;
import com.questrail.remotedisplay.protocol.frame.PacketAssembler;
import com.questrail.remotedisplay.session.handshake.HandshakeCodec;
import com.questrail.remotedisplay.session.handshake.HandshakeMessage;
import com.questrail.remotedisplay.transport.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DisplaySession
 * =============================================================================
 * One client connection: handshake, authentication, packet assembly and the
 * batch controllers of the windows it displays.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li>The client sends {@code Hello} with its username, digests and
 *       compressors.</li>
 *   <li>A fresh authenticator is built for the attempt. Each verifier that
 *       challenges gets its own {@code Challenge}/{@code ChallengeResponse}
 *       round, in chain order; the first rejection fails the attempt.</li>
 *   <li>A failed attempt starts over with a fresh authenticator until the
 *       attempt budget is used up; then the client is sent {@code Rejected}
 *       and {@link AuthenticationFailedException} is raised.</li>
 *   <li>The whole handshake must complete within the challenge timeout,
 *       enforced here with a scheduler timer.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * Frames arrive on the connection's worker. The handshake timer and batch
 * timers fire on the scheduler thread. Handshake state is guarded by the
 * session lock, and so is {@link #openWindow(int)} against {@link #close(String)}.
 * Other window operations and {@link #sendPacket(Packet)} do not take it, so
 * batch callbacks can send without lock-order problems.
 *
 * <h2>Teardown</h2>
 * {@link #close(String)} cleans up every batch controller, discards the
 * outstanding challenge, cancels the timer and drops buffered chunks. It is
 * idempotent.
 */
public final class DisplaySession
{
    private static final Logger log = LoggerFactory.getLogger(DisplaySession.class);

    private final String id;
    private final StreamTransport transport;
    private final SessionEnvironment env;
    private final PacketHandler handler;
    private final AuthAttemptTracker attempts = new AuthAttemptTracker();
    private final PacketAssembler assembler;
    private final Map<Integer, DamageBatchController> windows = new ConcurrentHashMap<>();

    private volatile SessionState state = SessionState.AWAITING_HELLO;
    private volatile FramePayloadCodec codec;

    // handshake state, guarded by this
    private HandshakeMessage.Hello hello;
    private AuthenticatorChain verifier;
    private Cancellable timeout = Cancellable.NONE;
    private boolean started;

    public DisplaySession(String id, StreamTransport transport, SessionEnvironment env, PacketHandler handler)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.env = Objects.requireNonNull(env, "env");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.codec = env.payloadCodec();
        this.assembler = new PacketAssembler(env.maxPendingBytes());
    }

    public String id()
    {
        return id;
    }

    public SessionState state()
    {
        return state;
    }

    public Optional<String> username()
    {
        HandshakeMessage.Hello h;
        synchronized (this) {
            h = hello;
        }
        return h == null ? Optional.empty() : Optional.of(h.username());
    }

    /**
     * Arms the handshake timer. Call once when the connection is up.
     */
    public synchronized void start()
    {
        if (started) {
            return;
        }
        started = true;
        timeout = env.scheduler().scheduleAfter(env.challengeTimeout(), env.clock(), this::handshakeTimedOut);
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Handles one frame from the transport.
     *
     * @throws FrameFormatException if the frame cannot be decoded or breaks
     *         the handshake sequence; the caller must close the connection
     * @throws AuthenticationFailedException when the last allowed attempt
     *         failed; the session is already closed
     */
    public void onFrame(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        SessionState s = state;
        if (s.isTerminal()) {
            log.debug("session {}: frame ignored in state {}", id, s);
            return;
        }
        if (s == SessionState.AUTHENTICATED) {
            onPacketFrame(frame);
            return;
        }
        onHandshakeFrame(frame);
    }

    private void onPacketFrame(Frame frame)
    {
        byte[] data = codec.decode(frame);
        Optional<Packet> packet;
        synchronized (this) {
            if (state != SessionState.AUTHENTICATED) {
                return;
            }
            packet = assembler.accept(frame.index(), data);
        }
        packet.ifPresent(p -> handler.onPacket(this, p));
    }

    private synchronized void onHandshakeFrame(Frame frame)
    {
        if (frame.isChunk()) {
            throw new FrameFormatException("chunk frame before authentication");
        }
        HandshakeMessage message = HandshakeCodec.decode(codec.decode(frame));

        if (state == SessionState.AWAITING_HELLO && message instanceof HandshakeMessage.Hello h) {
            hello = h;
            beginAttempt();
        } else if (state == SessionState.CHALLENGE_ISSUED && message instanceof HandshakeMessage.ChallengeResponse r) {
            onResponse(r);
        } else {
            throw new FrameFormatException("unexpected " + message.getClass().getSimpleName()
                    + " in state " + state);
        }
    }

    private void beginAttempt()
    {
        verifier = AuthenticatorChain.of(env.authenticators().create(hello.username()));
        advance();
    }

    /**
     * Issues the next challenge of the chain, or settles the attempt when no
     * challenging verifier is left.
     */
    private void advance()
    {
        if (verifier.state() == AuthState.AUTHENTICATED) {
            accept();
            return;
        }
        String member = verifier.currentMember().map(Authenticator::name).orElse(verifier.name());

        Optional<AuthChallenge> challenge;
        try {
            challenge = verifier.getChallenge(new HashSet<>(hello.digests()));
        } catch (UnsupportedDigestException e) {
            reject("unsupported digest", e);
            return;
        }
        if (challenge.isPresent()) {
            send(new HandshakeMessage.Challenge(challenge.get().salt(), challenge.get().digest().wireName()));
            transition(SessionState.CHALLENGE_ISSUED, member + " challenge");
        } else if (verifier.state() == AuthState.AUTHENTICATED) {
            accept();
        } else {
            attemptFailed();
        }
    }

    private void onResponse(HandshakeMessage.ChallengeResponse r)
    {
        if (verifier.authenticate(r.response(), r.clientSalt())) {
            advance();
            return;
        }
        attemptFailed();
    }

    private void attemptFailed()
    {
        String username = hello.username();
        int failures = attempts.recordFailure(username);
        verifier.discardChallenge();

        if (failures >= env.maxAuthAttempts()) {
            AuthenticationFailedException failure = new AuthenticationFailedException(username, failures);
            reject("authentication failed", failure);
            throw failure;
        }
        log.info("session {}: authentication attempt {} of {} failed for '{}'",
                id, failures, env.maxAuthAttempts(), username);
        beginAttempt();
    }

    private void accept()
    {
        attempts.reset(hello.username());
        timeout.cancel();
        timeout = Cancellable.NONE;

        CompressionPolicy negotiated = env.payloadCodec().compression().negotiate(hello.compressors());
        send(new HandshakeMessage.Accepted(negotiated.select().map(CompressionScheme::wireName).orElse("none")));
        codec = codec.withCompression(negotiated);

        transition(SessionState.AUTHENTICATED, "authenticated as '" + hello.username() + "'");
        handler.onAuthenticated(this);
    }

    private void reject(String reason, Throwable cause)
    {
        if (cause != null) {
            env.sink().onError(new DisplayErrorEvent(env.wallClock().now(),
                    "session " + id + " rejected: " + reason, cause));
        }
        if (transport.isOpen()) {
            send(new HandshakeMessage.Rejected(reason));
        }
        transition(SessionState.REJECTED, reason);
        close(reason);
    }

    private synchronized void handshakeTimedOut()
    {
        if (state == SessionState.AWAITING_HELLO || state == SessionState.CHALLENGE_ISSUED) {
            log.info("session {}: handshake timed out in state {}", id, state);
            timeout = Cancellable.NONE;
            reject("challenge timeout", null);
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Sends an application packet (chunks first, then the main payload).
     *
     * @throws IllegalStateException if the session is not authenticated
     */
    public void sendPacket(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (state != SessionState.AUTHENTICATED) {
            throw new IllegalStateException("session " + id + " is not authenticated (" + state + ")");
        }
        for (Frame f : codec.encode(packet)) {
            transport.send(env.frameEncoder().encode(f));
        }
    }

    private void send(HandshakeMessage message)
    {
        Frame f = codec.encode(HandshakeCodec.encode(message), 0);
        transport.send(env.frameEncoder().encode(f));
    }

    // -------------------------------------------------------------------------
    // Windows
    // -------------------------------------------------------------------------

    /**
     * Creates the batch controller for a window, from a clone of the shared
     * template. Opening an open window returns its existing controller.
     *
     * @throws IllegalStateException if the session is not authenticated
     */
    public DamageBatchController openWindow(int windowId)
    {
        // under the session lock so close() either sees the new window or refuses it
        synchronized (this) {
            if (state != SessionState.AUTHENTICATED) {
                throw new IllegalStateException("session " + id + " is not authenticated (" + state + ")");
            }
            return windows.computeIfAbsent(windowId, wid -> new DamageBatchController(
                    wid,
                    env.batchTemplate().clone(),
                    env.factors(),
                    env.clock(),
                    env.scheduler(),
                    env.wallClock(),
                    env.sink(),
                    batch -> handler.onDamageBatch(this, batch)));
        }
    }

    public void closeWindow(int windowId)
    {
        DamageBatchController c = windows.remove(windowId);
        if (c != null) {
            c.cleanup();
        }
    }

    public Optional<DamageBatchController> window(int windowId)
    {
        return Optional.ofNullable(windows.get(windowId));
    }

    public Set<Integer> windowIds()
    {
        return Set.copyOf(windows.keySet());
    }

    public void onDamage(int windowId, DamageRegion region)
    {
        DamageBatchController c = windows.get(windowId);
        if (c == null) {
            log.debug("session {}: damage for unknown window {}", id, windowId);
            return;
        }
        c.damage(region);
    }

    public void onDelaySample(int windowId, DelaySample sample)
    {
        DamageBatchController c = windows.get(windowId);
        if (c == null) {
            log.debug("session {}: delay sample for unknown window {}", id, windowId);
            return;
        }
        c.onDelaySample(sample);
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Releases everything the session holds and closes the transport.
     * Idempotent.
     */
    public void close(String reason)
    {
        synchronized (this) {
            if (state == SessionState.CLOSED) {
                return;
            }
            transition(SessionState.CLOSED, reason);

            timeout.cancel();
            timeout = Cancellable.NONE;
            if (verifier != null) {
                verifier.discardChallenge();
                verifier = null;
            }
            assembler.reset();
        }

        for (Integer wid : List.copyOf(windows.keySet())) {
            closeWindow(wid);
        }
        transport.close();
        handler.onClosed(this, reason);
    }

    private void transition(SessionState next, String reason)
    {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("session {}: {} -> {} ({})", id, previous, next, reason);
        env.sink().onSessionTransition(new SessionTransitionEvent(
                env.wallClock().now(), id, previous, next, reason));
    }

    @Override
    public String toString()
    {
        return "DisplaySession[" + id + ", " + state + ", " + transport.remoteAddress() + "]";
    }
}
