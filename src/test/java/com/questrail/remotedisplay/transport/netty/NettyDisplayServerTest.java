package com.questrail.remotedisplay.transport.netty;

import com.questrail.remotedisplay.auth.AuthenticatorSpec;
import com.questrail.remotedisplay.auth.Authenticators;
import com.questrail.remotedisplay.auth.IdentityCheck;
import com.questrail.remotedisplay.batch.BatchBounds;
import com.questrail.remotedisplay.batch.BatchConfig;
import com.questrail.remotedisplay.batch.factor.DelayFactor;
import com.questrail.remotedisplay.internal.time.ScheduledExecutorScheduler;
import com.questrail.remotedisplay.internal.time.SystemMonotonicClock;
import com.questrail.remotedisplay.internal.time.SystemWallClock;
import com.questrail.remotedisplay.observability.RecordingObservabilitySink;
import com.questrail.remotedisplay.observability.TransportObservabilityEvent;
import com.questrail.remotedisplay.protocol.codec.FramePayloadCodec;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.remotedisplay.protocol.compression.CompressionPolicy;
import com.questrail.remotedisplay.protocol.frame.Frame;
import com.questrail.remotedisplay.protocol.frame.FrameHeader;
import com.questrail.remotedisplay.protocol.frame.Packet;
import com.questrail.remotedisplay.session.DisplaySession;
import com.questrail.remotedisplay.session.PacketHandler;
import com.questrail.remotedisplay.session.SessionEnvironment;
import com.questrail.remotedisplay.session.handshake.HandshakeCodec;
import com.questrail.remotedisplay.session.handshake.HandshakeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyDisplayServerTest
 * -----------------------------------------------------------------------------
 * Loopback tests: a plain socket plays the client against a real listener.
 */
final class NettyDisplayServerTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final BlockingQueue<Packet> received = new LinkedBlockingQueue<>();
    private final FramePayloadCodec clientCodec = new FramePayloadCodec(CompressionPolicy.NONE, 1 << 20);
    private final DefaultFrameEncoder encoder = new DefaultFrameEncoder();
    private final DefaultFrameDecoder decoder = new DefaultFrameDecoder();

    private ScheduledExecutorService executor;
    private NettyDisplayServer server;

    @BeforeEach
    void startServer()
    {
        executor = Executors.newSingleThreadScheduledExecutor();
        SessionEnvironment env = new SessionEnvironment(
                Authenticators.factory(List.of(AuthenticatorSpec.parse("none")), IdentityCheck.DENY_ALL),
                3,
                Duration.ofSeconds(30),
                BatchConfig.defaults(BatchBounds.defaults()),
                DelayFactor.ALL,
                new FramePayloadCodec(CompressionPolicy.defaults(1), 1 << 20),
                encoder,
                1 << 20,
                SystemMonotonicClock.INSTANCE,
                new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE),
                SystemWallClock.INSTANCE,
                sink);
        PacketHandler handler = new PacketHandler()
        {
            @Override
            public void onPacket(DisplaySession session, Packet packet)
            {
                received.add(packet);
            }
        };
        server = new NettyDisplayServer(new InetSocketAddress("127.0.0.1", 0), env, handler, 1 << 20);
        server.start();
    }

    @AfterEach
    void stopServer()
    {
        server.stop();
        executor.shutdownNow();
    }

    private Socket connect() throws IOException
    {
        Socket socket = new Socket();
        socket.connect(server.localAddress(), 5_000);
        socket.setSoTimeout(5_000);
        return socket;
    }

    private void write(Socket socket, Frame frame) throws IOException
    {
        OutputStream out = socket.getOutputStream();
        out.write(encoder.encode(frame));
        out.flush();
    }

    private Frame read(Socket socket) throws IOException
    {
        DataInputStream in = new DataInputStream(socket.getInputStream());
        byte[] header = new byte[FrameHeader.LENGTH];
        in.readFully(header);
        int size = (int) decoder.decodeHeader(header).payloadSize();
        byte[] wire = Arrays.copyOf(header, FrameHeader.LENGTH + size);
        in.readFully(wire, FrameHeader.LENGTH, size);
        return decoder.decode(wire);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void handshakeAndPacketOverTcp() throws Exception
    {
        try (Socket socket = connect()) {
            HandshakeMessage hello = new HandshakeMessage.Hello("alice", List.of("hmac+sha256"), List.of("zlib"));
            write(socket, clientCodec.encode(HandshakeCodec.encode(hello), 0));

            HandshakeMessage reply = HandshakeCodec.decode(clientCodec.decode(read(socket)));
            assertEquals(new HandshakeMessage.Accepted("zlib"), reply);

            write(socket, clientCodec.encodeRaw(new byte[] { 3, 3, 3 }, 1));
            write(socket, clientCodec.encode(new byte[] { 42 }, 0));

            Packet packet = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(packet);
            assertArrayEquals(new byte[] { 42 }, packet.main());
            assertArrayEquals(new byte[] { 3, 3, 3 }, packet.chunk(1).orElseThrow());
            assertEquals(1, server.sessionCount());
        }
        awaitTrue(() -> server.sessionCount() == 0);
        assertTrue(sink.hasEventOfType(TransportObservabilityEvent.class));
    }

    @Test
    void garbageClosesTheConnection() throws Exception
    {
        try (Socket socket = connect()) {
            socket.getOutputStream().write("GET / HTTP/1.1\r\n\r\n".getBytes());
            socket.getOutputStream().flush();

            int r;
            try {
                r = socket.getInputStream().read();
            } catch (SocketException reset) {
                r = -1;
            }
            assertEquals(-1, r);
        }
        awaitTrue(() -> sink.eventsOfType(TransportObservabilityEvent.class).stream()
                .anyMatch(e -> e.kind() == TransportObservabilityEvent.Kind.FRAME_ERROR));
        awaitTrue(() -> server.sessionCount() == 0);
    }
}
