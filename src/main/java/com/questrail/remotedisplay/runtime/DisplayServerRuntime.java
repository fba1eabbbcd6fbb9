package com.questrail.remotedisplay.runtime;

import com.questrail.remotedisplay.auth.AuthenticatorFactory;
import com.questrail.remotedisplay.auth.Authenticators;
import com.questrail.remotedisplay.auth.IdentityCheck;
import com.questrail.remotedisplay.batch.BatchConfig;
import com.questrail.remotedisplay.batch.factor.DelayFactor;
import com.questrail.remotedisplay.discovery.DiscoveryBackend;
import com.questrail.remotedisplay.discovery.DiscoveryListener;
import com.questrail.remotedisplay.discovery.DiscoveryListenerFactory;
import com.questrail.remotedisplay.discovery.DiscoveryRegistry;
import com.questrail.remotedisplay.internal.time.MonotonicClock;
import com.questrail.remotedisplay.internal.time.MonotonicScheduler;
import com.questrail.remotedisplay.internal.time.ScheduledExecutorScheduler;
import com.questrail.remotedisplay.internal.time.SystemMonotonicClock;
import com.questrail.remotedisplay.internal.time.SystemWallClock;
import com.questrail.remotedisplay.observability.DisplayObservabilitySink;
import com.questrail.remotedisplay.observability.NullObservabilitySink;
import com.questrail.remotedisplay.protocol.codec.FramePayloadCodec;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.remotedisplay.protocol.compression.CompressionPolicy;
import com.questrail.remotedisplay.protocol.crypto.PacketCipher;
import com.questrail.remotedisplay.session.PacketHandler;
import com.questrail.remotedisplay.session.SessionEnvironment;
import com.questrail.remotedisplay.transport.netty.NettyDisplayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * DisplayServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the display server: scheduler,
 * shared session environment, TCP listener and discovery.
 */
public final class DisplayServerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DisplayServerRuntime.class);

    /** Service name used when advertising through discovery. */
    public static final String SERVICE_NAME = "remote-display";

    private final NettyDisplayServer server;
    private final DiscoveryRegistry discovery;
    private final ScheduledExecutorService schedulerExecutor;
    private final SessionEnvironment environment;

    private DiscoveryListener discoveryListener;

    private DisplayServerRuntime(
            NettyDisplayServer server,
            DiscoveryRegistry discovery,
            ScheduledExecutorService schedulerExecutor,
            SessionEnvironment environment) {
        this.server = server;
        this.discovery = discovery;
        this.schedulerExecutor = schedulerExecutor;
        this.environment = environment;
    }

    public void start() {
        server.start();

        Optional<DiscoveryListenerFactory> factory = discovery.getListenerClass();
        if (factory.isPresent()) {
            try {
                DiscoveryListener listener = factory.get().create();
                listener.start(SERVICE_NAME, server.localAddress().getPort(), new LoggingServiceCallback());
                discoveryListener = listener;
            } catch (RuntimeException e) {
                log.warn("discovery could not be started, continuing without it", e);
            }
        } else {
            log.info("service discovery is not available");
        }
    }

    public void stop() {
        DiscoveryListener listener = discoveryListener;
        if (listener != null) {
            listener.stop();
            discoveryListener = null;
        }
        server.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public InetSocketAddress localAddress() {
        return server.localAddress();
    }

    public int sessionCount() {
        return server.sessionCount();
    }

    public SessionEnvironment environment() {
        return environment;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class LoggingServiceCallback implements DiscoveryListener.ServiceCallback {
        @Override
        public void serviceAdded(String name, String host, int port) {
            log.info("discovered service {} at {}:{}", name, host, port);
        }

        @Override
        public void serviceRemoved(String name) {
            log.info("service {} went away", name);
        }
    }

    public static final class Builder {
        private ServerConfig config = ServerConfig.builder().build();
        private DisplayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PacketHandler packetHandler = PacketHandler.NONE;
        private IdentityCheck identityCheck = IdentityCheck.DENY_ALL;
        private List<DiscoveryBackend> discoveryBackends = List.of();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(DisplayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withPacketHandler(PacketHandler handler) {
            this.packetHandler = handler;
            return this;
        }

        public Builder withIdentityCheck(IdentityCheck identityCheck) {
            this.identityCheck = identityCheck;
            return this;
        }

        public Builder withDiscoveryBackends(List<DiscoveryBackend> backends) {
            this.discoveryBackends = backends;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public DisplayServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(packetHandler, "packetHandler");
            Objects.requireNonNull(identityCheck, "identityCheck");
            Objects.requireNonNull(discoveryBackends, "discoveryBackends");

            // 1. Time
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1);
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Authentication (specs are validated here, not on first connection)
            AuthenticatorFactory authenticators;
            try {
                authenticators = Authenticators.factory(config.authSpecs(), identityCheck);
            } catch (RuntimeException e) {
                schedulerExec.shutdownNow();
                throw e;
            }

            // 3. Frame payloads
            FramePayloadCodec codec = new FramePayloadCodec(
                CompressionPolicy.defaults(config.compressionLevel()), config.maxPacketSize());
            if (config.encryptionKey() != null) {
                codec = codec.withCipher(PacketCipher.create(config.encryptionKey(), config.cipher()));
            }

            // 4. Shared session environment
            SessionEnvironment env = new SessionEnvironment(
                authenticators,
                config.maxAuthAttempts(),
                config.challengeTimeout(),
                BatchConfig.defaults(config.batchBounds()),
                DelayFactor.ALL,
                codec,
                new DefaultFrameEncoder(),
                config.maxPacketSize(),
                clock,
                scheduler,
                SystemWallClock.INSTANCE,
                observabilitySink
            );

            // 5. Listener and discovery
            NettyDisplayServer server = new NettyDisplayServer(
                config.bindAddress(), env, packetHandler, config.maxPacketSize());
            DiscoveryRegistry registry = DiscoveryRegistry.configured(discoveryBackends, config.discovery());

            return new DisplayServerRuntime(server, registry, schedulerExec, env);
        }
    }
}
