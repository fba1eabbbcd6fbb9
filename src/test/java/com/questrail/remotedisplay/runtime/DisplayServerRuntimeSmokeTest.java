package com.questrail.remotedisplay.runtime;

import com.questrail.remotedisplay.auth.AuthenticatorSpec;
import com.questrail.remotedisplay.discovery.DiscoveryBackend;
import com.questrail.remotedisplay.discovery.DiscoveryListener;
import com.questrail.remotedisplay.discovery.ProbeResult;
import com.questrail.remotedisplay.observability.Slf4jDisplayObservabilitySink;
import com.questrail.remotedisplay.protocol.crypto.CipherParameters;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DisplayServerRuntimeSmokeTest {

    private static final class RecordingListener implements DiscoveryListener {
        final AtomicInteger advertisedPort = new AtomicInteger(-1);
        final AtomicBoolean stopped = new AtomicBoolean();

        @Override
        public void start(String serviceName, int port, ServiceCallback callback) {
            assertEquals(DisplayServerRuntime.SERVICE_NAME, serviceName);
            advertisedPort.set(port);
        }

        @Override
        public void stop() {
            stopped.set(true);
        }
    }

    @Test
    void fullStackLifecycleWithDiscovery() {
        RecordingListener listener = new RecordingListener();
        ServerConfig config = ServerConfig.builder()
            .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
            .withAuthSpecs(List.of(AuthenticatorSpec.parse("password:value=pw")))
            .withEncryption("shared", CipherParameters.aes("remote-display"))
            .build();

        DisplayServerRuntime runtime = DisplayServerRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jDisplayObservabilitySink())
            .withDiscoveryBackends(List.of(
                new DiscoveryBackend("unavailable", true, () -> ProbeResult.failure("not installed")),
                new DiscoveryBackend("test", true, () -> ProbeResult.success(() -> listener))))
            .build();

        runtime.start();
        try {
            int port = runtime.localAddress().getPort();
            assertTrue(port > 0);
            assertEquals(port, listener.advertisedPort.get());
            assertEquals(0, runtime.sessionCount());
            assertTrue(runtime.environment().payloadCodec().encrypted());
        } finally {
            runtime.stop();
        }
        assertTrue(listener.stopped.get());
    }

    @Test
    void badAuthenticatorFailsAtBuild() {
        ServerConfig config = ServerConfig.builder()
            .withAuthSpecs(List.of(AuthenticatorSpec.parse("ldap")))
            .build();

        assertThrows(IllegalArgumentException.class,
            () -> DisplayServerRuntime.builder().withConfig(config).build());
    }
}
