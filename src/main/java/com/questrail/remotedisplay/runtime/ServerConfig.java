package com.questrail.remotedisplay.runtime;

import com.questrail.remotedisplay.auth.AuthenticatorSpec;
import com.questrail.remotedisplay.batch.BatchBounds;
import com.questrail.remotedisplay.config.ConfigSource;
import com.questrail.remotedisplay.config.IntSetting;
import com.questrail.remotedisplay.discovery.DiscoveryBackend;
import com.questrail.remotedisplay.discovery.DiscoveryConfig;
import com.questrail.remotedisplay.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.remotedisplay.protocol.crypto.CipherParameters;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the display server runtime.
 *
 * @param encryptionKey shared AES secret, or {@code null} for clear-text frames
 * @param cipher        key derivation parameters, required with a key
 */
public record ServerConfig(
    InetSocketAddress bindAddress,
    List<AuthenticatorSpec> authSpecs,
    BatchBounds batchBounds,
    DiscoveryConfig discovery,
    long maxPacketSize,
    Duration challengeTimeout,
    int maxAuthAttempts,
    int compressionLevel,
    String encryptionKey,
    CipherParameters cipher
) {
    public static final IntSetting PORT = new IntSetting("PORT", 14500, 0, 65535);
    public static final IntSetting MAX_PACKET_MB = new IntSetting("MAX_PACKET_MB", 256, 1, 1024);
    public static final IntSetting CHALLENGE_TIMEOUT = new IntSetting("CHALLENGE_TIMEOUT", 120, 1, 3600);
    public static final IntSetting AUTH_ATTEMPTS = new IntSetting("AUTH_ATTEMPTS", 3, 1, 100);
    public static final IntSetting COMPRESSION_LEVEL = new IntSetting("COMPRESSION_LEVEL", 1, 0, 9);

    /** {@code ;}-separated authenticator specs, e.g. {@code password:value=x;system}. */
    public static final String AUTH = "AUTH";

    public ServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        authSpecs = List.copyOf(Objects.requireNonNull(authSpecs, "authSpecs"));
        Objects.requireNonNull(batchBounds, "batchBounds");
        Objects.requireNonNull(discovery, "discovery");
        Objects.requireNonNull(challengeTimeout, "challengeTimeout");
        if (maxPacketSize <= 0 || maxPacketSize > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("maxPacketSize out of range: " + maxPacketSize);
        }
        if (maxAuthAttempts <= 0) {
            throw new IllegalArgumentException("maxAuthAttempts must be positive");
        }
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compressionLevel must be 0-9: " + compressionLevel);
        }
        if (encryptionKey != null && cipher == null) {
            throw new IllegalArgumentException("encryptionKey requires cipher parameters");
        }
    }


    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder preloaded from {@code source}. Invalid values are logged and
     * replaced with defaults; an unparsable authenticator spec is an error.
     */
    public static Builder fromSource(ConfigSource source, List<DiscoveryBackend> discoveryBackends) {
        Builder b = new Builder()
            .withBindAddress(new InetSocketAddress(PORT.resolve(source)))
            .withBatchBounds(BatchBounds.resolve(source))
            .withDiscovery(DiscoveryConfig.resolve(source, discoveryBackends))
            .withMaxPacketSize(MAX_PACKET_MB.resolve(source) * 1024L * 1024L)
            .withChallengeTimeout(Duration.ofSeconds(CHALLENGE_TIMEOUT.resolve(source)))
            .withMaxAuthAttempts(AUTH_ATTEMPTS.resolve(source))
            .withCompressionLevel(COMPRESSION_LEVEL.resolve(source));

        Optional<String> auth = source.get(AUTH);
        if (auth.isPresent()) {
            List<AuthenticatorSpec> specs = new ArrayList<>();
            for (String part : auth.get().split(";")) {
                if (!part.isBlank()) {
                    specs.add(AuthenticatorSpec.parse(part));
                }
            }
            b.withAuthSpecs(specs);
        }
        return b;
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(PORT.defaultValue());
        private List<AuthenticatorSpec> authSpecs = List.of();
        private BatchBounds batchBounds = BatchBounds.defaults();
        private DiscoveryConfig discovery = DiscoveryConfig.DEFAULTS;
        private long maxPacketSize = DefaultFrameDecoder.DEFAULT_MAX_PAYLOAD_SIZE;
        private Duration challengeTimeout = Duration.ofSeconds(CHALLENGE_TIMEOUT.defaultValue());
        private int maxAuthAttempts = AUTH_ATTEMPTS.defaultValue();
        private int compressionLevel = COMPRESSION_LEVEL.defaultValue();
        private String encryptionKey;
        private CipherParameters cipher;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withAuthSpecs(List<AuthenticatorSpec> authSpecs) {
            this.authSpecs = authSpecs;
            return this;
        }

        public Builder withBatchBounds(BatchBounds batchBounds) {
            this.batchBounds = batchBounds;
            return this;
        }

        public Builder withDiscovery(DiscoveryConfig discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder withMaxPacketSize(long maxPacketSize) {
            this.maxPacketSize = maxPacketSize;
            return this;
        }

        public Builder withChallengeTimeout(Duration challengeTimeout) {
            this.challengeTimeout = challengeTimeout;
            return this;
        }

        public Builder withMaxAuthAttempts(int maxAuthAttempts) {
            this.maxAuthAttempts = maxAuthAttempts;
            return this;
        }

        public Builder withCompressionLevel(int compressionLevel) {
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder withEncryption(String key, CipherParameters cipher) {
            this.encryptionKey = key;
            this.cipher = cipher;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(bindAddress, authSpecs, batchBounds, discovery, maxPacketSize,
                challengeTimeout, maxAuthAttempts, compressionLevel, encryptionKey, cipher);
        }
    }
}
