package com.questrail.remotedisplay.session;

import com.questrail.remotedisplay.auth.AuthenticatorFactory;
import com.questrail.remotedisplay.batch.BatchConfig;
import com.questrail.remotedisplay.batch.factor.BatchFactor;
import com.questrail.remotedisplay.internal.time.MonotonicClock;
import com.questrail.remotedisplay.internal.time.MonotonicScheduler;
import com.questrail.remotedisplay.internal.time.WallClock;
import com.questrail.remotedisplay.observability.DisplayObservabilitySink;
import com.questrail.remotedisplay.protocol.codec.FrameEncoder;
import com.questrail.remotedisplay.protocol.codec.FramePayloadCodec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Everything sessions share: built once by the runtime, read-only afterwards.
 *
 * @param batchTemplate     config cloned for every new window; never mutated
 * @param challengeTimeout  time a client has to complete the handshake
 * @param maxAuthAttempts   failed responses allowed before the session is rejected
 * @param maxPendingBytes   limit for buffered chunk payloads per connection
 */
public record SessionEnvironment(
        AuthenticatorFactory authenticators,
        int maxAuthAttempts,
        Duration challengeTimeout,
        BatchConfig batchTemplate,
        List<BatchFactor> factors,
        FramePayloadCodec payloadCodec,
        FrameEncoder frameEncoder,
        long maxPendingBytes,
        MonotonicClock clock,
        MonotonicScheduler scheduler,
        WallClock wallClock,
        DisplayObservabilitySink sink)
{
    public SessionEnvironment
    {
        Objects.requireNonNull(authenticators, "authenticators");
        Objects.requireNonNull(challengeTimeout, "challengeTimeout");
        Objects.requireNonNull(batchTemplate, "batchTemplate");
        factors = List.copyOf(Objects.requireNonNull(factors, "factors"));
        Objects.requireNonNull(payloadCodec, "payloadCodec");
        Objects.requireNonNull(frameEncoder, "frameEncoder");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(sink, "sink");
        if (maxAuthAttempts <= 0) {
            throw new IllegalArgumentException("maxAuthAttempts must be positive");
        }
        if (challengeTimeout.isNegative() || challengeTimeout.isZero()) {
            throw new IllegalArgumentException("challengeTimeout must be positive");
        }
        if (maxPendingBytes <= 0) {
            throw new IllegalArgumentException("maxPendingBytes must be positive");
        }
    }
}
