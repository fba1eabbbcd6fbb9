package com.questrail.remotedisplay.observability;

import java.time.Instant;

/**
 * Record representing a transport-level event.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String remoteAddress,
    String detail
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        FRAME_ERROR
    }
}
