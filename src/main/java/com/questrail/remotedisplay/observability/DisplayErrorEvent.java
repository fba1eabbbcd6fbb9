package com.questrail.remotedisplay.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the display protocol stack.
 */
public record DisplayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
