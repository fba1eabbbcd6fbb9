package com.questrail.remotedisplay.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>It MUST NOT be used for timeouts or batch delay computation.</p>
 */
public interface WallClock
{
    Instant now();
}
