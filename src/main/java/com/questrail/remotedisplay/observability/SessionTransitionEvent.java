package com.questrail.remotedisplay.observability;

import com.questrail.remotedisplay.session.SessionState;

import java.time.Instant;

/**
 * Record representing a session state transition.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String sessionId,
    SessionState oldState,
    SessionState newState,
    String reason
) {
    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
