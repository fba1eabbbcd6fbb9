package com.questrail.remotedisplay.observability;

import com.questrail.remotedisplay.stats.Adjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DisplayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDisplayObservabilitySink implements DisplayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDisplayObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isTerminal() && event.reason() != null) {
            log.info("Session {}: {} -> {} ({})",
                event.sessionId(), event.oldState(), event.newState(), event.reason());
        } else {
            log.info("Session {}: {} -> {}", event.sessionId(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onBatchDelayChanged(BatchDelayEvent event) {
        if (!log.isDebugEnabled() || !event.changed()) {
            return;
        }
        log.debug("Window {}: batch delay {} -> {} ms{}",
            event.windowId(),
            Math.round(event.oldDelay()),
            Math.round(event.newDelay()),
            event.locked() ? " (locked)" : "");
        for (Adjustment a : event.factors()) {
            log.debug("  {}", a.explanation());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("Transport Event: {} {} {}", event.kind(), event.remoteAddress(),
            event.detail() == null ? "" : event.detail());
    }

    @Override
    public void onError(DisplayErrorEvent event) {
        log.error("Display Error: {}", event.message(), event.cause());
    }
}
