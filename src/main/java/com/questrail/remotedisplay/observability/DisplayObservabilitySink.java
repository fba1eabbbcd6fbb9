package com.questrail.remotedisplay.observability;

/**
 * Receives observability events from sessions, batch controllers and the
 * transport. Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that produced the event (usually a channel's
 * event loop) and must not block.</p>
 */
public interface DisplayObservabilitySink
{
    /**
     * Called when a session changes state.
     * @param event the transition details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called after a batch controller recomputed its delay.
     * @param event the old and new delay with the factor results
     */
    void onBatchDelayChanged(BatchDelayEvent event);

    /**
     * Called when a transport-level event occurs (connection up/down, bad frame).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(DisplayErrorEvent event);
}
