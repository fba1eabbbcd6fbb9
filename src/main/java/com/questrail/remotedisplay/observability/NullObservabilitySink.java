package com.questrail.remotedisplay.observability;

/**
 * No-op implementation of DisplayObservabilitySink.
 */
public final class NullObservabilitySink implements DisplayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onBatchDelayChanged(BatchDelayEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(DisplayErrorEvent event) {}
}
