package com.questrail.guider.protocol.phd2.observability;

/**
 * No-op implementation of GuiderObservabilitySink.
 */
public final class NullObservabilitySink implements GuiderObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onProtocolAnomaly(ProtocolAnomalyEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(GuiderErrorEvent event) {}
}
