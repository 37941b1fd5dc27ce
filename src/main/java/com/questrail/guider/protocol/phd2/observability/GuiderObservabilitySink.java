package com.questrail.guider.protocol.phd2.observability;

/**
 * Receives observability events from the guider session runtime.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on runtime threads (the supervisor thread, the transport
 * event loop, timer threads) and must return quickly.</p>
 */
public interface GuiderObservabilitySink {
    /**
     * Called on every connection state change.
     * @param event the transition details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when an inbound message is unmatched, untagged or undecodable.
     * @param event the anomaly
     */
    void onProtocolAnomaly(ProtocolAnomalyEvent event);

    /**
     * Called when the transport comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an unexpected error is caught on a runtime thread.
     * @param event the error
     */
    void onError(GuiderErrorEvent event);
}
