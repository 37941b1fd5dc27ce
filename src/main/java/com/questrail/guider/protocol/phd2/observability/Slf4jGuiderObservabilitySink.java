package com.questrail.guider.protocol.phd2.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GuiderObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGuiderObservabilitySink implements GuiderObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGuiderObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        if (event.isChange()) {
            log.info("Guider connection: {} -> {} ({})",
                event.oldState(),
                event.newState(),
                event.trigger());
        }
    }

    @Override
    public void onProtocolAnomaly(ProtocolAnomalyEvent event) {
        log.debug("Guider anomaly {}: {} [{}]", event.kind(), event.detail(), event.message());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("Guider transport {} (generation {}, {}): {}",
            event.kind(), event.generation(), event.remote(), event.detail());
    }

    @Override
    public void onError(GuiderErrorEvent event) {
        log.error("Guider error: {}", event.message(), event.cause());
    }
}
