package com.questrail.guider.protocol.phd2.observability;

import java.time.Instant;

/**
 * Transport-level change for one connection generation.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long generation,
    String remote,
    String detail
) {
    public enum Kind {
        CONNECTED,
        CONNECT_FAILED,
        CLOSED
    }
}
