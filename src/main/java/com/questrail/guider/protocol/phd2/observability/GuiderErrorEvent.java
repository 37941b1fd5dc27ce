package com.questrail.guider.protocol.phd2.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error caught inside the session runtime.
 */
public record GuiderErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
