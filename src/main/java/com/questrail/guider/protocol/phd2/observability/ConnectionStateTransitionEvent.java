package com.questrail.guider.protocol.phd2.observability;

import com.questrail.guider.api.ConnectionState;

import java.time.Instant;

/**
 * A connection state change performed by the connection supervisor.
 *
 * @param trigger short description of what caused the change
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    String trigger
) {
    public boolean isChange() {
        return oldState != newState;
    }
}
