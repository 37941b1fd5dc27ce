package com.questrail.guider.protocol.phd2.observability;

import java.time.Instant;

/**
 * An inbound message that was dropped instead of being delivered.
 *
 * @param message raw text of the message, possibly abbreviated
 */
public record ProtocolAnomalyEvent(
    Instant timestamp,
    Kind kind,
    String detail,
    String message
) {
    public enum Kind {
        /** Carries an id with no outstanding call: late or from an earlier session. */
        UNMATCHED_RESPONSE,
        /** Neither a response nor an event. */
        UNTAGGED_MESSAGE,
        /** Not a JSON object. */
        MALFORMED_MESSAGE
    }
}
