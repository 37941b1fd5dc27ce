package com.questrail.guider.protocol.phd2.internal.classify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.guider.protocol.phd2.model.RpcResponse;

/**
 * Result of classifying one decoded inbound message.
 */
public sealed interface Classification
        permits Classification.Response,
                Classification.Event,
                Classification.UnmatchedResponse,
                Classification.Untagged
{
    /** Answer to an outstanding call. */
    record Response(RpcResponse response) implements Classification {}

    /** Unsolicited notification tagged with {@code "Event"}. */
    record Event(String name, ObjectNode payload) implements Classification {}

    /** Carries an id that matches no outstanding call. */
    record UnmatchedResponse(long id, ObjectNode message) implements Classification {}

    /** Neither an answer nor an event. */
    record Untagged(ObjectNode message) implements Classification {}
}
