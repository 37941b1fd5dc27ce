package com.questrail.guider.protocol.phd2.internal.classify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.guider.protocol.phd2.codec.JsonRpcCodec;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * MessageClassifier
 * -----------------------------------------------------------------------------
 * Decides what an inbound JSON object is, in this order:
 *
 * <ol>
 *   <li>an {@code id} matching an outstanding call: {@link Classification.Response}</li>
 *   <li>a textual {@code "Event"} field: {@link Classification.Event}</li>
 *   <li>any other {@code id}: {@link Classification.UnmatchedResponse}</li>
 *   <li>anything else: {@link Classification.Untagged}</li>
 * </ol>
 *
 * <p>The classifier is pure: it only asks {@code isOutstanding} and never
 * resolves a call itself. A call that times out between classification and
 * resolution is caught by the correlator.</p>
 */
public final class MessageClassifier
{
    private final JsonRpcCodec codec;
    private final LongPredicate isOutstanding;

    public MessageClassifier(JsonRpcCodec codec, LongPredicate isOutstanding)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.isOutstanding = Objects.requireNonNull(isOutstanding, "isOutstanding");
    }

    /**
     * @throws com.questrail.guider.protocol.phd2.codec.GuiderProtocolException
     *         if a matching response carries a malformed error object
     */
    public Classification classify(ObjectNode message)
    {
        Objects.requireNonNull(message, "message");

        Optional<Long> id = JsonRpcCodec.idOf(message);
        if (id.isPresent() && isOutstanding.test(id.get())) {
            return new Classification.Response(codec.toResponse(id.get(), message));
        }

        Optional<String> event = JsonRpcCodec.eventNameOf(message);
        if (event.isPresent()) {
            return new Classification.Event(event.get(), message);
        }

        if (id.isPresent()) {
            return new Classification.UnmatchedResponse(id.get(), message);
        }
        return new Classification.Untagged(message);
    }
}
