package com.questrail.guider.protocol.phd2.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Incoming response correlated to an earlier {@link RpcCall} by {@code id}.
 *
 * <p>Exactly one of {@code result} and {@code error} is meaningful: a present
 * error wins; otherwise a missing result is read as JSON {@code null}.</p>
 */
public record RpcResponse(long id, JsonNode result, RpcError error)
{
    public RpcResponse {
        if (error == null) {
            result = Objects.requireNonNullElse(result, NullNode.getInstance());
        }
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<RpcError> errorObject() {
        return Optional.ofNullable(error);
    }
}
