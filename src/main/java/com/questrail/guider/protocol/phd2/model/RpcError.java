package com.questrail.guider.protocol.phd2.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * JSON-RPC error object carried by a failed response.
 *
 * @param data optional extra detail; may be {@code null}
 */
public record RpcError(int code, String message, JsonNode data)
{
    public RpcError {
        Objects.requireNonNull(message, "message");
    }
}
