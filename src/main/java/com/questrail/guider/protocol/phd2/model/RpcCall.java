package com.questrail.guider.protocol.phd2.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Outgoing request: {@code {"method": ..., "params": ..., "id": ...}}.
 *
 * @param id     correlation identifier, unique for the lifetime of the client
 * @param method remote method name
 * @param params JSON object or array; {@code null} omits the field
 */
public record RpcCall(long id, String method, JsonNode params)
{
    public RpcCall {
        Objects.requireNonNull(method, "method");
        if (method.isBlank()) {
            throw new IllegalArgumentException("method must not be blank");
        }
        if (params != null && !params.isObject() && !params.isArray()) {
            throw new IllegalArgumentException("params must be a JSON object or array");
        }
    }
}
