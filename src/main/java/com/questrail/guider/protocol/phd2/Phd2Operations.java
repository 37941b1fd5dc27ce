package com.questrail.guider.protocol.phd2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.guider.api.GuiderClient;
import com.questrail.guider.protocol.phd2.codec.GuiderProtocolException;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed wrappers for the few remote operations the runtime itself relies on.
 *
 * <p>Every method goes through {@link GuiderClient#invoke} and so throws the
 * {@code GuiderException} subtype matching a non-success outcome. Anything
 * not listed here is issued as a raw {@link GuiderClient#call}.</p>
 */
public final class Phd2Operations
{
    public static final String GET_APP_STATE = "get_app_state";
    public static final String GET_CONNECTED = "get_connected";
    public static final String SET_CONNECTED = "set_connected";
    public static final String SHUTDOWN = "shutdown";

    private final GuiderClient client;

    public Phd2Operations(GuiderClient client)
    {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * @throws GuiderProtocolException if the result is not a known state name
     */
    public AppState getAppState()
    {
        JsonNode result = client.invoke(GET_APP_STATE, null);
        if (!result.isTextual()) {
            throw new GuiderProtocolException("Expected string for app state, got " + result);
        }
        return AppState.fromWireName(result.asText())
                .orElseThrow(() -> new GuiderProtocolException("Unknown app state: " + result.asText()));
    }

    /** Whether the controller's equipment (camera, mount) is connected. */
    public boolean isEquipmentConnected()
    {
        JsonNode result = client.invoke(GET_CONNECTED, null);
        if (!result.isBoolean()) {
            throw new GuiderProtocolException("Expected boolean for connected state, got " + result);
        }
        return result.booleanValue();
    }

    public void setEquipmentConnected(boolean connected)
    {
        ArrayNode params = JsonNodeFactory.instance.arrayNode().add(connected);
        client.invoke(SET_CONNECTED, params);
    }

    /**
     * Ask the controller to exit, bounding the wait for its acknowledgement.
     */
    public void shutdown(Duration timeout)
    {
        client.call(SHUTDOWN, null, timeout).orThrow();
    }
}
