package com.questrail.guider.protocol.phd2.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.guider.protocol.phd2.model.RpcCall;
import com.questrail.guider.protocol.phd2.model.RpcError;
import com.questrail.guider.protocol.phd2.model.RpcResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonRpcCodec
 * -----------------------------------------------------------------------------
 * Text-level codec for the guider's line-delimited JSON-RPC dialect.
 *
 * <p>The codec sits between the transport (which delivers one complete line
 * per inbound message, terminator already stripped) and the classifier:</p>
 *
 * <pre>
 *   byte[] line
 *        → JsonRpcCodec.decode       (JSON object or GuiderProtocolException)
 *            → MessageClassifier     (response / event / anomaly)
 * </pre>
 *
 * <p>Outbound, {@link #encodeCall(RpcCall)} produces the full line including
 * the CRLF terminator the controller expects.</p>
 *
 * <p>The codec holds no per-connection state and is safe to share.</p>
 */
public final class JsonRpcCodec
{
    public static final String FIELD_ID = "id";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_PARAMS = "params";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_EVENT = "Event";

    private static final byte[] LINE_TERMINATOR = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final ObjectMapper mapper;

    public JsonRpcCodec() {
        this(new ObjectMapper());
    }

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Encode a call as one wire line, CRLF included.
     */
    public byte[] encodeCall(RpcCall call) {
        Objects.requireNonNull(call, "call");

        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_METHOD, call.method());
        if (call.params() != null) {
            node.set(FIELD_PARAMS, call.params());
        }
        node.put(FIELD_ID, call.id());

        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode call " + call.method(), e);
        }

        byte[] line = new byte[json.length + LINE_TERMINATOR.length];
        System.arraycopy(json, 0, line, 0, json.length);
        System.arraycopy(LINE_TERMINATOR, 0, line, json.length, LINE_TERMINATOR.length);
        return line;
    }

    /**
     * Decode one inbound line into a JSON object.
     *
     * @param line UTF-8 bytes of one message, terminator stripped
     * @return the decoded object, or empty for a blank line
     * @throws GuiderProtocolException if the line is not a JSON object
     */
    public Optional<ObjectNode> decode(byte[] line) {
        Objects.requireNonNull(line, "line");

        String text = new String(line, StandardCharsets.UTF_8).trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }

        final JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (IOException e) {
            throw new GuiderProtocolException("Malformed JSON message: " + abbreviate(text), e);
        }

        if (node == null || !node.isObject()) {
            throw new GuiderProtocolException("Message is not a JSON object: " + abbreviate(text));
        }
        return Optional.of((ObjectNode) node);
    }

    /**
     * Numeric correlation identifier of a message, if it carries one.
     *
     * <p>Integral numbers and decimal strings are accepted; anything else is
     * read as "no identifier".</p>
     */
    public static Optional<Long> idOf(JsonNode message) {
        JsonNode id = message.get(FIELD_ID);
        if (id == null || id.isNull()) {
            return Optional.empty();
        }
        if (id.canConvertToLong() && id.isIntegralNumber()) {
            return Optional.of(id.asLong());
        }
        if (id.isTextual()) {
            try {
                return Optional.of(Long.parseLong(id.asText()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * The {@code "Event"} tag of a notification, if present and textual.
     */
    public static Optional<String> eventNameOf(JsonNode message) {
        JsonNode event = message.get(FIELD_EVENT);
        if (event == null || !event.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(event.asText());
    }

    /**
     * Interpret a message already known to carry identifier {@code id} as a
     * response.
     *
     * @throws GuiderProtocolException if an error object is present but malformed
     */
    public RpcResponse toResponse(long id, JsonNode message) {
        JsonNode error = message.get(FIELD_ERROR);
        if (error != null && !error.isNull()) {
            JsonNode code = error.get("code");
            if (code == null || !code.isIntegralNumber()) {
                throw new GuiderProtocolException("Error object without integer code in response " + id);
            }
            JsonNode msg = error.get("message");
            return new RpcResponse(id, null, new RpcError(
                    code.asInt(),
                    msg == null || msg.isNull() ? "" : msg.asText(),
                    error.get("data")));
        }
        return new RpcResponse(id, message.get(FIELD_RESULT), null);
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
