package com.questrail.guider.protocol.phd2.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.guider.protocol.phd2.model.RpcCall;
import com.questrail.guider.protocol.phd2.model.RpcResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonRpcCodecTest {

    private final JsonRpcCodec codec = new JsonRpcCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void encodedCallIsOneCrlfTerminatedJsonObject() throws Exception {
        ObjectNode params = mapper.createObjectNode().put("exposure", 2000);

        byte[] line = codec.encodeCall(new RpcCall(7, "set_exposure", params));
        String text = new String(line, StandardCharsets.UTF_8);

        assertTrue(text.endsWith("\r\n"));
        assertEquals(1, text.split("\n", -1).length - 1, "exactly one line terminator");

        JsonNode decoded = mapper.readTree(text.trim());
        assertEquals("set_exposure", decoded.get("method").asText());
        assertEquals(7, decoded.get("id").asLong());
        assertEquals(2000, decoded.get("params").get("exposure").asInt());
    }

    @Test
    void nullParamsAreOmitted() throws Exception {
        String text = new String(codec.encodeCall(new RpcCall(1, "get_app_state", null)), StandardCharsets.UTF_8);

        JsonNode decoded = mapper.readTree(text.trim());
        assertFalse(decoded.has("params"));
    }

    @Test
    void scalarParamsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RpcCall(1, "set_connected", mapper.getNodeFactory().booleanNode(true)));
    }

    @Test
    void decodesObjectAndIgnoresBlankLines() {
        Optional<ObjectNode> decoded = codec.decode(bytes("{\"Event\":\"StarLost\"}"));
        assertTrue(decoded.isPresent());
        assertEquals("StarLost", decoded.get().get("Event").asText());

        assertTrue(codec.decode(bytes("   ")).isEmpty());
        assertTrue(codec.decode(bytes("")).isEmpty());
    }

    @Test
    void malformedJsonIsAProtocolError() {
        GuiderProtocolException e = assertThrows(GuiderProtocolException.class,
                () -> codec.decode(bytes("{\"Event\": ")));
        assertTrue(e.getMessage().startsWith("Malformed JSON"));
    }

    @Test
    void nonObjectJsonIsAProtocolError() {
        assertThrows(GuiderProtocolException.class, () -> codec.decode(bytes("[1,2,3]")));
        assertThrows(GuiderProtocolException.class, () -> codec.decode(bytes("42")));
    }

    @Test
    void idIsReadFromNumbersAndDecimalStrings() {
        assertEquals(Optional.of(12L), JsonRpcCodec.idOf(codec.decode(bytes("{\"id\":12}")).get()));
        assertEquals(Optional.of(12L), JsonRpcCodec.idOf(codec.decode(bytes("{\"id\":\"12\"}")).get()));
        assertEquals(Optional.empty(), JsonRpcCodec.idOf(codec.decode(bytes("{\"id\":null}")).get()));
        assertEquals(Optional.empty(), JsonRpcCodec.idOf(codec.decode(bytes("{\"id\":\"abc\"}")).get()));
        assertEquals(Optional.empty(), JsonRpcCodec.idOf(codec.decode(bytes("{\"id\":1.5}")).get()));
    }

    @Test
    void eventNameMustBeTextual() {
        assertEquals(Optional.of("GuideStep"),
                JsonRpcCodec.eventNameOf(codec.decode(bytes("{\"Event\":\"GuideStep\"}")).get()));
        assertEquals(Optional.empty(),
                JsonRpcCodec.eventNameOf(codec.decode(bytes("{\"Event\":3}")).get()));
    }

    @Test
    void responseWithResult() {
        RpcResponse r = codec.toResponse(3, codec.decode(bytes("{\"jsonrpc\":\"2.0\",\"result\":\"Guiding\",\"id\":3}")).get());

        assertFalse(r.isError());
        assertEquals("Guiding", r.result().asText());
    }

    @Test
    void missingResultReadsAsJsonNull() {
        RpcResponse r = codec.toResponse(3, codec.decode(bytes("{\"id\":3}")).get());

        assertFalse(r.isError());
        assertTrue(r.result().isNull());
    }

    @Test
    void responseWithError() {
        RpcResponse r = codec.toResponse(4, codec.decode(bytes(
                "{\"error\":{\"code\":1,\"message\":\"equipment not connected\"},\"id\":4}")).get());

        assertTrue(r.isError());
        assertEquals(1, r.errorObject().get().code());
        assertEquals("equipment not connected", r.errorObject().get().message());
    }

    @Test
    void errorWithoutCodeIsAProtocolError() {
        ObjectNode message = codec.decode(bytes("{\"error\":{\"message\":\"x\"},\"id\":4}")).get();

        assertThrows(GuiderProtocolException.class, () -> codec.toResponse(4, message));
    }
}
