package com.questrail.guider.protocol.phd2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.guider.api.ConnectionState;
import com.questrail.guider.api.EventPayload;
import com.questrail.guider.api.GuiderEvent;
import com.questrail.guider.api.RemoteEventType;
import com.questrail.guider.api.RpcFailureException;
import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.api.Subscription;
import com.questrail.guider.protocol.phd2.config.GuiderClientConfig;
import com.questrail.guider.protocol.phd2.config.ReconnectPolicy;
import com.questrail.guider.protocol.phd2.internal.time.SystemWallClock;
import com.questrail.guider.protocol.phd2.observability.ProtocolAnomalyEvent;
import com.questrail.guider.protocol.phd2.observability.RecordingObservabilitySink;
import com.questrail.guider.protocol.phd2.time.DeterministicScheduler;
import com.questrail.guider.protocol.phd2.time.ManualMonotonicClock;
import com.questrail.guider.protocol.phd2.transport.FakeStreamConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Phd2GuiderClientTest
 * -----------------------------------------------------------------------------
 * The client's inbound pipeline and call surface against a fake transport.
 * Call deadlines fire only when the test advances the manual clock.
 */
class Phd2GuiderClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeStreamConnector connector;
    private RecordingObservabilitySink sink;
    private Phd2GuiderClient client;
    private FakeStreamConnector.FakeConnection connection;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        connector = new FakeStreamConnector();
        sink = new RecordingObservabilitySink();
        GuiderClientConfig config = GuiderClientConfig.builder()
                .withReconnect(ReconnectPolicy.disabled())
                .build();
        client = new Phd2GuiderClient(config, connector, scheduler, clock, SystemWallClock.INSTANCE, sink);
        client.connect();
        connection = connector.lastConnection();
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    /** Id of the {@code index}-th request written, checking its method. */
    private long requestId(int index, String method) throws Exception {
        List<String> sent = connection.awaitSent(index + 1, 2000);
        JsonNode request = MAPPER.readTree(sent.get(index));
        assertEquals(method, request.get("method").asText());
        return request.get("id").asLong();
    }

    private void respond(long id, String resultJson) {
        connection.inject("{\"jsonrpc\":\"2.0\",\"result\":" + resultJson + ",\"id\":" + id + "}");
    }

    @Test
    void callResolvesWithTheMatchingResult() throws Exception {
        CompletableFuture<RpcOutcome> outcome = client.callAsync("get_app_state", null, Duration.ofSeconds(5));
        long id = requestId(0, "get_app_state");

        respond(id, "\"Guiding\"");

        assertEquals(new RpcOutcome.Success(TextNode.valueOf("Guiding")), outcome.get(1, TimeUnit.SECONDS));
    }

    @Test
    void continuationRunsOffTheInboundThreadAndMayCallAgain() throws Exception {
        CompletableFuture<String> continuationThread = new CompletableFuture<>();
        CompletableFuture<RpcOutcome> chained = client.callAsync("get_app_state", null, Duration.ofSeconds(5))
                .thenApply(first -> {
                    continuationThread.complete(Thread.currentThread().getName());
                    return client.call("get_connected", null, Duration.ofSeconds(5));
                });

        respond(requestId(0, "get_app_state"), "\"Guiding\"");
        respond(requestId(1, "get_connected"), "true");

        assertEquals(new RpcOutcome.Success(BooleanNode.TRUE), chained.get(2, TimeUnit.SECONDS));
        assertNotEquals(Thread.currentThread().getName(), continuationThread.get());
        assertTrue(continuationThread.get().startsWith("guider-callback-"));
    }

    @Test
    void typedOperationParsesAppState() throws Exception {
        CompletableFuture<AppState> state = CompletableFuture.supplyAsync(() -> new Phd2Operations(client).getAppState());
        respond(requestId(0, Phd2Operations.GET_APP_STATE), "\"LostLock\"");

        assertEquals(AppState.LOST_LOCK, state.get(2, TimeUnit.SECONDS));
    }

    @Test
    void equipmentConnectSendsBooleanParameter() throws Exception {
        CompletableFuture<Void> done = CompletableFuture.runAsync(() -> new Phd2Operations(client).setEquipmentConnected(true));
        long id = requestId(0, Phd2Operations.SET_CONNECTED);
        respond(id, "0");

        done.get(2, TimeUnit.SECONDS);
        JsonNode request = MAPPER.readTree(connection.sent().get(0));
        assertTrue(request.get("params").get(0).booleanValue());
    }

    @Test
    void remoteErrorBecomesRpcFailure() throws Exception {
        CompletableFuture<RpcOutcome> outcome = client.callAsync("guide", null, Duration.ofSeconds(5));
        long id = requestId(0, "guide");

        connection.inject("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":1,\"message\":\"cannot guide while not looping\"},\"id\":" + id + "}");

        RpcOutcome result = outcome.get(1, TimeUnit.SECONDS);
        assertEquals(new RpcOutcome.RpcFailure(1, "cannot guide while not looping"), result);
        RpcFailureException e = assertThrows(RpcFailureException.class, result::orThrow);
        assertEquals(1, e.code());
    }

    @Test
    void lateResponseAfterTimeoutIsDroppedAsAnomaly() throws Exception {
        Subscription events = client.subscribe();
        CompletableFuture<RpcOutcome> outcome = client.callAsync("get_exposure", null, Duration.ofMillis(100));
        long id = requestId(0, "get_exposure");

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertEquals(new RpcOutcome.Timeout("get_exposure", Duration.ofMillis(100)), outcome.get(1, TimeUnit.SECONDS));

        respond(id, "1000");

        List<ProtocolAnomalyEvent> anomalies = sink.getAnomalies();
        assertEquals(1, anomalies.size());
        assertEquals(ProtocolAnomalyEvent.Kind.UNMATCHED_RESPONSE, anomalies.get(0).kind());
        assertEquals(Optional.empty(), events.tryNext(), "a late response is never an event");
        assertEquals(ConnectionState.CONNECTED, client.connectionState());
    }

    @Test
    void eventsReachCurrentSubscribersOnly() throws Exception {
        Subscription first = client.subscribe();
        Subscription second = client.subscribe();

        connection.inject("{\"Event\":\"StarLost\",\"Timestamp\":1700000000.1,\"Host\":\"obs\",\"Inst\":1,\"Frame\":42,\"Status\":-1}");
        Subscription late = client.subscribe();

        for (Subscription s : List.of(first, second)) {
            GuiderEvent.RemoteEvent e = assertInstanceOf(GuiderEvent.RemoteEvent.class, s.poll(Duration.ofSeconds(1)).orElseThrow());
            assertEquals(RemoteEventType.STAR_LOST, e.type());
            assertEquals("StarLost", e.name());
            assertEquals(42, e.payload().get("Frame").asInt());
        }
        assertEquals(Optional.empty(), late.tryNext());
    }

    @Test
    void unknownEventTagsArePassedThrough() throws Exception {
        Subscription events = client.subscribe();

        connection.inject("{\"Event\":\"BrandNewThing\",\"Value\":3}");

        GuiderEvent.RemoteEvent e = assertInstanceOf(GuiderEvent.RemoteEvent.class, events.poll(Duration.ofSeconds(1)).orElseThrow());
        assertEquals(RemoteEventType.UNKNOWN, e.type());
        assertEquals("BrandNewThing", e.name());
        assertEquals("3", e.text("Value"));
    }

    @Test
    void guideStepIsDeliveredWithTypedFields() throws Exception {
        Subscription events = client.subscribe();

        connection.inject("{\"Event\":\"GuideStep\",\"Timestamp\":1700000000.5,\"Host\":\"obs\",\"Inst\":1,"
                + "\"Frame\":42,\"Time\":12.3,\"Mount\":\"Mount\",\"dx\":0.12,\"dy\":-0.3,"
                + "\"RADistanceRaw\":0.1,\"RADuration\":120,\"RADirection\":\"East\",\"SNR\":25.4}");

        GuiderEvent.RemoteEvent e = assertInstanceOf(GuiderEvent.RemoteEvent.class, events.poll(Duration.ofSeconds(1)).orElseThrow());
        EventPayload.GuideStep step = e.payloadAs(EventPayload.GuideStep.class).orElseThrow();
        assertEquals(42, step.frame());
        assertEquals(-0.3, step.dy());
        assertEquals(120, step.raDuration());
        assertEquals(25.4, step.snr());
        assertNull(step.decDuration());
    }

    @Test
    void malformedVersionFieldsAreReportedButStillDelivered() throws Exception {
        Subscription events = client.subscribe();

        connection.inject("{\"Event\":\"Version\",\"PHDVersion\":\"2.6.13\",\"MsgVersion\":\"one\"}");

        GuiderEvent.RemoteEvent e = assertInstanceOf(GuiderEvent.RemoteEvent.class, events.poll(Duration.ofSeconds(1)).orElseThrow());
        assertEquals(RemoteEventType.VERSION, e.type());
        assertEquals(Optional.empty(), client.controllerVersion());
        assertEquals(1, sink.getAnomalies().size());
        assertEquals(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, sink.getAnomalies().get(0).kind());
        assertEquals(ConnectionState.CONNECTED, client.connectionState());
    }

    @Test
    void sessionCacheIsClearedOnDisconnect() {
        connection.inject("{\"Event\":\"Version\",\"PHDVersion\":\"2.6.13\",\"PHDSubver\":\"\",\"MsgVersion\":1}");
        connection.inject("{\"Event\":\"AppState\",\"State\":\"Looping\"}");

        assertEquals(Optional.of("2.6.13"), client.controllerVersion());
        assertEquals(Optional.of(AppState.LOOPING), client.cachedAppState());

        client.disconnect();

        assertEquals(Optional.empty(), client.controllerVersion());
        assertEquals(Optional.empty(), client.cachedAppState());
    }

    @Test
    void malformedLinesAreSkippedAndTheSessionSurvives() throws Exception {
        connection.inject("this is not json");
        connection.inject("[1,2,3]");
        connection.inject("");
        connection.inject("{\"jsonrpc\":\"2.0\",\"result\":1}");

        CompletableFuture<RpcOutcome> outcome = client.callAsync("get_paused", null, Duration.ofSeconds(5));
        respond(requestId(0, "get_paused"), "false");

        assertInstanceOf(RpcOutcome.Success.class, outcome.get(1, TimeUnit.SECONDS));
        assertEquals(ConnectionState.CONNECTED, client.connectionState());
        List<ProtocolAnomalyEvent> anomalies = sink.getAnomalies();
        assertEquals(3, anomalies.size());
        assertEquals(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, anomalies.get(0).kind());
        assertEquals(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, anomalies.get(1).kind());
        assertEquals(ProtocolAnomalyEvent.Kind.UNTAGGED_MESSAGE, anomalies.get(2).kind());
    }

    @Test
    void callsWhileDisconnectedFailFast() {
        client.disconnect();

        assertEquals(new RpcOutcome.NotConnected(), client.call("get_app_state", null));
        assertTrue(connection.sent().isEmpty());
    }

    @Test
    void closeEndsSubscriptionsAndRefusesReconnect() {
        Subscription events = client.subscribe();

        client.close();

        assertTrue(events.isClosed());
        assertEquals(ConnectionState.DISCONNECTED, client.connectionState());
        assertThrows(IllegalStateException.class, client::connect);
    }
}
