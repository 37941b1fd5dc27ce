package com.questrail.guider.protocol.phd2;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.guider.api.ConnectionFailedException;
import com.questrail.guider.api.ConnectionState;
import com.questrail.guider.api.GuiderEvent;
import com.questrail.guider.api.RemoteEventType;
import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.api.Subscription;
import com.questrail.guider.protocol.phd2.config.GuiderClientConfig;
import com.questrail.guider.protocol.phd2.config.ReconnectPolicy;
import com.questrail.guider.protocol.phd2.internal.time.ScheduledExecutorScheduler;
import com.questrail.guider.protocol.phd2.internal.time.SystemMonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.SystemWallClock;
import com.questrail.guider.protocol.phd2.observability.RecordingObservabilitySink;
import com.questrail.guider.protocol.phd2.transport.ScriptedGuiderServer;
import com.questrail.guider.protocol.phd2.transport.tcp.netty.NettyTcpStreamConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Phd2GuiderClientNettyTest
 * -----------------------------------------------------------------------------
 * Full client stack over loopback TCP against a scripted controller.
 */
class Phd2GuiderClientNettyTest {

    private ScriptedGuiderServer server;
    private NettyTcpStreamConnector connector;
    private ScheduledExecutorService timer;
    private RecordingObservabilitySink sink;
    private Phd2GuiderClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new ScriptedGuiderServer()
                .respond("get_app_state", TextNode.valueOf("Guiding"))
                .respond("get_connected", BooleanNode.TRUE)
                .respond("get_exposure", ScriptedGuiderServer.SILENT);
        connector = new NettyTcpStreamConnector(1024 * 1024);
        timer = Executors.newSingleThreadScheduledExecutor();
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        connector.shutdown();
        timer.shutdownNow();
        server.close();
    }

    private Phd2GuiderClient newClient(ReconnectPolicy reconnect) {
        GuiderClientConfig config = GuiderClientConfig.builder()
                .withHost("127.0.0.1")
                .withPort(server.port())
                .withConnectionTimeout(Duration.ofSeconds(2))
                .withCallTimeout(Duration.ofSeconds(2))
                .withReconnect(reconnect)
                .build();
        return new Phd2GuiderClient(config, connector,
                new ScheduledExecutorScheduler(timer, SystemMonotonicClock.INSTANCE),
                SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, sink);
    }

    private static GuiderEvent awaitEvent(Subscription events, Predicate<GuiderEvent> match) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Optional<GuiderEvent> e = events.poll(Duration.ofMillis(100));
            if (e.isPresent() && match.test(e.get())) {
                return e.get();
            }
        }
        throw new AssertionError("Expected event not published");
    }

    @Test
    void connectsReceivesGreetingAndCalls() throws Exception {
        client = newClient(ReconnectPolicy.disabled());
        Subscription events = client.subscribe();

        client.connect();

        GuiderEvent.RemoteEvent version = (GuiderEvent.RemoteEvent) awaitEvent(events,
                e -> e instanceof GuiderEvent.RemoteEvent r && r.type() == RemoteEventType.VERSION);
        assertEquals("2.6.13", version.text("PHDVersion"));
        assertEquals(Optional.of("2.6.13"), client.controllerVersion());

        Phd2Operations ops = new Phd2Operations(client);
        assertEquals(AppState.GUIDING, ops.getAppState());
        assertTrue(ops.isEquipmentConnected());
        assertEquals(new RpcOutcome.RpcFailure(-32601, "method not found"), client.call("no_such_method", null));
    }

    @Test
    void continuationMayBlockOnAnotherCall() throws Exception {
        client = newClient(ReconnectPolicy.disabled());
        client.connect();

        CompletableFuture<String> thread = new CompletableFuture<>();
        CompletableFuture<RpcOutcome> nested = client.callAsync("get_app_state", null, Duration.ofSeconds(2))
                .thenApply(first -> {
                    thread.complete(Thread.currentThread().getName());
                    return client.call("get_connected", null, Duration.ofSeconds(2));
                });

        assertEquals(new RpcOutcome.Success(BooleanNode.TRUE), nested.get(5, TimeUnit.SECONDS));
        assertTrue(thread.get().startsWith("guider-callback-"), thread.get());
    }

    @Test
    void unansweredCallTimesOutAndSessionSurvives() {
        client = newClient(ReconnectPolicy.disabled());
        client.connect();

        RpcOutcome outcome = client.call("get_exposure", null, Duration.ofMillis(150));

        assertEquals(new RpcOutcome.Timeout("get_exposure", Duration.ofMillis(150)), outcome);
        assertEquals(ConnectionState.CONNECTED, client.connectionState());
        assertInstanceOf(RpcOutcome.Success.class, client.call("get_app_state", null));
    }

    @Test
    void broadcastEventsAreDelivered() throws Exception {
        client = newClient(ReconnectPolicy.disabled());
        Subscription events = client.subscribe();
        client.connect();
        server.awaitAccepted(1, 2000);

        server.broadcast("{\"Event\":\"GuideStep\",\"Frame\":7,\"dx\":0.12,\"dy\":-0.3}");

        GuiderEvent.RemoteEvent step = (GuiderEvent.RemoteEvent) awaitEvent(events,
                e -> e instanceof GuiderEvent.RemoteEvent r && r.type() == RemoteEventType.GUIDE_STEP);
        assertEquals(7, step.payload().get("Frame").asInt());
    }

    @Test
    void reconnectsAfterServerDropsTheSession() throws Exception {
        client = newClient(ReconnectPolicy.bounded(Duration.ofMillis(100), 20));
        Subscription events = client.subscribe();
        client.connect();
        server.awaitAccepted(1, 2000);

        server.dropClients();

        awaitEvent(events, e -> e instanceof GuiderEvent.ConnectionLost);
        awaitEvent(events, e -> e instanceof GuiderEvent.Reconnecting);
        awaitEvent(events, e -> e instanceof GuiderEvent.Reconnected);
        client.awaitConnected(Duration.ofSeconds(2));
        assertEquals(2, server.acceptedCount());
        assertEquals(TextNode.valueOf("Guiding"), client.call("get_app_state", null).orThrow());
    }

    @Test
    void refusedConnectionFailsConnect() throws IOException {
        int port = server.port();
        server.close();
        GuiderClientConfig config = GuiderClientConfig.builder()
                .withHost("127.0.0.1")
                .withPort(port)
                .withConnectionTimeout(Duration.ofSeconds(1))
                .build();
        client = new Phd2GuiderClient(config, connector,
                new ScheduledExecutorScheduler(timer, SystemMonotonicClock.INSTANCE),
                SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, sink);

        assertThrows(ConnectionFailedException.class, client::connect);
        assertEquals(ConnectionState.DISCONNECTED, client.connectionState());
    }

    @Test
    void lateResultForExpiredCallIsNotAnEvent() throws Exception {
        server.respond("get_exposure", request -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return IntNode.valueOf(2000);
        });
        client = newClient(ReconnectPolicy.disabled());
        Subscription events = client.subscribe();
        client.connect();
        awaitEvent(events, e -> e instanceof GuiderEvent.RemoteEvent r && r.type() == RemoteEventType.APP_STATE);

        assertInstanceOf(RpcOutcome.Timeout.class, client.call("get_exposure", null, Duration.ofMillis(100)));
        Thread.sleep(500);

        assertTrue(events.tryNext().isEmpty());
        assertFalse(sink.getAnomalies().isEmpty());
    }
}
