package com.questrail.guider.protocol.phd2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.guider.api.ConnectionState;
import com.questrail.guider.api.EventPayload;
import com.questrail.guider.api.GuiderClient;
import com.questrail.guider.api.GuiderEvent;
import com.questrail.guider.api.RemoteEventType;
import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.api.Subscription;
import com.questrail.guider.protocol.phd2.codec.GuiderProtocolException;
import com.questrail.guider.protocol.phd2.codec.JsonRpcCodec;
import com.questrail.guider.protocol.phd2.config.GuiderClientConfig;
import com.questrail.guider.protocol.phd2.internal.classify.Classification;
import com.questrail.guider.protocol.phd2.internal.classify.MessageClassifier;
import com.questrail.guider.protocol.phd2.internal.events.EventBroadcaster;
import com.questrail.guider.protocol.phd2.internal.rpc.RequestCorrelator;
import com.questrail.guider.protocol.phd2.internal.session.ConnectionSupervisor;
import com.questrail.guider.protocol.phd2.internal.session.SessionHooks;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicScheduler;
import com.questrail.guider.protocol.phd2.internal.time.WallClock;
import com.questrail.guider.protocol.phd2.observability.GuiderErrorEvent;
import com.questrail.guider.protocol.phd2.observability.GuiderObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.NullObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.ProtocolAnomalyEvent;
import com.questrail.guider.protocol.phd2.transport.StreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Phd2GuiderClient
 * =============================================================================
 * {@link GuiderClient} for a PHD2-compatible controller speaking line-delimited
 * JSON-RPC over TCP.
 *
 * <h2>Inbound pipeline</h2>
 * <pre>
 *   transport line
 *     → JsonRpcCodec.decode
 *       → MessageClassifier
 *           Response          → RequestCorrelator.complete
 *           Event             → session cache, EventBroadcaster.publish
 *           UnmatchedResponse → WARN + anomaly, dropped
 *           Untagged          → anomaly, dropped
 * </pre>
 * The pipeline runs on the transport thread of the live connection and never
 * lets an exception reach the transport: a bad message is reported and
 * skipped, the connection stays up.
 *
 * <h2>Session cache</h2>
 * The controller version (from the {@code Version} greeting) and the last
 * {@link AppState} (from {@code AppState} notifications) are cached per
 * session and cleared when the session ends.
 *
 * <h2>Callbacks</h2>
 * Futures returned by {@link #callAsync} complete on the callback executor,
 * never on the transport or timer thread, so a continuation may itself block
 * on {@link #call}. The executor must be able to run more than one task at a
 * time for such nesting to make progress.
 *
 * <p>Construction starts the connection supervisor thread but does not
 * connect. {@link #close()} disconnects and stops the thread, and shuts down
 * the callback pool when the client created it; the transport and scheduler
 * threads belong to whoever built them (normally
 * {@code GuiderClientRuntime}).</p>
 */
public final class Phd2GuiderClient implements GuiderClient
{
    private static final Logger log = LoggerFactory.getLogger(Phd2GuiderClient.class);

    private final GuiderClientConfig config;
    private final JsonRpcCodec codec;
    private final RequestCorrelator correlator;
    private final MessageClassifier classifier;
    private final EventBroadcaster broadcaster;
    private final ConnectionSupervisor supervisor;
    private final WallClock wallClock;
    private final GuiderObservabilitySink observabilitySink;
    private final ExecutorService ownedCallbackExecutor;

    private final AtomicReference<String> controllerVersion = new AtomicReference<>();
    private final AtomicReference<AppState> appState = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Phd2GuiderClient(GuiderClientConfig config,
                            StreamConnector connector,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            GuiderObservabilitySink observabilitySink)
    {
        this(config, connector, scheduler, clock, wallClock, observabilitySink, null);
    }

    /**
     * @param callbackExecutor completes call futures; owned by the caller.
     *        {@code null} makes the client create and own a cached daemon pool.
     */
    public Phd2GuiderClient(GuiderClientConfig config,
                            StreamConnector connector,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            GuiderObservabilitySink observabilitySink,
                            Executor callbackExecutor)
    {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.ownedCallbackExecutor = callbackExecutor == null ? newCallbackPool() : null;
        Executor completion = callbackExecutor != null ? callbackExecutor : ownedCallbackExecutor;

        this.codec = new JsonRpcCodec();
        this.correlator = new RequestCorrelator(codec, scheduler, clock, completion);
        this.classifier = new MessageClassifier(codec, correlator::isOutstanding);
        this.broadcaster = new EventBroadcaster(config.subscriberQueueCapacity());
        this.supervisor = new ConnectionSupervisor(
                InetSocketAddress.createUnresolved(config.host(), config.port()),
                config.connectionTimeout(),
                config.reconnect(),
                connector,
                correlator,
                broadcaster,
                new InboundPipeline(),
                scheduler,
                clock,
                wallClock,
                this.observabilitySink);

        supervisor.start();
    }

    // -------------------------------------------------------------------------
    // Calls
    // -------------------------------------------------------------------------

    @Override
    public RpcOutcome call(String method, JsonNode params, Duration timeout)
    {
        return callAsync(method, params, timeout).join();
    }

    @Override
    public RpcOutcome call(String method, JsonNode params)
    {
        return call(method, params, config.callTimeout());
    }

    @Override
    public CompletableFuture<RpcOutcome> callAsync(String method, JsonNode params, Duration timeout)
    {
        return correlator.callAsync(method, params, timeout);
    }

    // -------------------------------------------------------------------------
    // Events
    // -------------------------------------------------------------------------

    @Override
    public Subscription subscribe()
    {
        return broadcaster.subscribe();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void connect()
    {
        if (closed.get()) {
            throw new IllegalStateException("Client is closed");
        }
        supervisor.connect();
    }

    @Override
    public void disconnect()
    {
        supervisor.disconnect();
    }

    @Override
    public ConnectionState connectionState()
    {
        return supervisor.state();
    }

    @Override
    public void setAutoReconnectEnabled(boolean enabled)
    {
        supervisor.setAutoReconnectEnabled(enabled);
    }

    @Override
    public boolean isAutoReconnectEnabled()
    {
        return supervisor.isAutoReconnectEnabled();
    }

    @Override
    public void stopReconnection()
    {
        supervisor.stopReconnection();
    }

    @Override
    public void awaitConnected(Duration timeout) throws InterruptedException
    {
        supervisor.awaitConnected(timeout);
    }

    @Override
    public Optional<String> controllerVersion()
    {
        return Optional.ofNullable(controllerVersion.get());
    }

    /**
     * Last application state announced by an {@code AppState} notification in
     * the current session. No call is made.
     */
    public Optional<AppState> cachedAppState()
    {
        return Optional.ofNullable(appState.get());
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            supervisor.disconnect();
            supervisor.stop();
            broadcaster.closeAll();
            if (ownedCallbackExecutor != null) {
                ownedCallbackExecutor.shutdown();
            }
        }
    }

    /** Cached daemon pool named {@code guider-callback-N}. */
    public static ExecutorService newCallbackPool()
    {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "guider-callback-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // -------------------------------------------------------------------------
    // Inbound pipeline (transport thread)
    // -------------------------------------------------------------------------

    private void handleLine(byte[] line)
    {
        Optional<ObjectNode> decoded;
        try {
            decoded = codec.decode(line);
        } catch (GuiderProtocolException e) {
            log.warn("Skipping undecodable message: {}", e.getMessage());
            anomaly(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, e.getMessage(), line);
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }

        ObjectNode message = decoded.get();
        Classification c;
        try {
            c = classifier.classify(message);
        } catch (GuiderProtocolException e) {
            log.warn("Skipping malformed response: {}", e.getMessage());
            anomaly(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, e.getMessage(), line);
            return;
        }

        if (c instanceof Classification.Response r) {
            if (!correlator.complete(r.response())) {
                // Resolved by its deadline since classification.
                unmatched(r.response().id(), line);
            }
        }
        else if (c instanceof Classification.Event e) {
            onRemoteEvent(e.name(), e.payload(), line);
        }
        else if (c instanceof Classification.UnmatchedResponse u) {
            unmatched(u.id(), line);
        }
        else {
            log.debug("Dropping message with neither id nor Event tag");
            anomaly(ProtocolAnomalyEvent.Kind.UNTAGGED_MESSAGE, "no id and no Event tag", line);
        }
    }

    private void onRemoteEvent(String name, ObjectNode payload, byte[] line)
    {
        GuiderEvent.RemoteEvent event = new GuiderEvent.RemoteEvent(
                wallClock.now(), RemoteEventType.fromWireName(name), name, payload);
        try {
            event.payloadAs(EventPayload.Version.class)
                    .map(EventPayload.Version::phdVersion)
                    .ifPresent(version -> {
                        controllerVersion.set(version);
                        log.info("Guider controller version {}", version);
                    });
            event.payloadAs(EventPayload.AppStateChanged.class)
                    .map(EventPayload.AppStateChanged::state)
                    .flatMap(AppState::fromWireName)
                    .ifPresent(appState::set);
        } catch (IllegalArgumentException e) {
            // Still delivered raw; only the session cache misses it.
            log.warn("{} notification has malformed fields: {}", name, e.getMessage());
            anomaly(ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, e.getMessage(), line);
        }
        broadcaster.publish(event);
    }

    private void unmatched(long id, byte[] line)
    {
        log.warn("Dropping response for unknown or expired call id {}", id);
        anomaly(ProtocolAnomalyEvent.Kind.UNMATCHED_RESPONSE, "no outstanding call with id " + id, line);
    }

    private void anomaly(ProtocolAnomalyEvent.Kind kind, String detail, byte[] line)
    {
        String text = new String(line, StandardCharsets.UTF_8);
        if (text.length() > 200) {
            text = text.substring(0, 197) + "...";
        }
        observabilitySink.onProtocolAnomaly(new ProtocolAnomalyEvent(wallClock.now(), kind, detail, text));
    }

    private final class InboundPipeline implements SessionHooks
    {
        @Override
        public void onLine(byte[] line)
        {
            try {
                handleLine(line);
            } catch (RuntimeException e) {
                log.error("Inbound message handling failed", e);
                observabilitySink.onError(new GuiderErrorEvent(wallClock.now(), "Inbound message handling failed", e));
            }
        }

        @Override
        public void onFramingError(String detail)
        {
            log.warn("Discarded oversized inbound line: {}", detail);
            observabilitySink.onProtocolAnomaly(new ProtocolAnomalyEvent(
                    wallClock.now(), ProtocolAnomalyEvent.Kind.MALFORMED_MESSAGE, detail, ""));
        }

        @Override
        public void onSessionClosed()
        {
            controllerVersion.set(null);
            appState.set(null);
        }
    }
}
