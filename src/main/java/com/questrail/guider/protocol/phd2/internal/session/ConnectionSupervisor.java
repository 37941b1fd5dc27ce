package com.questrail.guider.protocol.phd2.internal.session;

import com.questrail.guider.api.CallTimeoutException;
import com.questrail.guider.api.ConnectionFailedException;
import com.questrail.guider.api.ConnectionState;
import com.questrail.guider.api.GuiderEvent;
import com.questrail.guider.api.NotConnectedException;
import com.questrail.guider.api.ReconnectFailedException;
import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.protocol.phd2.config.ReconnectPolicy;
import com.questrail.guider.protocol.phd2.internal.events.EventBroadcaster;
import com.questrail.guider.protocol.phd2.internal.rpc.RequestCorrelator;
import com.questrail.guider.protocol.phd2.internal.time.Cancellable;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicScheduler;
import com.questrail.guider.protocol.phd2.internal.time.WallClock;
import com.questrail.guider.protocol.phd2.observability.ConnectionStateTransitionEvent;
import com.questrail.guider.protocol.phd2.observability.GuiderErrorEvent;
import com.questrail.guider.protocol.phd2.observability.GuiderObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.NullObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.TransportObservabilityEvent;
import com.questrail.guider.protocol.phd2.transport.StreamConnection;
import com.questrail.guider.protocol.phd2.transport.StreamConnector;
import com.questrail.guider.protocol.phd2.transport.StreamListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionSupervisor
 * =============================================================================
 * Single owner of the connection state machine and the reconnect loop.
 *
 * <h2>Threading Model</h2>
 * The supervisor runs one event-loop thread consuming a command queue. Every
 * state change, every connect attempt and every reconnect decision happens on
 * that thread, so the state machine needs no locking of its own. Transport
 * callbacks and timer ticks only enqueue commands.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED --connect--------------------&gt; CONNECTING
 *   CONNECTING   --handshake ok---------------&gt; CONNECTED
 *   CONNECTING   --handshake failed-----------&gt; DISCONNECTED
 *   CONNECTED    --transport down, auto on----&gt; RECONNECTING
 *   CONNECTED    --transport down, auto off---&gt; DISCONNECTED
 *   CONNECTED    --disconnect-----------------&gt; DISCONNECTED
 *   RECONNECTING --attempt ok-----------------&gt; CONNECTED
 *   RECONNECTING --retries exhausted----------&gt; DISCONNECTED
 *   RECONNECTING --disable / stop / disconnect&gt; DISCONNECTED
 *   RECONNECTING --connect--------------------&gt; CONNECTING
 * </pre>
 *
 * <h2>Cancellation</h2>
 * Each connect attempt carries a generation number and each reconnect loop a
 * loop token. A connect result or tick whose token is no longer current is
 * stale: a stale connection is closed and the result discarded.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   supervisor.start()    → starts the event loop thread
 *   supervisor.connect()  → blocks until CONNECTED or the attempt fails
 *   supervisor.stop()     → stops the event loop thread
 * </pre>
 */
public final class ConnectionSupervisor
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    static final String THREAD_NAME = "guider-connection-supervisor";

    static final String REASON_CLIENT_DISCONNECT = "Disconnected by client";
    static final String REASON_CANCELLED = "Reconnection cancelled";
    static final String REASON_DISABLED = "Auto-reconnect disabled";
    static final String REASON_RECONNECTING = "Reconnecting";

    private final InetSocketAddress remote;
    private final Duration connectionTimeout;
    private final ReconnectPolicy policy;
    private final StreamConnector connector;
    private final RequestCorrelator correlator;
    private final EventBroadcaster broadcaster;
    private final SessionHooks hooks;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final GuiderObservabilitySink observabilitySink;

    private final BlockingQueue<SupervisorCommand> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile Thread eventLoopThread;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean autoReconnect;
    private volatile long latestGeneration;

    // Guarded by stateLock; read by awaitConnected().
    private long reconnectFailures;
    private String lastReconnectFailure;

    // Event-loop thread only.
    private long generation;
    private Attempt attempt;
    private StreamConnection current;
    private long currentGeneration = -1;
    private long loop;
    private int loopAttempt;
    private Cancellable tick;

    public ConnectionSupervisor(InetSocketAddress remote,
                                Duration connectionTimeout,
                                ReconnectPolicy policy,
                                StreamConnector connector,
                                RequestCorrelator correlator,
                                EventBroadcaster broadcaster,
                                SessionHooks hooks,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                WallClock wallClock,
                                GuiderObservabilitySink observabilitySink)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.autoReconnect = policy.enabled();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public void start()
    {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, THREAD_NAME);
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread. Does not disconnect; callers disconnect first.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }

            SupervisorCommand leftover;
            while ((leftover = commands.poll()) != null) {
                abandon(leftover);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Public operations (any thread)
    // -------------------------------------------------------------------------

    /**
     * Open the session, waiting for the outcome.
     *
     * @throws ConnectionFailedException if the attempt fails or is superseded
     */
    public void connect()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        submit(new SupervisorCommand.Connect(done));
        await(done);
    }

    /** Idempotent. Returns once the disconnect has been applied. */
    public void disconnect()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        submit(new SupervisorCommand.Disconnect(done));
        await(done);
    }

    public void stopReconnection()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        submit(new SupervisorCommand.StopReconnection(done));
        await(done);
    }

    public void setAutoReconnectEnabled(boolean enabled)
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        submit(new SupervisorCommand.SetAutoReconnect(enabled, done));
        await(done);
    }

    public boolean isAutoReconnectEnabled()
    {
        return autoReconnect;
    }

    public ConnectionState state()
    {
        return state;
    }

    /**
     * Block until CONNECTED.
     *
     * @throws CallTimeoutException     if {@code timeout} elapses first
     * @throws ReconnectFailedException if a reconnect loop gives up while waiting
     * @throws NotConnectedException    if DISCONNECTED with nothing in progress
     */
    public void awaitConnected(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");

        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            long failuresAtEntry = reconnectFailures;
            while (true) {
                if (state == ConnectionState.CONNECTED) {
                    return;
                }
                if (reconnectFailures != failuresAtEntry) {
                    throw new ReconnectFailedException(lastReconnectFailure);
                }
                if (state == ConnectionState.DISCONNECTED) {
                    throw new NotConnectedException("Not connected and no reconnection in progress");
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new CallTimeoutException(
                            "Not connected after " + timeout.toMillis() + "ms (state " + state + ")");
                }
                TimeUnit.NANOSECONDS.timedWait(stateLock, remaining);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Event loop
    // -------------------------------------------------------------------------

    private void submit(SupervisorCommand command)
    {
        if (!running.get()) {
            abandon(command);
            return;
        }
        commands.offer(command);
    }

    private void await(CompletableFuture<Void> done)
    {
        // A sink or hook calling back in from the loop thread must not wait on itself.
        if (Thread.currentThread() == eventLoopThread) {
            return;
        }
        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the connection supervisor", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CompletionException(cause);
        }
    }

    private void runEventLoop()
    {
        while (running.get()) {
            try {
                SupervisorCommand command = commands.take();
                if (running.get()) {
                    handle(command);
                }
                else {
                    abandon(command);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (Exception e) {
                log.error("Connection supervisor command failed", e);
                observabilitySink.onError(new GuiderErrorEvent(
                        wallClock.now(),
                        "Connection supervisor command failed",
                        e));
            }
        }
    }

    private void handle(SupervisorCommand command)
    {
        if (command instanceof SupervisorCommand.Connect c) {
            onConnect(c.done());
        }
        else if (command instanceof SupervisorCommand.Disconnect d) {
            onDisconnect();
            d.done().complete(null);
        }
        else if (command instanceof SupervisorCommand.StopReconnection s) {
            if (state == ConnectionState.RECONNECTING) {
                endReconnectLoop(REASON_CANCELLED);
            }
            s.done().complete(null);
        }
        else if (command instanceof SupervisorCommand.SetAutoReconnect a) {
            autoReconnect = a.enabled();
            if (!a.enabled() && state == ConnectionState.RECONNECTING) {
                endReconnectLoop(REASON_DISABLED);
            }
            a.done().complete(null);
        }
        else if (command instanceof SupervisorCommand.ConnectAttemptCompleted r) {
            onAttemptCompleted(r.generation(), r.connection(), r.failure());
        }
        else if (command instanceof SupervisorCommand.TransportDown t) {
            onTransportDown(t.generation(), t.cause());
        }
        else if (command instanceof SupervisorCommand.ReconnectTick t) {
            onReconnectTick(t.loop());
        }
    }

    private void abandon(SupervisorCommand command)
    {
        CompletableFuture<Void> done = null;
        if (command instanceof SupervisorCommand.Connect c) {
            c.done().completeExceptionally(new ConnectionFailedException("Client is closed"));
            return;
        }
        else if (command instanceof SupervisorCommand.Disconnect d) {
            done = d.done();
        }
        else if (command instanceof SupervisorCommand.StopReconnection s) {
            done = s.done();
        }
        else if (command instanceof SupervisorCommand.SetAutoReconnect a) {
            autoReconnect = a.enabled();
            done = a.done();
        }
        else if (command instanceof SupervisorCommand.ConnectAttemptCompleted r && r.connection() != null) {
            r.connection().close();
        }
        if (done != null) {
            done.complete(null);
        }
    }

    // -------------------------------------------------------------------------
    // Handlers (event loop thread)
    // -------------------------------------------------------------------------

    private void onConnect(CompletableFuture<Void> done)
    {
        switch (state) {
            case CONNECTED:
                done.complete(null);
                return;
            case CONNECTING:
                attempt.waiters.add(done);
                return;
            case RECONNECTING:
                log.info("Explicit connect requested; abandoning reconnect loop");
                cancelLoop();
                break;
            case DISCONNECTED:
            default:
                break;
        }
        transition(ConnectionState.CONNECTING, "connect requested");
        beginAttempt(false).waiters.add(done);
    }

    private void onDisconnect()
    {
        switch (state) {
            case CONNECTED:
                closeSession(REASON_CLIENT_DISCONNECT);
                broadcaster.publish(new GuiderEvent.ConnectionLost(wallClock.now(), REASON_CLIENT_DISCONNECT));
                transition(ConnectionState.DISCONNECTED, "disconnect requested");
                break;
            case RECONNECTING:
                endReconnectLoop(REASON_CANCELLED);
                break;
            case CONNECTING:
                Attempt a = attempt;
                attempt = null;
                transition(ConnectionState.DISCONNECTED, "disconnect requested");
                a.fail(new ConnectionFailedException("Connection attempt cancelled by disconnect"));
                break;
            case DISCONNECTED:
            default:
                break;
        }
    }

    private void onAttemptCompleted(long gen, StreamConnection connection, Throwable failure)
    {
        Attempt a = attempt;
        if (a == null || a.generation != gen) {
            if (connection != null) {
                log.debug("Discarding stale connection of generation {}", gen);
                connection.close();
            }
            return;
        }
        attempt = null;

        if (failure == null && !connection.isOpen()) {
            failure = new IllegalStateException("Connection closed during handshake");
        }

        if (failure == null) {
            current = connection;
            currentGeneration = gen;
            correlator.attach(connection);
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), TransportObservabilityEvent.Kind.CONNECTED, gen,
                    connection.remoteDescription(), "handshake complete"));

            if (a.reconnect) {
                log.info("Reconnected to guider at {} after {} attempt(s)", describeRemote(), loopAttempt);
                cancelLoop();
                transition(ConnectionState.CONNECTED, "reconnect succeeded");
                broadcaster.publish(new GuiderEvent.Reconnected(wallClock.now()));
            }
            else {
                log.info("Connected to guider at {}", describeRemote());
                transition(ConnectionState.CONNECTED, "handshake complete");
            }
            a.succeed();
            return;
        }

        if (connection != null) {
            connection.close();
        }
        String detail = describe(failure);
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), TransportObservabilityEvent.Kind.CONNECT_FAILED, gen, describeRemote(), detail));

        if (a.reconnect) {
            log.warn("Reconnect attempt {} to {} failed: {}", loopAttempt, describeRemote(), detail);
            if (policy.isExhausted(loopAttempt)) {
                endReconnectLoop("Max retries (" + policy.maxRetries().getAsInt() + ") exceeded");
            }
            else {
                scheduleTick();
            }
        }
        else {
            transition(ConnectionState.DISCONNECTED, "handshake failed");
            a.fail(new ConnectionFailedException(
                    "Failed to connect to " + describeRemote() + ": " + detail, failure));
        }
    }

    private void onTransportDown(long gen, Throwable cause)
    {
        if (current == null || gen != currentGeneration) {
            return;
        }

        String reason = cause == null
                ? "Connection closed by remote"
                : "Connection error: " + describe(cause);
        log.warn("Guider connection lost: {}", reason);

        closeSession(reason);
        broadcaster.publish(new GuiderEvent.ConnectionLost(wallClock.now(), reason));

        if (autoReconnect) {
            loop++;
            loopAttempt = 0;
            transition(ConnectionState.RECONNECTING, "transport down");
            scheduleTick();
        }
        else {
            transition(ConnectionState.DISCONNECTED, "transport down");
        }
    }

    private void onReconnectTick(long tickLoop)
    {
        if (state != ConnectionState.RECONNECTING || tickLoop != loop || attempt != null) {
            return;
        }
        tick = null;
        loopAttempt++;
        broadcaster.publish(new GuiderEvent.Reconnecting(wallClock.now(), loopAttempt, policy.maxRetries()));
        log.info("Reconnect attempt {}{} to {}",
                loopAttempt,
                policy.maxRetries().isPresent() ? "/" + policy.maxRetries().getAsInt() : "",
                describeRemote());
        beginAttempt(true);
    }

    // -------------------------------------------------------------------------
    // Helpers (event loop thread)
    // -------------------------------------------------------------------------

    private Attempt beginAttempt(boolean reconnect)
    {
        long gen = ++generation;
        latestGeneration = gen;
        Attempt a = new Attempt(gen, reconnect);
        attempt = a;

        CompletableFuture<StreamConnection> future;
        try {
            future = connector.connect(remote, connectionTimeout, new GenerationListener(gen));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((connection, failure) ->
                submit(new SupervisorCommand.ConnectAttemptCompleted(gen, connection, unwrap(failure))));
        return a;
    }

    private void closeSession(String reason)
    {
        StreamConnection c = current;
        long closedGeneration = currentGeneration;
        current = null;
        currentGeneration = -1;

        int drained = correlator.detach(reason);
        if (drained > 0) {
            log.info("{} outstanding call(s) failed: {}", drained, reason);
        }
        if (c != null) {
            c.close();
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), TransportObservabilityEvent.Kind.CLOSED, closedGeneration,
                    c.remoteDescription(), reason));
        }
        try {
            hooks.onSessionClosed();
        } catch (RuntimeException e) {
            observabilitySink.onError(new GuiderErrorEvent(wallClock.now(), "Session close hook failed", e));
        }
    }

    private void scheduleTick()
    {
        long tickLoop = loop;
        tick = scheduler.scheduleAfter(policy.retryInterval(), clock,
                () -> submit(new SupervisorCommand.ReconnectTick(tickLoop)));
    }

    /** Leave the reconnect loop without publishing anything. */
    private void cancelLoop()
    {
        Cancellable t = tick;
        tick = null;
        if (t != null) {
            t.cancel();
        }
        if (attempt != null && attempt.reconnect) {
            attempt = null;
        }
        loop++;
        loopAttempt = 0;
    }

    private void endReconnectLoop(String reason)
    {
        log.warn("Reconnection ended: {}", reason);
        cancelLoop();
        synchronized (stateLock) {
            reconnectFailures++;
            lastReconnectFailure = reason;
        }
        transition(ConnectionState.DISCONNECTED, reason);
        broadcaster.publish(new GuiderEvent.ReconnectFailed(wallClock.now(), reason));
    }

    private void transition(ConnectionState next, String trigger)
    {
        ConnectionState previous;
        synchronized (stateLock) {
            previous = state;
            if (previous == next) {
                return;
            }
            state = next;
            stateLock.notifyAll();
        }

        correlator.setOfflineOutcome(next == ConnectionState.RECONNECTING
                ? new RpcOutcome.ConnectionLost(REASON_RECONNECTING)
                : new RpcOutcome.NotConnected());

        observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(
                wallClock.now(), previous, next, trigger));
    }

    private String describeRemote()
    {
        return remote.getHostString() + ":" + remote.getPort();
    }

    private static Throwable unwrap(Throwable failure)
    {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static String describe(Throwable failure)
    {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getSimpleName() : message;
    }

    /**
     * An in-flight connect attempt and the callers waiting on it.
     */
    private static final class Attempt
    {
        final long generation;
        final boolean reconnect;
        final List<CompletableFuture<Void>> waiters = new ArrayList<>();

        Attempt(long generation, boolean reconnect)
        {
            this.generation = generation;
            this.reconnect = reconnect;
        }

        void succeed()
        {
            waiters.forEach(w -> w.complete(null));
        }

        void fail(RuntimeException failure)
        {
            waiters.forEach(w -> w.completeExceptionally(failure));
        }
    }

    /**
     * Transport listener bound to one connection generation. Lines from a
     * superseded generation are dropped.
     */
    private final class GenerationListener implements StreamListener
    {
        private final long gen;

        GenerationListener(long gen)
        {
            this.gen = gen;
        }

        @Override
        public void onMessage(byte[] line)
        {
            if (gen != latestGeneration) {
                return;
            }
            hooks.onLine(line);
        }

        @Override
        public void onFramingError(String detail)
        {
            if (gen == latestGeneration) {
                hooks.onFramingError(detail);
            }
        }

        @Override
        public void onClosed(Throwable cause)
        {
            submit(new SupervisorCommand.TransportDown(gen, cause));
        }
    }
}
