package com.questrail.guider.protocol.phd2.runtime;

import com.questrail.guider.api.GuiderClient;
import com.questrail.guider.protocol.phd2.Phd2GuiderClient;
import com.questrail.guider.protocol.phd2.Phd2Operations;
import com.questrail.guider.protocol.phd2.config.GuiderClientConfig;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicScheduler;
import com.questrail.guider.protocol.phd2.internal.time.ScheduledExecutorScheduler;
import com.questrail.guider.protocol.phd2.internal.time.SystemMonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.SystemWallClock;
import com.questrail.guider.protocol.phd2.observability.ConnectionStateTransitionEvent;
import com.questrail.guider.protocol.phd2.observability.GuiderErrorEvent;
import com.questrail.guider.protocol.phd2.observability.GuiderObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.ProtocolAnomalyEvent;
import com.questrail.guider.protocol.phd2.observability.Slf4jGuiderObservabilitySink;
import com.questrail.guider.protocol.phd2.observability.TransportObservabilityEvent;
import com.questrail.guider.protocol.phd2.process.ExecutableLocator;
import com.questrail.guider.protocol.phd2.process.GuiderProcessManager;
import com.questrail.guider.protocol.phd2.process.JdkProcessSpawner;
import com.questrail.guider.protocol.phd2.process.ProcessSpawner;
import com.questrail.guider.protocol.phd2.transport.tcp.netty.NettyTcpStreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * GuiderClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production guider stack:
 * Netty transport, timer thread, client, and process manager.
 */
public final class GuiderClientRuntime
{
    private static final Logger log = LoggerFactory.getLogger(GuiderClientRuntime.class);

    private final GuiderClientConfig config;
    private final Phd2GuiderClient client;
    private final GuiderProcessManager processManager;
    private final NettyTcpStreamConnector connector;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService callbackExecutor;

    private GuiderClientRuntime(GuiderClientConfig config,
                                Phd2GuiderClient client,
                                GuiderProcessManager processManager,
                                NettyTcpStreamConnector connector,
                                ScheduledExecutorService schedulerExecutor,
                                ExecutorService callbackExecutor)
    {
        this.config = config;
        this.client = client;
        this.processManager = processManager;
        this.connector = connector;
        this.schedulerExecutor = schedulerExecutor;
        this.callbackExecutor = callbackExecutor;
    }

    /**
     * Start the controller process when {@code autoStart} is set, then connect.
     */
    public void start() throws InterruptedException
    {
        if (config.autoStart()) {
            processManager.start();
        }
        client.connect();
    }

    /**
     * Close the client and release transport, timer and callback threads. The
     * controller process is left alone; see {@link #stopGuider()}.
     */
    public void stop()
    {
        client.close();
        connector.shutdown();
        shutdown(schedulerExecutor);
        shutdown(callbackExecutor);
    }

    private static void shutdown(ExecutorService executor)
    {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ask the controller to exit through the client when connected, then kill
     * the process this runtime spawned if it is still there.
     */
    public void stopGuider() throws InterruptedException
    {
        processManager.stop(Optional.of(client));
    }

    public GuiderClient client()
    {
        return client;
    }

    public Phd2Operations operations()
    {
        return new Phd2Operations(client);
    }

    public GuiderProcessManager processManager()
    {
        return processManager;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private GuiderClientConfig config = GuiderClientConfig.defaults();
        private GuiderObservabilitySink observabilitySink = new Slf4jGuiderObservabilitySink();
        private ProcessSpawner processSpawner = new JdkProcessSpawner();
        private ExecutableLocator executableLocator;
        private Consumer<ConnectionStateTransitionEvent> stateCallback;

        public Builder withConfig(GuiderClientConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(GuiderObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withProcessSpawner(ProcessSpawner spawner)
        {
            this.processSpawner = spawner;
            return this;
        }

        public Builder withExecutableLocator(ExecutableLocator locator)
        {
            this.executableLocator = locator;
            return this;
        }

        /** Invoked on every connection state change, after the sink. */
        public Builder withStateCallback(Consumer<ConnectionStateTransitionEvent> callback)
        {
            this.stateCallback = callback;
            return this;
        }

        public GuiderClientRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(processSpawner, "processSpawner");

            // 1. Timing
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "guider-timer");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            ExecutorService callbackExec = Phd2GuiderClient.newCallbackPool();

            // 2. Transport
            NettyTcpStreamConnector connector = new NettyTcpStreamConnector(config.maxFrameLength());

            // 3. Composite sink for the state callback + configured sink
            GuiderObservabilitySink effectiveSink = observabilitySink;
            if (stateCallback != null) {
                GuiderObservabilitySink delegate = observabilitySink;
                Consumer<ConnectionStateTransitionEvent> callback = stateCallback;
                effectiveSink = new GuiderObservabilitySink() {
                    @Override
                    public void onStateTransition(ConnectionStateTransitionEvent event) {
                        delegate.onStateTransition(event);
                        try {
                            callback.accept(event);
                        } catch (RuntimeException e) {
                            log.warn("State callback failed", e);
                        }
                    }

                    @Override public void onProtocolAnomaly(ProtocolAnomalyEvent event) { delegate.onProtocolAnomaly(event); }
                    @Override public void onTransportEvent(TransportObservabilityEvent event) { delegate.onTransportEvent(event); }
                    @Override public void onError(GuiderErrorEvent event) { delegate.onError(event); }
                };
            }

            // 4. Client
            Phd2GuiderClient client = new Phd2GuiderClient(
                    config, connector, scheduler, clock, SystemWallClock.INSTANCE, effectiveSink, callbackExec);

            // 5. Process manager, checking reachability through the same transport
            GuiderProcessManager processManager = new GuiderProcessManager(
                    config,
                    processSpawner,
                    connector,
                    executableLocator != null ? executableLocator : ExecutableLocator.forCurrentPlatform());

            return new GuiderClientRuntime(config, client, processManager, connector, schedulerExec, callbackExec);
        }
    }
}
