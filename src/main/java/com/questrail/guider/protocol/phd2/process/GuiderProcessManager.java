package com.questrail.guider.protocol.phd2.process;

import com.questrail.guider.api.CallTimeoutException;
import com.questrail.guider.api.ExecutableNotFoundException;
import com.questrail.guider.api.GuiderClient;
import com.questrail.guider.api.GuiderException;
import com.questrail.guider.api.ProcessAlreadyRunningException;
import com.questrail.guider.api.ProcessStartFailedException;
import com.questrail.guider.protocol.phd2.Phd2Operations;
import com.questrail.guider.protocol.phd2.config.GuiderClientConfig;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.SystemMonotonicClock;
import com.questrail.guider.protocol.phd2.transport.StreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * GuiderProcessManager
 * =============================================================================
 * Starts, checks reachability of and stops the external controller process.
 *
 * <h2>Start</h2>
 * <ol>
 *   <li>If the controller endpoint already accepts connections, nothing is
 *       spawned.</li>
 *   <li>A second start while a managed process exists is refused.</li>
 *   <li>The executable is the configured override (which must exist) or the
 *       first platform default found by {@link ExecutableLocator}.</li>
 *   <li>After spawning, the endpoint is polled until it accepts connections,
 *       the process exits, or the connection timeout elapses.</li>
 * </ol>
 *
 * <h2>Stop</h2>
 * Graceful first when a connected client is supplied ({@code shutdown} call,
 * then up to {@link #EXIT_TIMEOUT} for the process to exit); forced
 * termination otherwise or when the graceful path fails.
 */
public final class GuiderProcessManager
{
    private static final Logger log = LoggerFactory.getLogger(GuiderProcessManager.class);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(500);
    public static final Duration EXIT_TIMEOUT = Duration.ofSeconds(10);

    private final GuiderClientConfig config;
    private final ProcessSpawner spawner;
    private final StreamConnector reachability;
    private final ExecutableLocator locator;
    private final MonotonicClock clock;
    private final Duration pollInterval;
    private final Duration exitTimeout;

    private final Object lock = new Object();
    private ManagedProcess process;

    public GuiderProcessManager(GuiderClientConfig config,
                                ProcessSpawner spawner,
                                StreamConnector reachability,
                                ExecutableLocator locator)
    {
        this(config, spawner, reachability, locator, SystemMonotonicClock.INSTANCE, POLL_INTERVAL, EXIT_TIMEOUT);
    }

    GuiderProcessManager(GuiderClientConfig config,
                         ProcessSpawner spawner,
                         StreamConnector reachability,
                         ExecutableLocator locator,
                         MonotonicClock clock,
                         Duration pollInterval,
                         Duration exitTimeout)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.reachability = Objects.requireNonNull(reachability, "reachability");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.exitTimeout = Objects.requireNonNull(exitTimeout, "exitTimeout");
    }

    /**
     * Make sure a controller is accepting connections, spawning one if needed.
     *
     * @throws ProcessAlreadyRunningException if this manager already owns a process
     * @throws ExecutableNotFoundException    if no executable can be found
     * @throws ProcessStartFailedException    if spawning fails or the process exits early
     * @throws CallTimeoutException           if the endpoint is not reachable in time
     */
    public void start() throws InterruptedException
    {
        if (isReachable()) {
            log.debug("Guider controller already reachable at {}:{}", config.host(), config.port());
            return;
        }

        Path executable;
        ManagedProcess spawned;
        synchronized (lock) {
            if (process != null) {
                throw new ProcessAlreadyRunningException();
            }
            executable = resolveExecutable();
            log.info("Starting guider controller from {}", executable);
            spawned = spawner.spawn(executable, config.spawnEnvironment());
            process = spawned;
        }

        waitUntilReachable(config.connectionTimeout());
        log.info("Guider controller (pid {}) is accepting connections", spawned.pid());
    }

    /**
     * Poll the endpoint until it accepts connections.
     *
     * @throws ProcessStartFailedException if the managed process exits while waiting
     * @throws CallTimeoutException        if {@code timeout} elapses first
     */
    public void waitUntilReachable(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");

        long deadline = clock.nowNanos() + timeout.toNanos();
        while (clock.nowNanos() < deadline) {
            if (isReachable()) {
                return;
            }

            ManagedProcess p = managedProcess();
            if (p != null && !p.isAlive()) {
                OptionalInt code = p.exitCode();
                synchronized (lock) {
                    if (process == p) {
                        process = null;
                    }
                }
                throw new ProcessStartFailedException("Guider process exited prematurely with status "
                        + (code.isPresent() ? code.getAsInt() : "unknown"));
            }

            Thread.sleep(pollInterval.toMillis());
        }
        throw new CallTimeoutException("Guider did not become reachable within " + timeout.toMillis() + "ms");
    }

    /**
     * Stop the managed process. A no-op if this manager owns none.
     *
     * @param client a client connected to the controller, for a graceful shutdown
     */
    public void stop(Optional<GuiderClient> client) throws InterruptedException
    {
        Objects.requireNonNull(client, "client");

        if (client.isPresent() && client.get().isConnected()) {
            try {
                log.debug("Requesting graceful guider shutdown");
                new Phd2Operations(client.get()).shutdown(exitTimeout);
                if (waitForExit()) {
                    log.info("Guider controller exited after shutdown request");
                    return;
                }
                log.warn("Guider controller did not exit within {} ms; forcing", exitTimeout.toMillis());
            } catch (GuiderException e) {
                log.warn("Graceful guider shutdown failed, forcing: {}", e.getMessage());
            }
        }
        kill();
    }

    /** Managed process alive, or something accepting connections at the endpoint. */
    public boolean isRunning()
    {
        ManagedProcess p = managedProcess();
        return (p != null && p.isAlive()) || isReachable();
    }

    public boolean hasManagedProcess()
    {
        return managedProcess() != null;
    }

    private boolean waitForExit() throws InterruptedException
    {
        long deadline = clock.nowNanos() + exitTimeout.toNanos();
        while (clock.nowNanos() < deadline) {
            synchronized (lock) {
                if (process == null) {
                    return true;
                }
                if (!process.isAlive()) {
                    process = null;
                    return true;
                }
            }
            Thread.sleep(pollInterval.toMillis());
        }
        return false;
    }

    private void kill() throws InterruptedException
    {
        ManagedProcess p;
        synchronized (lock) {
            p = process;
            process = null;
        }
        if (p == null) {
            return;
        }
        log.info("Killing guider controller (pid {})", p.pid());
        p.destroyForcibly();
        if (!p.waitFor(exitTimeout)) {
            log.warn("Guider controller (pid {}) still running after forced kill", p.pid());
        }
    }

    private Path resolveExecutable()
    {
        Optional<Path> override = config.executablePath();
        if (override.isPresent()) {
            if (Files.exists(override.get())) {
                return override.get();
            }
            throw new ExecutableNotFoundException(override.get().toString());
        }
        return locator.locate().orElseThrow(() ->
                new ExecutableNotFoundException("no executable at " + locator.defaultLocations()
                        + " or on PATH"));
    }

    private boolean isReachable()
    {
        return reachability.canConnect(InetSocketAddress.createUnresolved(config.host(), config.port()),
                Duration.ofSeconds(1));
    }

    private ManagedProcess managedProcess()
    {
        synchronized (lock) {
            return process;
        }
    }
}
