package com.questrail.guider.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * GuiderClient
 * -----------------------------------------------------------------------------
 * {@code GuiderClient} is the façade over one long-lived session with an
 * external autoguiding controller.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>A single call entry point: every remote operation is a method name
 *       plus JSON parameters, resolved to a typed {@link RpcOutcome}</li>
 *   <li>A live, lossy event stream via {@link #subscribe()}</li>
 *   <li>Session lifecycle: connect, disconnect, and bounded automatic
 *       reconnection governed by a reconnect policy</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>The meaning of any remote operation (guiding, calibration, ...)</li>
 *   <li>Starting or stopping the controller process (see
 *       {@code GuiderProcessManager})</li>
 *   <li>Persisting anything across process restarts</li>
 * </ul>
 *
 * <h2>Resolution guarantees</h2>
 * A call never hangs past its timeout and is never silently lost: on
 * disconnect every outstanding call resolves immediately with
 * {@link RpcOutcome.ConnectionLost}. Transport failures are never surfaced as
 * raw I/O exceptions.
 *
 * <h2>Thread Safety</h2>
 * Implementations must be safe for concurrent use by any number of callers and
 * subscribers.
 */
public interface GuiderClient extends AutoCloseable
{
    /**
     * Issue a call and wait for its resolution.
     *
     * @param method  remote method name
     * @param params  JSON object or array, or {@code null} for no parameters
     * @param timeout local deadline for the response
     */
    RpcOutcome call(String method, JsonNode params, Duration timeout);

    /** Issue a call with the configured default call timeout. */
    RpcOutcome call(String method, JsonNode params);

    /**
     * Issue a call without blocking. The returned future always completes
     * normally with an {@link RpcOutcome}, off the I/O thread, so dependent
     * stages may block on further calls.
     */
    CompletableFuture<RpcOutcome> callAsync(String method, JsonNode params, Duration timeout);

    /**
     * Issue a call with the default timeout and unwrap its result.
     *
     * @throws GuiderException the subtype matching a non-success outcome
     */
    default JsonNode invoke(String method, JsonNode params) {
        return call(method, params).orThrow();
    }

    /** Open a new subscription on the live event stream. */
    Subscription subscribe();

    /**
     * Open the session. No-op if already connected. Cancels a running
     * reconnect loop and connects immediately.
     *
     * @throws ConnectionFailedException if the handshake fails
     */
    void connect();

    /**
     * Close the session from any state. Cancels any reconnect loop, resolves
     * outstanding calls with {@code ConnectionLost}. Idempotent.
     */
    void disconnect();

    ConnectionState connectionState();

    default boolean isConnected() {
        return connectionState() == ConnectionState.CONNECTED;
    }

    default boolean isReconnecting() {
        return connectionState() == ConnectionState.RECONNECTING;
    }

    /**
     * Toggle automatic reconnection. Disabling it while a reconnect loop runs
     * ends the loop with a {@code ReconnectFailed} event.
     */
    void setAutoReconnectEnabled(boolean enabled);

    boolean isAutoReconnectEnabled();

    /**
     * Cancel a running reconnect loop without disabling future automatic
     * reconnection. No-op unless currently reconnecting.
     */
    void stopReconnection();

    /**
     * Block until the session is connected.
     *
     * @throws CallTimeoutException      if {@code timeout} elapses first
     * @throws ReconnectFailedException  if the reconnect loop gives up while waiting
     * @throws NotConnectedException     if the client is disconnected with no loop running
     */
    void awaitConnected(Duration timeout) throws InterruptedException;

    /** Controller version announced by the greeting of the current session. */
    Optional<String> controllerVersion();

    /** Disconnect and release any resources owned by this client. */
    @Override
    void close();
}
