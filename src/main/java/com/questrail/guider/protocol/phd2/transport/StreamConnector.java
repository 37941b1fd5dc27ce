package com.questrail.guider.protocol.phd2.transport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * StreamConnector
 * -----------------------------------------------------------------------------
 * Opens line-framed stream connections to the controller.
 *
 * <p>Each successful {@link #connect} yields a new, independent
 * {@link StreamConnection}; the connector keeps no notion of a "current"
 * connection. Generations, reconnects and cancellation are the session
 * layer's business.</p>
 */
public interface StreamConnector
{
    /**
     * Open a connection.
     *
     * <p>The returned future completes with the open connection, or
     * exceptionally if the remote cannot be reached within {@code timeout}.
     * Inbound lines may be delivered to {@code listener} as soon as the
     * future completes.</p>
     *
     * @param remote   controller endpoint
     * @param timeout  connect timeout
     * @param listener receives inbound lines and the single close notification
     */
    CompletableFuture<StreamConnection> connect(InetSocketAddress remote, Duration timeout, StreamListener listener);

    /**
     * Check whether something accepts connections at {@code remote}. Any
     * connection opened for the check is closed before returning.
     *
     * <p>Blocks for at most {@code timeout}.</p>
     */
    boolean canConnect(InetSocketAddress remote, Duration timeout);
}
