package com.questrail.guider.protocol.phd2.transport;

import java.util.concurrent.CompletableFuture;

/**
 * One open stream connection.
 *
 * <p>Writes are serialized by the implementation: lines handed to
 * {@link #send(byte[])} reach the wire whole and in call order, whichever
 * thread calls it.</p>
 */
public interface StreamConnection
{
    /**
     * Write one complete line.
     *
     * @param line encoded message, terminator included
     * @return completes when the line is flushed, exceptionally on write failure
     */
    CompletableFuture<Void> send(byte[] line);

    /**
     * Close the connection. The listener's {@link StreamListener#onClosed}
     * fires once, if it has not already. Idempotent.
     */
    void close();

    boolean isOpen();

    /** Human-readable remote endpoint, for diagnostics. */
    String remoteDescription();
}
