package com.questrail.guider.protocol.phd2.transport;

/**
 * StreamListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link StreamConnection}.
 *
 * <p>Callbacks for a given connection are delivered serially, in wire order,
 * on a transport thread. They must not block.</p>
 */
public interface StreamListener
{
    /**
     * A complete line arrived.
     *
     * @param line raw bytes, terminator stripped; never retained by the transport
     */
    void onMessage(byte[] line);

    /**
     * An inbound line exceeded the frame limit and was discarded. The
     * connection stays open.
     */
    void onFramingError(String detail);

    /**
     * The connection closed. Delivered exactly once per connection.
     *
     * @param cause I/O failure, or {@code null} for an orderly close by either side
     */
    void onClosed(Throwable cause);
}
