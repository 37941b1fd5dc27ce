package com.questrail.guider.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle state of the single session a {@link GuiderClient} maintains with
 * the guiding controller.
 *
 * <p>Exactly one value holds at any instant. The state is written only by the
 * connection supervisor; every other component (and every caller) observes
 * it.</p>
 *
 * <h2>Transitions</h2>
 * <pre>
 *   DISCONNECTED --connect()------------&gt; CONNECTING
 *   CONNECTING   --handshake ok---------&gt; CONNECTED
 *   CONNECTING   --handshake fails------&gt; DISCONNECTED
 *   CONNECTED    --I/O failure----------&gt; RECONNECTING (auto-reconnect on)
 *                                         DISCONNECTED (auto-reconnect off)
 *   RECONNECTING --attempt succeeds-----&gt; CONNECTED
 *   RECONNECTING --retries exhausted,
 *                  disabled or cancelled&gt; DISCONNECTED
 *   any          --disconnect()---------&gt; DISCONNECTED
 * </pre>
 *
 * No state is terminal; the machine may be re-entered indefinitely.
 */
public enum ConnectionState
{
    /** No transport is open and no reconnect loop is running. */
    DISCONNECTED,

    /** A caller-initiated connect is opening the transport. */
    CONNECTING,

    /** The transport is open; calls may be issued. */
    CONNECTED,

    /**
     * The session was lost and the bounded reconnect loop is running.
     * Calls issued in this state resolve with {@code ConnectionLost}.
     */
    RECONNECTING
}
