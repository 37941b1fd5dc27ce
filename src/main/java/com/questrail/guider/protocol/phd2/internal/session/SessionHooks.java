package com.questrail.guider.protocol.phd2.internal.session;

/**
 * Callbacks from the {@link ConnectionSupervisor} to the layer that
 * interprets traffic.
 *
 * <p>{@link #onLine} and {@link #onFramingError} run on the transport thread
 * of the live connection. {@link #onSessionClosed} runs on the supervisor
 * thread, before the loss is published.</p>
 */
public interface SessionHooks
{
    /** One inbound line of the current connection generation. */
    void onLine(byte[] line);

    void onFramingError(String detail);

    /** The live session ended; per-session caches must be cleared. */
    void onSessionClosed();
}
