package com.questrail.guider.protocol.phd2.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a call deadline or a pending reconnect tick.
 *
 * <p>Both the request correlator and the connection supervisor hold one of
 * these for every piece of timed work they arm, so that resolving a call or
 * leaving the reconnect loop can withdraw the timer it no longer needs.</p>
 */
public interface Cancellable
{
    /**
     * Withdraw the scheduled task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was withdrawn earlier.
     */
    boolean cancel();
}
