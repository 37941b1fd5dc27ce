package com.questrail.guider.protocol.phd2.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for call deadlines and reconnect spacing.
 *
 * <h2>Binding invariant</h2>
 * Every timing decision in the session runtime (call timeouts, retry
 * intervals, reachability polling) is taken against this clock. Wall-clock
 * time is used only to stamp events for observers.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
