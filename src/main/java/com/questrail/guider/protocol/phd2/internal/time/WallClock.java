package com.questrail.guider.protocol.phd2.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the timestamps carried by {@code GuiderEvent}s and observability
 * records. Never consulted for timeouts or retry spacing.
 */
public interface WallClock
{
    Instant now();
}
