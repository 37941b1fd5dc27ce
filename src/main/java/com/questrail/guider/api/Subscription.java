package com.questrail.guider.api;

import java.time.Duration;
import java.util.Optional;

/**
 * Subscription
 * -----------------------------------------------------------------------------
 * Consumer-held handle on the live event stream of a {@link GuiderClient}.
 *
 * <h2>Delivery contract (lossy broadcast)</h2>
 * <ul>
 *   <li>Receives every event published after the subscription was created;
 *       there is no replay of history.</li>
 *   <li>Events arrive in publish order.</li>
 *   <li>Each subscription has a bounded queue. When a consumer falls behind
 *       and the queue is full, the oldest queued event is discarded to make
 *       room and {@link #droppedCount()} is incremented. The publisher never
 *       waits for a consumer.</li>
 *   <li>Subscriptions survive reconnects; events keep flowing across
 *       connection generations.</li>
 * </ul>
 *
 * A subscription that is closed, or simply dropped and garbage collected,
 * has no effect on the publisher.
 */
public interface Subscription extends AutoCloseable
{
    /**
     * Wait for the next event.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if the subscription is closed and drained
     */
    GuiderEvent next() throws InterruptedException;

    /**
     * Wait up to {@code timeout} for the next event.
     */
    Optional<GuiderEvent> poll(Duration timeout) throws InterruptedException;

    /** Take the next event if one is queued, without waiting. */
    Optional<GuiderEvent> tryNext();

    /** Number of events discarded because this consumer fell behind. */
    long droppedCount();

    boolean isClosed();

    /** Stop receiving events. Idempotent. */
    @Override
    void close();
}
