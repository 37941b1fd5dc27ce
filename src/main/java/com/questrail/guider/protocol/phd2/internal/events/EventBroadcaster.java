package com.questrail.guider.protocol.phd2.internal.events;

import com.questrail.guider.api.GuiderEvent;
import com.questrail.guider.api.Subscription;

import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * EventBroadcaster
 * =============================================================================
 * Lossy fan-out of {@link GuiderEvent}s to any number of subscribers.
 *
 * <h2>Delivery contract</h2>
 * <ul>
 *   <li>Each subscriber owns a queue bounded at {@code capacity}.</li>
 *   <li>On overflow the oldest queued event is dropped and counted.</li>
 *   <li>{@link #publish(GuiderEvent)} never blocks on a consumer.</li>
 * </ul>
 *
 * <p>Subscriptions are referenced weakly. A subscription that is closed or
 * no longer reachable from its consumer is pruned on the next publish.</p>
 */
public final class EventBroadcaster
{
    private final int capacity;
    private final CopyOnWriteArrayList<WeakReference<QueueSubscription>> subscribers = new CopyOnWriteArrayList<>();

    public EventBroadcaster(int capacity)
    {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public Subscription subscribe()
    {
        QueueSubscription s = new QueueSubscription(capacity);
        subscribers.add(new WeakReference<>(s));
        return s;
    }

    /**
     * Deliver {@code event} to every live subscription.
     */
    public void publish(GuiderEvent event)
    {
        Objects.requireNonNull(event, "event");

        boolean prune = false;
        for (WeakReference<QueueSubscription> ref : subscribers) {
            QueueSubscription s = ref.get();
            if (s == null || s.isClosed()) {
                prune = true;
                continue;
            }
            s.offer(event);
        }
        if (prune) {
            subscribers.removeIf(ref -> {
                QueueSubscription s = ref.get();
                return s == null || s.isClosed();
            });
        }
    }

    /** Number of subscriptions not yet pruned. */
    public int subscriberCount()
    {
        return subscribers.size();
    }

    /**
     * Close every subscription, waking any consumer blocked in {@code next()}.
     */
    public void closeAll()
    {
        for (WeakReference<QueueSubscription> ref : subscribers) {
            QueueSubscription s = ref.get();
            if (s != null) {
                s.close();
            }
        }
        subscribers.clear();
    }

    private static final class QueueSubscription implements Subscription
    {
        private final int capacity;
        private final ArrayDeque<GuiderEvent> queue;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition notEmpty = lock.newCondition();

        private long dropped;
        private volatile boolean closed;

        QueueSubscription(int capacity)
        {
            this.capacity = capacity;
            this.queue = new ArrayDeque<>(Math.min(capacity, 64));
        }

        void offer(GuiderEvent event)
        {
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                if (queue.size() >= capacity) {
                    queue.pollFirst();
                    dropped++;
                }
                queue.addLast(event);
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public GuiderEvent next() throws InterruptedException
        {
            lock.lockInterruptibly();
            try {
                while (queue.isEmpty()) {
                    if (closed) {
                        throw new IllegalStateException("Subscription is closed");
                    }
                    notEmpty.await();
                }
                return queue.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public Optional<GuiderEvent> poll(Duration timeout) throws InterruptedException
        {
            Objects.requireNonNull(timeout, "timeout");

            long remaining = timeout.toNanos();
            lock.lockInterruptibly();
            try {
                while (queue.isEmpty()) {
                    if (closed || remaining <= 0) {
                        return Optional.empty();
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
                return Optional.of(queue.pollFirst());
            } finally {
                lock.unlock();
            }
        }

        @Override
        public Optional<GuiderEvent> tryNext()
        {
            lock.lock();
            try {
                return Optional.ofNullable(queue.pollFirst());
            } finally {
                lock.unlock();
            }
        }

        @Override
        public long droppedCount()
        {
            lock.lock();
            try {
                return dropped;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isClosed()
        {
            return closed;
        }

        @Override
        public void close()
        {
            lock.lock();
            try {
                closed = true;
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
