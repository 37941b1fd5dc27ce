package com.questrail.guider.protocol.phd2.internal.rpc;

import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.protocol.phd2.internal.time.Cancellable;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * One outstanding call, owned by {@link RequestCorrelator} from the moment it
 * is registered until it is removed from the pending table.
 *
 * <p>Only the thread that removed the entry may call {@link #resolve}.</p>
 */
final class PendingCall
{
    private final long id;
    private final String method;
    private final Duration timeout;
    private final CompletableFuture<RpcOutcome> slot = new CompletableFuture<>();

    private volatile Cancellable deadline;
    private volatile boolean resolved;

    PendingCall(long id, String method, Duration timeout)
    {
        this.id = id;
        this.method = method;
        this.timeout = timeout;
    }

    long id()
    {
        return id;
    }

    String method()
    {
        return method;
    }

    Duration timeout()
    {
        return timeout;
    }

    CompletableFuture<RpcOutcome> slot()
    {
        return slot;
    }

    void armDeadline(Cancellable deadline)
    {
        this.deadline = deadline;
        // Resolved before the deadline was armed.
        if (resolved) {
            deadline.cancel();
        }
    }

    /**
     * Cancel the deadline and hand the outcome to {@code completion}, which
     * runs the caller's continuations. Completes inline once that executor has
     * been shut down.
     */
    void resolve(RpcOutcome outcome, Executor completion)
    {
        resolved = true;
        Cancellable d = deadline;
        if (d != null) {
            d.cancel();
        }
        try {
            completion.execute(() -> slot.complete(outcome));
        } catch (RejectedExecutionException e) {
            slot.complete(outcome);
        }
    }
}
