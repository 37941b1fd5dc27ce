package com.questrail.guider.protocol.phd2.internal.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.guider.api.RpcOutcome;
import com.questrail.guider.protocol.phd2.codec.JsonRpcCodec;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicClock;
import com.questrail.guider.protocol.phd2.internal.time.MonotonicScheduler;
import com.questrail.guider.protocol.phd2.model.RpcCall;
import com.questrail.guider.protocol.phd2.model.RpcResponse;
import com.questrail.guider.protocol.phd2.transport.StreamConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RequestCorrelator
 * =============================================================================
 * Matches responses to calls over one multiplexed connection and guarantees
 * every call resolves exactly once.
 *
 * <h2>Resolution rule</h2>
 * A call is resolved by whichever party first removes it from the pending
 * table: the response path, its deadline, a write failure, or a detach. The
 * losers find nothing to remove and do nothing. No other bookkeeping decides
 * ownership.
 *
 * <h2>Identifiers</h2>
 * Allocated from a single counter starting at 1 and never reset, so an id is
 * unique across every connection generation of the owning client. A response
 * from an earlier generation can therefore never complete a newer call.
 *
 * <h2>Attachment</h2>
 * The connection supervisor attaches the live connection after a successful
 * handshake and detaches it when the session ends. While detached, calls
 * resolve immediately with the configured offline outcome.
 *
 * <h2>Completion</h2>
 * Futures are completed on the completion executor, never on the I/O or
 * timer thread that resolved them, so a continuation may block on another
 * call. The three-argument constructor completes on the resolving thread.
 */
public final class RequestCorrelator
{
    private static final Logger log = LoggerFactory.getLogger(RequestCorrelator.class);

    private final JsonRpcCodec codec;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Executor completion;

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, PendingCall> pending = new ConcurrentHashMap<>();

    private volatile StreamConnection connection;
    private volatile String lastDetachReason = "Not connected";
    private volatile RpcOutcome offlineOutcome = new RpcOutcome.NotConnected();

    public RequestCorrelator(JsonRpcCodec codec, MonotonicScheduler scheduler, MonotonicClock clock)
    {
        this(codec, scheduler, clock, Runnable::run);
    }

    public RequestCorrelator(JsonRpcCodec codec, MonotonicScheduler scheduler, MonotonicClock clock,
                             Executor completion)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.completion = Objects.requireNonNull(completion, "completion");
    }

    /**
     * Issue a call. The returned future always completes normally.
     *
     * @throws IllegalArgumentException if {@code method} is blank, {@code params}
     *         is neither object nor array, or {@code timeout} is not positive
     */
    public CompletableFuture<RpcOutcome> callAsync(String method, JsonNode params, Duration timeout)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        StreamConnection conn = connection;
        if (conn == null) {
            return CompletableFuture.completedFuture(offlineOutcome);
        }

        long id = nextId.getAndIncrement();
        byte[] line = codec.encodeCall(new RpcCall(id, method, params));

        PendingCall call = new PendingCall(id, method, timeout);
        pending.put(id, call);
        call.armDeadline(scheduler.scheduleAfter(timeout, clock,
                () -> resolve(id, new RpcOutcome.Timeout(method, timeout))));

        // Detached between the read above and registration: the drain may have missed us.
        if (connection != conn) {
            resolve(id, new RpcOutcome.ConnectionLost(lastDetachReason));
            return call.slot();
        }

        conn.send(line).whenComplete((ignored, failure) -> {
            if (failure != null) {
                log.debug("Write of call {} ({}) failed", id, method, failure);
                resolve(id, new RpcOutcome.ConnectionLost("Write failed: " + describe(failure)));
                conn.close();
            }
        });
        return call.slot();
    }

    /**
     * Complete the call a response belongs to.
     *
     * @return {@code false} if no call with that id is outstanding any more
     */
    public boolean complete(RpcResponse response)
    {
        Objects.requireNonNull(response, "response");

        RpcOutcome outcome = response.errorObject()
                .<RpcOutcome>map(e -> new RpcOutcome.RpcFailure(e.code(), e.message()))
                .orElseGet(() -> new RpcOutcome.Success(response.result()));
        return resolve(response.id(), outcome);
    }

    public boolean isOutstanding(long id)
    {
        return pending.containsKey(id);
    }

    public int outstandingCount()
    {
        return pending.size();
    }

    /**
     * Route subsequent calls to {@code connection}.
     */
    public void attach(StreamConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * Stop routing calls and resolve every outstanding call with
     * {@code ConnectionLost(reason)}.
     *
     * @return number of calls drained
     */
    public int detach(String reason)
    {
        Objects.requireNonNull(reason, "reason");
        lastDetachReason = reason;
        connection = null;
        return failAll(reason);
    }

    /**
     * Outcome returned to calls issued while no connection is attached.
     */
    public void setOfflineOutcome(RpcOutcome outcome)
    {
        this.offlineOutcome = Objects.requireNonNull(outcome, "outcome");
    }

    /**
     * Resolve every outstanding call with {@code ConnectionLost(reason)}.
     */
    public int failAll(String reason)
    {
        List<Long> ids = new ArrayList<>(pending.keySet());
        int drained = 0;
        for (Long id : ids) {
            if (resolve(id, new RpcOutcome.ConnectionLost(reason))) {
                drained++;
            }
        }
        if (drained > 0) {
            log.debug("Resolved {} outstanding call(s) with ConnectionLost: {}", drained, reason);
        }
        return drained;
    }

    private boolean resolve(long id, RpcOutcome outcome)
    {
        PendingCall call = pending.remove(id);
        if (call == null) {
            return false;
        }
        if (outcome instanceof RpcOutcome.Timeout) {
            log.debug("Call {} ({}) timed out after {} ms", id, call.method(), call.timeout().toMillis());
        }
        call.resolve(outcome, completion);
        return true;
    }

    private static String describe(Throwable failure)
    {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getSimpleName() : message;
    }
}
