package com.questrail.guider.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Duration;
import java.util.Objects;

/**
 * RpcOutcome
 * -----------------------------------------------------------------------------
 * Typed resolution of one call. Every call issued through
 * {@link GuiderClient#call} resolves to exactly one of these, exactly once.
 *
 * <ul>
 *   <li>{@link Success}: the controller returned a result</li>
 *   <li>{@link RpcFailure}: the controller returned an error object</li>
 *   <li>{@link Timeout}: the local deadline expired first</li>
 *   <li>{@link ConnectionLost}: the session ended while the call was outstanding,
 *       or a reconnect was in progress when it was issued</li>
 *   <li>{@link NotConnected}: there was no session and no reconnect in progress</li>
 * </ul>
 */
public sealed interface RpcOutcome
        permits RpcOutcome.Success,
                RpcOutcome.RpcFailure,
                RpcOutcome.Timeout,
                RpcOutcome.ConnectionLost,
                RpcOutcome.NotConnected
{
    record Success(JsonNode result) implements RpcOutcome
    {
        public Success {
            result = result == null ? NullNode.getInstance() : result;
        }
    }

    record RpcFailure(int code, String message) implements RpcOutcome
    {
        public RpcFailure {
            Objects.requireNonNull(message, "message");
        }
    }

    record Timeout(String method, Duration timeout) implements RpcOutcome
    {
        public Timeout {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(timeout, "timeout");
        }
    }

    record ConnectionLost(String reason) implements RpcOutcome
    {
        public ConnectionLost {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record NotConnected() implements RpcOutcome {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Unwrap the result, translating every other outcome into the matching
     * {@link GuiderException}.
     */
    default JsonNode orThrow() {
        if (this instanceof Success s) {
            return s.result();
        }
        else if (this instanceof RpcFailure f) {
            throw new RpcFailureException(f.code(), f.message());
        }
        else if (this instanceof Timeout t) {
            throw new CallTimeoutException(
                    "Request '" + t.method() + "' timed out after " + t.timeout().toMillis() + "ms");
        }
        else if (this instanceof ConnectionLost c) {
            throw new ConnectionLostException(c.reason());
        }
        throw new NotConnectedException();
    }
}
