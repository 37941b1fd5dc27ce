package com.questrail.guider.protocol.phd2.internal.session;

import com.questrail.guider.protocol.phd2.transport.StreamConnection;

import java.util.concurrent.CompletableFuture;

/**
 * Commands consumed by the {@link ConnectionSupervisor} event loop.
 *
 * <p>Caller-originated commands carry a {@code done} future the caller may
 * wait on. Transport and timer commands carry the generation or loop token
 * they were issued for; a mismatch means the command is stale and it is
 * ignored.</p>
 */
sealed interface SupervisorCommand
        permits SupervisorCommand.Connect,
                SupervisorCommand.Disconnect,
                SupervisorCommand.StopReconnection,
                SupervisorCommand.SetAutoReconnect,
                SupervisorCommand.ConnectAttemptCompleted,
                SupervisorCommand.TransportDown,
                SupervisorCommand.ReconnectTick
{
    record Connect(CompletableFuture<Void> done) implements SupervisorCommand {}

    record Disconnect(CompletableFuture<Void> done) implements SupervisorCommand {}

    record StopReconnection(CompletableFuture<Void> done) implements SupervisorCommand {}

    record SetAutoReconnect(boolean enabled, CompletableFuture<Void> done) implements SupervisorCommand {}

    /** Exactly one of {@code connection} and {@code failure} is non-null. */
    record ConnectAttemptCompleted(long generation, StreamConnection connection, Throwable failure)
            implements SupervisorCommand {}

    record TransportDown(long generation, Throwable cause) implements SupervisorCommand {}

    record ReconnectTick(long loop) implements SupervisorCommand {}
}
