package com.questrail.guider.protocol.phd2.process;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle on a controller process started by a {@link ProcessSpawner}.
 */
public interface ManagedProcess
{
    long pid();

    boolean isAlive();

    /** Exit code once the process has terminated. */
    OptionalInt exitCode();

    /** Kill without giving the process a chance to clean up. */
    void destroyForcibly();

    /**
     * Wait for termination.
     *
     * @return {@code true} if the process has exited
     */
    boolean waitFor(Duration timeout) throws InterruptedException;
}
