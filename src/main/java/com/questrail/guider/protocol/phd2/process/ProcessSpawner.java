package com.questrail.guider.protocol.phd2.process;

import java.nio.file.Path;
import java.util.Map;

/**
 * Starts controller processes. Stdio of the child is discarded.
 */
public interface ProcessSpawner
{
    /**
     * @param executable  controller binary
     * @param environment variables added to the inherited environment
     * @throws com.questrail.guider.api.ProcessStartFailedException if the OS refuses to start it
     */
    ManagedProcess spawn(Path executable, Map<String, String> environment);
}
