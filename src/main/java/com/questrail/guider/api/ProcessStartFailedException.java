package com.questrail.guider.api;

/**
 * The controller process could not be spawned, or exited before its endpoint
 * became reachable.
 */
public final class ProcessStartFailedException extends GuiderException
{
    public ProcessStartFailedException(String message) {
        super(message);
    }

    public ProcessStartFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
