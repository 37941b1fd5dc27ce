package com.questrail.guider.api;

/**
 * A call was attempted with no live session and no reconnect in progress.
 */
public final class NotConnectedException extends GuiderException
{
    public NotConnectedException() {
        super("Not connected to the guider");
    }

    public NotConnectedException(String message) {
        super(message);
    }
}
