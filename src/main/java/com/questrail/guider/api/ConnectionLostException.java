package com.questrail.guider.api;

/**
 * The session ended while a call was outstanding.
 */
public final class ConnectionLostException extends GuiderException
{
    public ConnectionLostException(String reason) {
        super("Connection lost: " + reason);
    }
}
