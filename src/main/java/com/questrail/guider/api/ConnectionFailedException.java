package com.questrail.guider.api;

/**
 * The transport could not be opened or the connect handshake did not complete.
 */
public final class ConnectionFailedException extends GuiderException
{
    public ConnectionFailedException(String message) {
        super(message);
    }

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
