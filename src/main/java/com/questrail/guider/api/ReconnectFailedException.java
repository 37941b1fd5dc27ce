package com.questrail.guider.api;

/**
 * Automatic reconnection gave up: retries were exhausted, auto-reconnect was
 * disabled, or the loop was cancelled.
 */
public final class ReconnectFailedException extends GuiderException
{
    public ReconnectFailedException(String reason) {
        super("Reconnection failed: " + reason);
    }
}
