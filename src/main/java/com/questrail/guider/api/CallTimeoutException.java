package com.questrail.guider.api;

/**
 * A local deadline expired: a call got no response in time, or the controller
 * did not become reachable (or did not exit) within the allowed window.
 */
public final class CallTimeoutException extends GuiderException
{
    public CallTimeoutException(String message) {
        super(message);
    }
}
