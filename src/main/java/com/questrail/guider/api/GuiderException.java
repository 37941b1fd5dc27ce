package com.questrail.guider.api;

/**
 * Root of the error taxonomy exposed by the guider session runtime.
 *
 * <p>Transport-level failures never reach callers as raw {@code IOException}s;
 * they are translated into {@link ConnectionLostException} or
 * {@link NotConnectedException} at the request-correlation boundary.</p>
 */
public class GuiderException extends RuntimeException
{
    public GuiderException(String message) {
        super(message);
    }

    public GuiderException(String message, Throwable cause) {
        super(message, cause);
    }
}
