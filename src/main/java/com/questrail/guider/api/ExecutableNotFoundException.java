package com.questrail.guider.api;

/**
 * Neither the configured executable override nor any platform default
 * location holds a controller executable.
 */
public final class ExecutableNotFoundException extends GuiderException
{
    public ExecutableNotFoundException(String message) {
        super("Guider executable not found: " + message);
    }
}
