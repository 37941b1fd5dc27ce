package com.questrail.guider.api;

/**
 * {@code start()} was called while a managed process handle already exists.
 */
public final class ProcessAlreadyRunningException extends GuiderException
{
    public ProcessAlreadyRunningException() {
        super("Process already running");
    }
}
