package com.questrail.assetexport.api;

/**
 * The worker received a request and answered with an error.
 */
public final class WorkerCallException extends ExportException
{
    public WorkerCallException(String message) {
        super(message);
    }
}
