package com.questrail.assetexport.api;

/**
 * A batch export was requested while another one is still active.
 * Requests are rejected rather than queued; retrying is up to the caller.
 */
public final class BatchConflictException extends ExportException
{
    public BatchConflictException(String message) {
        super(message);
    }
}
