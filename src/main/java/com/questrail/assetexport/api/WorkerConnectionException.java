package com.questrail.assetexport.api;

/**
 * The rendering worker is unreachable, or the handshake failed after its retry.
 * Never fatal to the process: the exporter simply reports itself unavailable.
 */
public final class WorkerConnectionException extends ExportException
{
    public WorkerConnectionException(String message) {
        super(message);
    }

    public WorkerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
