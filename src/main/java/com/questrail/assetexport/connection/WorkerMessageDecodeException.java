package com.questrail.assetexport.connection;

/**
 * Indicates that a text message from the worker could not be interpreted as a
 * response.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not JSON</li>
 *   <li>A JSON value that is not an object</li>
 *   <li>A missing or non-numeric {@code id}</li>
 * </ul>
 */
public final class WorkerMessageDecodeException extends RuntimeException
{
    public WorkerMessageDecodeException(String message) {
        super(message);
    }

    public WorkerMessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
