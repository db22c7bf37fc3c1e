package com.questrail.assetexport.api;

/**
 * Root of the export failure hierarchy.
 *
 * <p>Facade operations never throw these synchronously; they complete the
 * returned future exceptionally instead.</p>
 */
public class ExportException extends RuntimeException
{
    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
