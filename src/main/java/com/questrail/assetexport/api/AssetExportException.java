package com.questrail.assetexport.api;

/**
 * A single asset could not be rendered or written. Isolated to that asset: it
 * is recorded as {@link AssetStatus#ERROR} and the rest of the batch continues.
 */
public final class AssetExportException extends ExportException
{
    public AssetExportException(String message) {
        super(message);
    }

    public AssetExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
