package com.questrail.assetexport.api;

/**
 * Writing export metadata to the document failed.
 */
public final class MetadataSyncException extends ExportException
{
    public MetadataSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
