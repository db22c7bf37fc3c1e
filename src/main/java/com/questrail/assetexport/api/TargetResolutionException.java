package com.questrail.assetexport.api;

/**
 * A requested document or layer does not exist in the document store.
 */
public final class TargetResolutionException extends ExportException
{
    public TargetResolutionException(String message) {
        super(message);
    }
}
