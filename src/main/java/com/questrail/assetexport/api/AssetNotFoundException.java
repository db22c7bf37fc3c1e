package com.questrail.assetexport.api;

/**
 * An asset index is out of range for the addressed asset list.
 */
public final class AssetNotFoundException extends ExportException
{
    public AssetNotFoundException(String message) {
        super(message);
    }
}
