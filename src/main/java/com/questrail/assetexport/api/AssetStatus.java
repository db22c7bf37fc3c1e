package com.questrail.assetexport.api;

/**
 * AssetStatus
 * -----------------------------------------------------------------------------
 * Last-known export state of a single {@link ExportAsset}.
 *
 * <ul>
 *   <li>{@link #QUEUED} - configured, never requested in the current session</li>
 *   <li>{@link #REQUESTED} - part of a batch whose tasks have not settled</li>
 *   <li>{@link #STABLE} - last export succeeded; the asset carries the written path</li>
 *   <li>{@link #ERROR} - last export failed; the asset carries an empty path</li>
 * </ul>
 */
public enum AssetStatus
{
    QUEUED,
    REQUESTED,
    STABLE,
    ERROR
}
