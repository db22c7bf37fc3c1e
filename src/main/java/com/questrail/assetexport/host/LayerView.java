package com.questrail.assetexport.host;

/**
 * Read-only view of a layer, as far as exporting is concerned.
 */
public interface LayerView
{
    long id();

    /**
     * Display name; used as the base filename of layer exports.
     */
    String name();

    /**
     * Whether the user flagged this layer for export.
     */
    boolean exportEnabled();

    /**
     * Whether this kind of layer can be exported at all (some cannot, e.g. groups
     * with no pixels or adjustment layers).
     */
    boolean isExportable();

    boolean isArtboard();
}
