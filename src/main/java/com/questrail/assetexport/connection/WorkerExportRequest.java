package com.questrail.assetexport.connection;

import com.questrail.assetexport.api.ExportAsset;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Parameters of one {@code exportAsset} worker call.
 *
 * @param documentId document to render from
 * @param layerId    layer to render; empty renders the whole document
 * @param asset      scale, format and suffix to render with
 * @param filename   base filename without suffix or extension
 * @param baseDir    destination folder
 */
public record WorkerExportRequest(
        long documentId,
        OptionalLong layerId,
        ExportAsset asset,
        String filename,
        String baseDir
) {
    public WorkerExportRequest {
        Objects.requireNonNull(layerId, "layerId");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(baseDir, "baseDir");
    }
}
