package com.questrail.assetexport.observability;

import com.questrail.assetexport.api.AssetStatus;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Outcome of one asset export as recorded in the registry.
 */
public record AssetStatusEvent(
    Instant timestamp,
    long documentId,
    OptionalLong layerId,
    int assetIndex,
    AssetStatus status,
    String filePath
) {
}
