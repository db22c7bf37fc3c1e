package com.questrail.assetexport.host;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * DocumentStore
 * -----------------------------------------------------------------------------
 * Source of truth for documents and layers. The export core reads it and
 * writes exactly one thing back: the per-layer export flag.
 */
public interface DocumentStore
{
    Optional<DocumentView> document(long documentId);

    /**
     * Sets the export flag of the given layers.
     */
    CompletableFuture<Void> setLayersExportEnabled(long documentId, Collection<Long> layerIds, boolean enabled);
}
