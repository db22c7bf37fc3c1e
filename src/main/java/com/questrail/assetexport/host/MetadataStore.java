package com.questrail.assetexport.host;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persists export metadata into documents.
 */
public interface MetadataStore
{
    /**
     * Applies all writes as one atomic batch, optionally recording a history state.
     */
    CompletableFuture<Void> write(List<MetadataWrite> writes, Optional<HistoryEntry> history);
}
