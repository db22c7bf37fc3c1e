package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.MetadataSyncException;
import com.questrail.assetexport.api.TargetResolutionException;
import com.questrail.assetexport.host.DocumentStore;
import com.questrail.assetexport.host.DocumentView;
import com.questrail.assetexport.host.HistoryEntry;
import com.questrail.assetexport.host.LayerView;
import com.questrail.assetexport.host.MetadataStore;
import com.questrail.assetexport.host.MetadataWrite;
import com.questrail.assetexport.model.DocumentExports;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * MetadataSynchronizer
 * =============================================================================
 * Projects the registry and the document model into persisted metadata.
 *
 * <p>The metadata store only accepts complete values, so every sync reads the
 * current registry snapshot and the current document afresh rather than
 * relying on anything the caller holds.</p>
 *
 * <p>A layer target produces one write per layer; all writes of one sync are
 * submitted as a single atomic batch.</p>
 */
public final class MetadataSynchronizer
{
    private final ExportAssetRegistry registry;
    private final DocumentStore documents;
    private final MetadataStore metadata;
    private final ExportsMetadataCodec codec;
    private final String namespace;
    private final String key;
    private final String historyName;

    public MetadataSynchronizer(ExportAssetRegistry registry,
                                DocumentStore documents,
                                MetadataStore metadata,
                                ExportsMetadataCodec codec,
                                String namespace,
                                String key,
                                String historyName) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.key = Objects.requireNonNull(key, "key");
        this.historyName = Objects.requireNonNull(historyName, "historyName");
    }

    /**
     * Writes the current metadata of the target.
     *
     * @param suppressHistory if {@code true}, no history state is created
     * @return a future failing with {@link TargetResolutionException} if the
     *         document or a layer is missing, or {@link MetadataSyncException}
     *         if the store rejects the write
     */
    public CompletableFuture<Void> sync(ExportTarget target, boolean suppressHistory) {
        Objects.requireNonNull(target, "target");

        List<MetadataWrite> writes;
        try {
            writes = buildWrites(target);
        } catch (TargetResolutionException e) {
            return CompletableFuture.failedFuture(e);
        }

        Optional<HistoryEntry> history = suppressHistory
                ? Optional.empty()
                : Optional.of(new HistoryEntry(historyName, target.documentId()));

        CompletableFuture<Void> written;
        try {
            written = metadata.write(writes, history);
        } catch (RuntimeException e) {
            written = CompletableFuture.failedFuture(e);
        }

        return written.handle((v, err) -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                throw new MetadataSyncException(
                        "Failed to write export metadata for document " + target.documentId(), cause);
            }
            return null;
        });
    }

    private List<MetadataWrite> buildWrites(ExportTarget target) {
        long documentId = target.documentId();
        DocumentView document = documents.document(documentId)
                .orElseThrow(() -> new TargetResolutionException("Cannot find document " + documentId));
        DocumentExports exports = registry.documentExports(documentId);

        if (target instanceof ExportTarget.Layers layers) {
            List<MetadataWrite> writes = new ArrayList<>(layers.layerIds().size());
            for (Long layerId : layers.layerIds()) {
                LayerView layer = document.layer(layerId)
                        .orElseThrow(() -> new TargetResolutionException(
                                "Cannot find layer " + layerId + " in document " + documentId));
                String json = codec.encodeLayer(exports.layerExports(layerId), layer.exportEnabled());
                writes.add(new MetadataWrite(documentId, OptionalLong.of(layerId), namespace, key, json));
            }
            return writes;
        }

        String json = codec.encodeDocument(exports.rootExports());
        return List.of(new MetadataWrite(documentId, OptionalLong.empty(), namespace, key, json));
    }
}
