package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.AssetStatus;
import com.questrail.assetexport.api.AssetUpdate;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.model.DocumentExports;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * ExportAssetRegistry
 * =============================================================================
 * In-memory model of the export assets configured per document.
 *
 * <h2>Concurrency</h2>
 * All reads and mutations happen under one monitor. Stored values are
 * immutable {@link DocumentExports} snapshots, so a snapshot handed out to a
 * caller never changes underneath it.
 *
 * <h2>Failure atomicity</h2>
 * A mutation that fails (for example an out-of-range index on one layer of a
 * multi-layer target) leaves the stored snapshot untouched.
 */
public final class ExportAssetRegistry
{
    private final Object lock = new Object();
    private final Map<Long, DocumentExports> documents = new HashMap<>();

    /**
     * Current snapshot of a document, created empty on first access.
     */
    public DocumentExports documentExports(long documentId) {
        synchronized (lock) {
            return documents.computeIfAbsent(documentId, DocumentExports::empty);
        }
    }

    /**
     * Inserts assets at {@code index} in every list of the target.
     *
     * @return the new snapshot
     */
    public DocumentExports addAssets(ExportTarget target, int index, List<ExportAsset> assets) {
        Objects.requireNonNull(assets, "assets");
        List<ExportAsset> copy = List.copyOf(assets);
        return mutate(target, exports -> exports.insert(target, index, copy));
    }

    /**
     * Merges {@code update} into the asset at {@code index} of every list of the target.
     */
    public DocumentExports updateAsset(ExportTarget target, int index, AssetUpdate update) {
        Objects.requireNonNull(update, "update");
        return mutate(target, exports -> exports.update(target, index, update::applyTo));
    }

    public DocumentExports deleteAsset(ExportTarget target, int index) {
        return mutate(target, exports -> exports.delete(target, index));
    }

    /**
     * Marks every asset of the target as {@link AssetStatus#REQUESTED}.
     */
    public DocumentExports markRequested(ExportTarget target) {
        return mutate(target, exports -> exports.mapAll(target, asset -> asset.withStatus(AssetStatus.REQUESTED)));
    }

    /**
     * Forgets a document. A later access starts from an empty snapshot.
     */
    public void discard(long documentId) {
        synchronized (lock) {
            documents.remove(documentId);
        }
    }

    public void clear() {
        synchronized (lock) {
            documents.clear();
        }
    }

    private DocumentExports mutate(ExportTarget target, UnaryOperator<DocumentExports> change) {
        Objects.requireNonNull(target, "target");
        synchronized (lock) {
            DocumentExports current = documents.computeIfAbsent(target.documentId(), DocumentExports::empty);
            DocumentExports next = change.apply(current);
            documents.put(target.documentId(), next);
            return next;
        }
    }
}
