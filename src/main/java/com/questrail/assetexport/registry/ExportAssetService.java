package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.AssetFormat;
import com.questrail.assetexport.api.AssetUpdate;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportScale;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.MetadataSyncException;
import com.questrail.assetexport.api.TargetResolutionException;
import com.questrail.assetexport.api.UpdateOptions;
import com.questrail.assetexport.host.DocumentStore;
import com.questrail.assetexport.host.DocumentView;
import com.questrail.assetexport.host.LayerView;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.model.DocumentExports;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.ExportObservabilitySink;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * ExportAssetService
 * =============================================================================
 * Asset editing operations. Every registry mutation is paired with a metadata
 * sync of the same target; the returned future completes after both.
 *
 * <h2>Layer targets</h2>
 * {@link #addAsset} only touches layers that can be exported, and inserts
 * after the assets the layers share uniformly, so the shared prefix stays
 * aligned across a multi-layer selection. Before inserting, the layers' export
 * flag is switched on. That flag write is best effort: its failure is reported
 * and the insert goes ahead.
 *
 * <h2>Default assets</h2>
 * An asset created without explicit settings takes its scale from
 * {@link DefaultScalePolicy}, applied to the uniform assets of the target.
 */
public final class ExportAssetService
{
    private final ExportAssetRegistry registry;
    private final MetadataSynchronizer synchronizer;
    private final DocumentStore documents;
    private final ExportObservabilitySink sink;
    private final WallClock wallClock;

    public ExportAssetService(ExportAssetRegistry registry,
                              MetadataSynchronizer synchronizer,
                              DocumentStore documents,
                              ExportObservabilitySink sink,
                              WallClock wallClock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ---------------------------------------------------------------------
    // Add
    // ---------------------------------------------------------------------

    /**
     * Adds assets to the target; a single default asset when {@code assets} is empty.
     *
     * <p>For a layer target, layers that cannot be exported are skipped. If none
     * remain the operation completes without change.</p>
     */
    public CompletableFuture<Void> addAsset(ExportTarget target, Optional<List<ExportAsset>> assets) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(assets, "assets");

        return run(() -> {
            DocumentView document = requireDocument(target.documentId());
            DocumentExports exports = registry.documentExports(target.documentId());

            if (target instanceof ExportTarget.Layers layers) {
                List<Long> exportable = exportableLayerIds(document, layers.layerIds());
                if (exportable.isEmpty()) {
                    return CompletableFuture.completedFuture(null);
                }

                ExportTarget.Layers effective = ExportTarget.layers(target.documentId(), exportable);
                List<ExportAsset> uniform = exports.uniformAssets(exportable);
                List<ExportAsset> toAdd = assets.orElseGet(() -> List.of(DefaultScalePolicy.defaultAsset(uniform)));

                return enableLayersBestEffort(effective)
                        .thenCompose(v -> insertAndSync(effective, uniform.size(), toAdd, false));
            }

            List<ExportAsset> root = exports.rootExports();
            List<ExportAsset> toAdd = assets.orElseGet(() -> List.of(DefaultScalePolicy.defaultAsset(root)));
            return insertAndSync(target, root.size(), toAdd, false);
        });
    }

    /**
     * Gives a layer (or, without a layer id, the document's first artboard) one
     * default asset if it has none. No history state is created.
     */
    public CompletableFuture<Void> addDefaultAsset(long documentId, OptionalLong layerId) {
        Objects.requireNonNull(layerId, "layerId");

        return run(() -> {
            DocumentView document = requireDocument(documentId);

            Optional<LayerView> layer;
            if (layerId.isPresent()) {
                layer = Optional.of(requireLayer(document, layerId.getAsLong()));
            } else {
                layer = document.firstArtboard();
            }

            if (layer.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }

            ExportTarget.Layers target = ExportTarget.layer(documentId, layer.get().id());
            List<ExportAsset> existing = registry.documentExports(documentId).layerExports(layer.get().id());
            if (!existing.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }

            return enableLayersBestEffort(target)
                    .thenCompose(v -> insertAndSync(target, 0, List.of(DefaultScalePolicy.defaultAsset(existing)), true));
        });
    }

    // ---------------------------------------------------------------------
    // Update / delete
    // ---------------------------------------------------------------------

    /**
     * Merges {@code update} into the asset at {@code index} of every list of the target.
     *
     * <p>With {@link UpdateOptions#suppressErrors()} failures are reported to the
     * sink as warnings and the future completes normally. Otherwise they surface
     * as {@link MetadataSyncException}.</p>
     */
    public CompletableFuture<Void> updateAsset(ExportTarget target, int index, AssetUpdate update, UpdateOptions options) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(options, "options");

        CompletableFuture<Void> updated = run(() -> {
            registry.updateAsset(target, index, update);
            return synchronizer.sync(target, options.suppressHistory());
        });

        return updated.handle((v, err) -> {
            if (err == null) {
                return null;
            }
            Throwable cause = unwrap(err);
            if (options.suppressErrors()) {
                sink.onError(new ExportErrorEvent(wallClock.now(), ExportErrorEvent.Severity.WARNING,
                        "Ignoring failed update of asset " + index + " in document " + target.documentId(), cause));
                return null;
            }
            if (cause instanceof MetadataSyncException e) {
                throw e;
            }
            throw new MetadataSyncException("Failed to update asset " + index
                    + " in document " + target.documentId(), cause);
        });
    }

    /**
     * Sets the scale; a {@code null} scale means 1x.
     */
    public CompletableFuture<Void> updateAssetScale(ExportTarget target, int index, ExportScale scale) {
        return updateAsset(target, index, AssetUpdate.scale(scale == null ? ExportScale.ONE : scale), UpdateOptions.defaults());
    }

    public CompletableFuture<Void> updateAssetSuffix(ExportTarget target, int index, String suffix) {
        return run(() -> updateAsset(target, index, AssetUpdate.suffix(suffix), UpdateOptions.defaults()));
    }

    public CompletableFuture<Void> updateAssetFormat(ExportTarget target, int index, AssetFormat format) {
        return run(() -> updateAsset(target, index, AssetUpdate.format(format), UpdateOptions.defaults()));
    }

    public CompletableFuture<Void> deleteAsset(ExportTarget target, int index) {
        Objects.requireNonNull(target, "target");
        return run(() -> {
            registry.deleteAsset(target, index);
            return synchronizer.sync(target, false);
        });
    }

    /**
     * Marks all assets of the target as requested and persists that, without history.
     */
    public CompletableFuture<Void> markRequested(ExportTarget target) {
        Objects.requireNonNull(target, "target");
        return run(() -> {
            registry.markRequested(target);
            return synchronizer.sync(target, true);
        });
    }

    // ---------------------------------------------------------------------
    // Layer export flag
    // ---------------------------------------------------------------------

    /**
     * Sets the export flag of the layers. When enabling, layers without assets
     * first receive a default asset (which also switches their flag on). The
     * remaining layers get the flag written and their metadata synced without
     * history.
     */
    public CompletableFuture<Void> setLayerExportEnabled(long documentId, Collection<Long> layerIds, boolean enabled) {
        Objects.requireNonNull(layerIds, "layerIds");

        return run(() -> {
            DocumentView document = requireDocument(documentId);
            List<Long> ids = new ArrayList<>(layerIds.size());
            for (Long id : layerIds) {
                ids.add(requireLayer(document, id).id());
            }
            if (ids.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }

            List<Long> withoutExports = enabled
                    ? registry.documentExports(documentId).layersWithoutExports(ids)
                    : List.of();

            CompletableFuture<Void> quickAdd = withoutExports.isEmpty()
                    ? CompletableFuture.completedFuture(null)
                    : addAsset(ExportTarget.layers(documentId, withoutExports), Optional.empty());

            if (withoutExports.size() == ids.size()) {
                return quickAdd;
            }

            ExportTarget.Layers target = ExportTarget.layers(documentId, ids);
            return quickAdd
                    .thenCompose(v -> documents.setLayersExportEnabled(documentId, ids, enabled))
                    .thenCompose(v -> synchronizer.sync(target, true));
        });
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> insertAndSync(ExportTarget target, int index, List<ExportAsset> assets,
                                                  boolean suppressHistory) {
        return run(() -> {
            registry.addAssets(target, index, assets);
            return synchronizer.sync(target, suppressHistory);
        });
    }

    private CompletableFuture<Void> enableLayersBestEffort(ExportTarget.Layers target) {
        CompletableFuture<Void> flagged = run(() ->
                documents.setLayersExportEnabled(target.documentId(), target.layerIds(), true));
        return flagged.exceptionally(err -> {
            sink.onError(new ExportErrorEvent(wallClock.now(), ExportErrorEvent.Severity.WARNING,
                    "Could not enable export on layers " + target.layerIds()
                            + " of document " + target.documentId(), unwrap(err)));
            return null;
        });
    }

    private DocumentView requireDocument(long documentId) {
        return documents.document(documentId)
                .orElseThrow(() -> new TargetResolutionException("Cannot find document " + documentId));
    }

    private static LayerView requireLayer(DocumentView document, long layerId) {
        return document.layer(layerId)
                .orElseThrow(() -> new TargetResolutionException(
                        "Cannot find layer " + layerId + " in document " + document.id()));
    }

    private static List<Long> exportableLayerIds(DocumentView document, List<Long> layerIds) {
        List<LayerView> layers = new ArrayList<>(layerIds.size());
        for (Long id : layerIds) {
            layers.add(requireLayer(document, id));
        }
        List<Long> ids = new ArrayList<>();
        for (LayerView layer : document.filterExportable(layers)) {
            ids.add(layer.id());
        }
        return ids;
    }

    /**
     * Runs a step that may throw synchronously, turning the throw into a failed future.
     */
    private static CompletableFuture<Void> run(Supplier<CompletableFuture<Void>> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }
}
