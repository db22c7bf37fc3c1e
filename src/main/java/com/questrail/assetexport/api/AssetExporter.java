package com.questrail.assetexport.api;

import com.questrail.assetexport.model.DocumentExports;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * AssetExporter
 * -----------------------------------------------------------------------------
 * The caller-facing facade of the export core: configure export assets on a
 * document or its layers, and export them through the rendering worker.
 *
 * <h2>Asynchronous contract</h2>
 * Every mutating or exporting operation returns a {@link CompletableFuture}.
 * No operation throws synchronously; all failures, including argument and
 * lookup failures, surface through the returned future as an
 * {@link ExportException} subtype.
 *
 * <h2>Persistence</h2>
 * Each asset mutation is paired with a metadata write for the same target. The
 * returned future completes only after both have happened, so callers never
 * observe in-memory state that the document metadata does not reflect.
 *
 * <h2>Batches</h2>
 * At most one export batch runs at a time. A second request while one is
 * active fails with {@link BatchConflictException}; it is never queued. An
 * unavailable worker is not an error: the request completes with
 * {@link ExportRequestOutcome.Disposition#SERVICE_UNAVAILABLE}.
 *
 * <h2>Threading</h2>
 * Implementations are safe to call from any thread. Futures may complete on
 * transport or scheduler threads.
 */
public interface AssetExporter
{
    /**
     * Whether the worker handshake has completed.
     */
    boolean isServiceAvailable();

    /**
     * Whether an export batch is currently running.
     */
    boolean isServiceBusy();

    /**
     * Whether layer exports should be prefixed with their artboard name.
     */
    boolean useArtboardPrefix();

    /**
     * Exports every exportable layer of the document whose export flag is set
     * and which has assets configured.
     */
    CompletableFuture<ExportRequestOutcome> exportLayerAssets(long documentId);

    /**
     * Exports the given layers regardless of their export flag. Layers that
     * cannot be exported are skipped; layers without assets receive one
     * default asset first.
     *
     * @param prefixes optional layer id to filename prefix map; may be empty
     */
    CompletableFuture<ExportRequestOutcome> exportLayerAssets(long documentId,
                                                              Collection<Long> layerIds,
                                                              Map<Long, String> prefixes);

    /**
     * Exports the document-level assets, adding a default one if none exist.
     */
    CompletableFuture<ExportRequestOutcome> exportDocumentAssets(long documentId);

    /**
     * Appends one default asset (next unused scale) to the target.
     */
    CompletableFuture<Void> addAsset(ExportTarget target);

    /**
     * Appends the given assets to the target. For a layer target the assets
     * are inserted after the last asset shared uniformly by all layers.
     */
    CompletableFuture<Void> addAsset(ExportTarget target, List<ExportAsset> assets);

    /**
     * Adds a default asset to the first artboard of the document, if it has none.
     */
    CompletableFuture<Void> addDefaultAsset(long documentId);

    /**
     * Adds a default asset to the layer, if it has none. No history entry is created.
     */
    CompletableFuture<Void> addDefaultAsset(long documentId, long layerId);

    CompletableFuture<Void> updateAsset(ExportTarget target, int index, AssetUpdate update);

    CompletableFuture<Void> updateAsset(ExportTarget target, int index, AssetUpdate update, UpdateOptions options);

    /**
     * Sets the scale of an asset; {@code null} means 1x.
     */
    CompletableFuture<Void> updateAssetScale(ExportTarget target, int index, ExportScale scale);

    CompletableFuture<Void> updateAssetSuffix(ExportTarget target, int index, String suffix);

    CompletableFuture<Void> updateAssetFormat(ExportTarget target, int index, AssetFormat format);

    CompletableFuture<Void> deleteAsset(ExportTarget target, int index);

    /**
     * Sets the export flag of the layers. Enabling a layer without assets
     * gives it one default asset.
     */
    CompletableFuture<Void> setLayerExportEnabled(long documentId, Collection<Long> layerIds, boolean enabled);

    /**
     * Copies a file through the worker.
     */
    CompletableFuture<Void> copyFile(String sourcePath, String targetPath);

    /**
     * Deletes files through the worker.
     */
    CompletableFuture<Void> deleteFiles(List<String> filePaths);

    /**
     * Updates the artboard-prefix setting and persists it as a preference.
     */
    CompletableFuture<Void> setUseArtboardPrefix(boolean enabled);

    /**
     * Current export configuration of the document (created empty on first access).
     */
    DocumentExports documentExports(long documentId);

    /**
     * Discards the export configuration held for a closed document.
     */
    void documentClosed(long documentId);

    /**
     * Forgets the last folder, the active batch marker and all document
     * configuration, and closes the worker connection.
     */
    CompletableFuture<Void> reset();
}
