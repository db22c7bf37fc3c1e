package com.questrail.assetexport.internal.exec;

import com.questrail.assetexport.api.AssetExportException;
import com.questrail.assetexport.api.AssetStatus;
import com.questrail.assetexport.api.AssetUpdate;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.UpdateOptions;
import com.questrail.assetexport.connection.ExportWorkerClient;
import com.questrail.assetexport.connection.WorkerExportRequest;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.AssetStatusEvent;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.ExportObservabilitySink;
import com.questrail.assetexport.registry.ExportAssetService;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * AssetExportTask
 * =============================================================================
 * Exports one asset through the worker and records the outcome.
 *
 * <h2>Outcome</h2>
 * <ul>
 *   <li>The worker returned at least one path: the asset becomes
 *       {@link AssetStatus#STABLE} with the first path.</li>
 *   <li>The call failed, or returned no path: the asset becomes
 *       {@link AssetStatus#ERROR} and an {@link AssetExportException} is
 *       reported to the sink.</li>
 * </ul>
 *
 * <p>The status update uses {@link UpdateOptions#quiet()}. The future returned
 * by {@link #run()} never completes exceptionally; it yields the status the
 * task recorded.</p>
 */
final class AssetExportTask
{
    private final ExportWorkerClient client;
    private final ExportAssetService service;
    private final ExportObservabilitySink sink;
    private final WallClock wallClock;

    private final long documentId;
    private final OptionalLong layerId;
    private final int index;
    private final ExportAsset asset;
    private final String directory;
    private final String filename;

    AssetExportTask(ExportWorkerClient client,
                    ExportAssetService service,
                    ExportObservabilitySink sink,
                    WallClock wallClock,
                    long documentId,
                    OptionalLong layerId,
                    int index,
                    ExportAsset asset,
                    String directory,
                    String baseFilename,
                    String prefix) {
        this.client = Objects.requireNonNull(client, "client");
        this.service = Objects.requireNonNull(service, "service");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.documentId = documentId;
        this.layerId = Objects.requireNonNull(layerId, "layerId");
        this.index = index;
        this.asset = Objects.requireNonNull(asset, "asset");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.filename = FilenameAllocator.compose(prefix, Objects.requireNonNull(baseFilename, "baseFilename"),
                asset.suffix());
    }

    String filename() {
        return filename;
    }

    CompletableFuture<AssetStatus> run() {
        CompletableFuture<List<String>> exported;
        try {
            exported = client.exportAsset(new WorkerExportRequest(documentId, layerId, asset, filename, directory));
        } catch (RuntimeException e) {
            exported = CompletableFuture.failedFuture(e);
        }

        return exported
                .handle(this::toUpdate)
                .thenCompose(this::record);
    }

    private AssetUpdate toUpdate(List<String> paths, Throwable err) {
        if (err == null && paths != null && !paths.isEmpty()) {
            return AssetUpdate.stable(paths.get(0));
        }

        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        String message = "Export failed for asset " + index + " of " + describeLayer() + ", document " + documentId
                + (cause == null ? ": worker returned no file" : "");
        AssetExportException failure = cause == null
                ? new AssetExportException(message)
                : new AssetExportException(message, cause);
        sink.onError(new ExportErrorEvent(wallClock.now(), ExportErrorEvent.Severity.ERROR, failure.getMessage(), failure));
        return AssetUpdate.error();
    }

    private CompletableFuture<AssetStatus> record(AssetUpdate update) {
        AssetStatus status = update.status().orElseThrow();
        String path = update.filePath().orElse("");
        ExportTarget target = layerId.isPresent()
                ? ExportTarget.layer(documentId, layerId.getAsLong())
                : ExportTarget.root(documentId);

        CompletableFuture<Void> updated;
        try {
            updated = service.updateAsset(target, index, update, UpdateOptions.quiet());
        } catch (RuntimeException e) {
            updated = CompletableFuture.failedFuture(e);
        }

        return updated.handle((v, err) -> {
            if (err != null) {
                sink.onError(new ExportErrorEvent(wallClock.now(), ExportErrorEvent.Severity.ERROR,
                        "Failed to record export outcome for asset " + index + " of " + describeLayer()
                                + ", document " + documentId, err));
            }
            sink.onAssetStatus(new AssetStatusEvent(wallClock.now(), documentId, layerId, index, status, path));
            return status;
        });
    }

    private String describeLayer() {
        return layerId.isPresent() ? "layer " + layerId.getAsLong() : "the document";
    }
}
