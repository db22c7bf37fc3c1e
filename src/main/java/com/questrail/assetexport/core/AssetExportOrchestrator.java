package com.questrail.assetexport.core;

import com.questrail.assetexport.api.AssetExporter;
import com.questrail.assetexport.api.AssetFormat;
import com.questrail.assetexport.api.AssetUpdate;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportRequestOutcome;
import com.questrail.assetexport.api.ExportScale;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.UpdateOptions;
import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.connection.ExportWorkerClient;
import com.questrail.assetexport.connection.ServiceConnection;
import com.questrail.assetexport.host.PreferenceStore;
import com.questrail.assetexport.internal.exec.BatchExportCoordinator;
import com.questrail.assetexport.model.DocumentExports;
import com.questrail.assetexport.registry.ExportAssetRegistry;
import com.questrail.assetexport.registry.ExportAssetService;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * AssetExportOrchestrator
 * =============================================================================
 * The per-process context object behind {@link AssetExporter}. It owns the
 * worker connection, the asset registry, the editing service and the batch
 * coordinator, and routes each facade call to the one responsible.
 *
 * <h2>Architectural Role</h2>
 * This class holds no export semantics of its own beyond the artboard-prefix
 * setting. It guarantees the facade contract that nothing throws
 * synchronously: every argument or lookup failure becomes a failed future.
 *
 * <p>Built once by {@code AssetExportRuntime}.</p>
 */
public final class AssetExportOrchestrator implements AssetExporter
{
    private final ServiceConnection connection;
    private final ExportAssetRegistry registry;
    private final ExportAssetService service;
    private final BatchExportCoordinator coordinator;
    private final PreferenceStore preferences;
    private final String artboardPrefixKey;

    private volatile boolean useArtboardPrefix;

    public AssetExportOrchestrator(ServiceConnection connection,
                                   ExportAssetRegistry registry,
                                   ExportAssetService service,
                                   BatchExportCoordinator coordinator,
                                   PreferenceStore preferences,
                                   String artboardPrefixKey) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.service = Objects.requireNonNull(service, "service");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.artboardPrefixKey = Objects.requireNonNull(artboardPrefixKey, "artboardPrefixKey");
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connects to the worker, then loads the persisted artboard-prefix setting.
     *
     * @return whether the worker is available; never completes exceptionally
     */
    public CompletableFuture<Boolean> start() {
        return connection.connect().thenApply(connected -> {
            loadArtboardPrefix();
            return connected;
        });
    }

    void loadArtboardPrefix() {
        preferences.get(artboardPrefixKey)
                .map(value -> Boolean.parseBoolean(value.trim()))
                .ifPresent(value -> useArtboardPrefix = value);
    }

    // ---------------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------------

    @Override
    public boolean isServiceAvailable() {
        return connection.isReady();
    }

    @Override
    public boolean isServiceBusy() {
        return connection.isBusy();
    }

    @Override
    public boolean useArtboardPrefix() {
        return useArtboardPrefix;
    }

    // ---------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<ExportRequestOutcome> exportLayerAssets(long documentId) {
        return guard(() -> coordinator.exportLayers(documentId, Optional.empty(), Map.of()));
    }

    @Override
    public CompletableFuture<ExportRequestOutcome> exportLayerAssets(long documentId,
                                                                     Collection<Long> layerIds,
                                                                     Map<Long, String> prefixes) {
        return guard(() -> {
            Objects.requireNonNull(layerIds, "layerIds");
            Collection<Long> ids = List.copyOf(layerIds);
            return coordinator.exportLayers(documentId, Optional.of(ids), prefixes == null ? Map.of() : prefixes);
        });
    }

    @Override
    public CompletableFuture<ExportRequestOutcome> exportDocumentAssets(long documentId) {
        return guard(() -> coordinator.exportDocument(documentId));
    }

    // ---------------------------------------------------------------------
    // Asset editing
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> addAsset(ExportTarget target) {
        return guard(() -> service.addAsset(target, Optional.empty()));
    }

    @Override
    public CompletableFuture<Void> addAsset(ExportTarget target, List<ExportAsset> assets) {
        return guard(() -> service.addAsset(target, Optional.of(List.copyOf(assets))));
    }

    @Override
    public CompletableFuture<Void> addDefaultAsset(long documentId) {
        return guard(() -> service.addDefaultAsset(documentId, OptionalLong.empty()));
    }

    @Override
    public CompletableFuture<Void> addDefaultAsset(long documentId, long layerId) {
        return guard(() -> service.addDefaultAsset(documentId, OptionalLong.of(layerId)));
    }

    @Override
    public CompletableFuture<Void> updateAsset(ExportTarget target, int index, AssetUpdate update) {
        return updateAsset(target, index, update, UpdateOptions.defaults());
    }

    @Override
    public CompletableFuture<Void> updateAsset(ExportTarget target, int index, AssetUpdate update, UpdateOptions options) {
        return guard(() -> service.updateAsset(target, index, update, options));
    }

    @Override
    public CompletableFuture<Void> updateAssetScale(ExportTarget target, int index, ExportScale scale) {
        return guard(() -> service.updateAssetScale(target, index, scale));
    }

    @Override
    public CompletableFuture<Void> updateAssetSuffix(ExportTarget target, int index, String suffix) {
        return guard(() -> service.updateAssetSuffix(target, index, suffix));
    }

    @Override
    public CompletableFuture<Void> updateAssetFormat(ExportTarget target, int index, AssetFormat format) {
        return guard(() -> service.updateAssetFormat(target, index, format));
    }

    @Override
    public CompletableFuture<Void> deleteAsset(ExportTarget target, int index) {
        return guard(() -> service.deleteAsset(target, index));
    }

    @Override
    public CompletableFuture<Void> setLayerExportEnabled(long documentId, Collection<Long> layerIds, boolean enabled) {
        return guard(() -> service.setLayerExportEnabled(documentId, layerIds, enabled));
    }

    // ---------------------------------------------------------------------
    // Worker file operations
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> copyFile(String sourcePath, String targetPath) {
        return withWorker(client -> client.copyFile(sourcePath, targetPath));
    }

    @Override
    public CompletableFuture<Void> deleteFiles(List<String> filePaths) {
        return withWorker(client -> client.deleteFiles(List.copyOf(filePaths)));
    }

    private CompletableFuture<Void> withWorker(Function<ExportWorkerClient, CompletableFuture<Void>> call) {
        return guard(() -> {
            Optional<ExportWorkerClient> client = connection.client();
            if (client.isEmpty()) {
                connection.markUnavailable();
                return CompletableFuture.failedFuture(
                        new WorkerConnectionException("Export worker is not available"));
            }
            return call.apply(client.get());
        });
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> setUseArtboardPrefix(boolean enabled) {
        useArtboardPrefix = enabled;
        return guard(() -> preferences.set(artboardPrefixKey, Boolean.toString(enabled)));
    }

    @Override
    public DocumentExports documentExports(long documentId) {
        return registry.documentExports(documentId);
    }

    @Override
    public void documentClosed(long documentId) {
        registry.discard(documentId);
    }

    @Override
    public CompletableFuture<Void> reset() {
        connection.forgetFolder();
        coordinator.clearActiveBatch();
        registry.clear();
        return connection.close();
    }

    private static <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
