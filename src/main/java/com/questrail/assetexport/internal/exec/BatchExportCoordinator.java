package com.questrail.assetexport.internal.exec;

import com.questrail.assetexport.api.AssetStatus;
import com.questrail.assetexport.api.BatchConflictException;
import com.questrail.assetexport.api.BatchSummary;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportRequestOutcome;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.TargetResolutionException;
import com.questrail.assetexport.connection.ExportWorkerClient;
import com.questrail.assetexport.connection.ServiceConnection;
import com.questrail.assetexport.host.DialogHost;
import com.questrail.assetexport.host.DocumentStore;
import com.questrail.assetexport.host.DocumentView;
import com.questrail.assetexport.host.LayerView;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.model.DocumentExports;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.ExportObservabilitySink;
import com.questrail.assetexport.observability.RequestPhaseTransitionEvent;
import com.questrail.assetexport.registry.ExportAssetRegistry;
import com.questrail.assetexport.registry.ExportAssetService;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * BatchExportCoordinator
 * =============================================================================
 * Runs export requests: resolves what to export, makes sure every target has
 * at least one asset, asks for a destination folder and fans out one
 * {@link AssetExportTask} per asset as a single batch.
 *
 * <h2>Single flight</h2>
 * At most one batch is active. The guard at the start of a request rejects a
 * second request early; the batch itself is claimed by compare-and-set just
 * before fan-out, so two requests racing through the folder dialog cannot
 * both start a batch. A rejected request fails with
 * {@link BatchConflictException}; it is never queued.
 *
 * <h2>Settling</h2>
 * The request's future completes with {@link ExportRequestOutcome#started}
 * as soon as the tasks are launched. The outcome's own completion future
 * completes once every task has settled, after the active-batch marker and
 * then the busy flag have been cleared. Per-asset failures are recorded as
 * {@link AssetStatus#ERROR} and counted in the {@link BatchSummary}; they are
 * never thrown.
 *
 * <h2>Observability</h2>
 * Every phase transition is reported to the sink.
 */
public final class BatchExportCoordinator
{
    private final ServiceConnection connection;
    private final ExportAssetRegistry registry;
    private final ExportAssetService service;
    private final DocumentStore documents;
    private final DialogHost dialogs;
    private final String defaultDocumentFilename;
    private final ExportObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicReference<BatchJob> activeBatch = new AtomicReference<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicLong batchIds = new AtomicLong();

    public BatchExportCoordinator(ServiceConnection connection,
                                  ExportAssetRegistry registry,
                                  ExportAssetService service,
                                  DocumentStore documents,
                                  DialogHost dialogs,
                                  String defaultDocumentFilename,
                                  ExportObservabilitySink sink,
                                  WallClock wallClock) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.service = Objects.requireNonNull(service, "service");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.dialogs = Objects.requireNonNull(dialogs, "dialogs");
        this.defaultDocumentFilename = Objects.requireNonNull(defaultDocumentFilename, "defaultDocumentFilename");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    /**
     * Exports layer assets.
     *
     * @param layerIds explicit layers, exported regardless of their export flag;
     *                 empty to export every export-enabled layer that has assets
     * @param prefixes layer id to filename prefix
     */
    public CompletableFuture<ExportRequestOutcome> exportLayers(long documentId,
                                                                Optional<Collection<Long>> layerIds,
                                                                Map<Long, String> prefixes) {
        Objects.requireNonNull(layerIds, "layerIds");
        Objects.requireNonNull(prefixes, "prefixes");
        Map<Long, String> prefixCopy = Map.copyOf(prefixes);
        return execute(documentId, request -> resolveLayers(request, layerIds, prefixCopy));
    }

    /**
     * Exports the document-level assets.
     */
    public CompletableFuture<ExportRequestOutcome> exportDocument(long documentId) {
        return execute(documentId, this::resolveDocument);
    }

    public boolean isBatchActive() {
        return activeBatch.get() != null;
    }

    /**
     * Forgets the active batch without waiting for it. Its tasks keep running
     * and still record their outcomes.
     */
    public void clearActiveBatch() {
        activeBatch.set(null);
    }

    // ---------------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------------

    private CompletableFuture<ExportRequestOutcome> execute(long documentId,
                                                           Function<Request, Plan> resolver) {
        Request request = new Request(requestIds.incrementAndGet(), documentId);

        if (activeBatch.get() != null) {
            request.moveTo(ExportRequestPhase.REJECTED);
            return CompletableFuture.failedFuture(new BatchConflictException(
                    "Cannot export assets while another batch is in progress"));
        }
        if (!connection.isReady()) {
            connection.markUnavailable();
            return CompletableFuture.completedFuture(ExportRequestOutcome.serviceUnavailable());
        }

        CompletableFuture<ExportRequestOutcome> outcome;
        try {
            request.moveTo(ExportRequestPhase.RESOLVING_TARGETS);
            Plan plan = resolver.apply(request);

            request.moveTo(ExportRequestPhase.ENSURING_DEFAULT_ASSETS);
            outcome = ensureDefaults(plan)
                    .thenCompose(v -> {
                        request.moveTo(ExportRequestPhase.AWAITING_FOLDER);
                        return promptForFolder();
                    })
                    .thenCompose(folder -> {
                        if (folder.isEmpty() || folder.get().isBlank()) {
                            request.moveTo(ExportRequestPhase.ABORTED);
                            return CompletableFuture.completedFuture(ExportRequestOutcome.cancelled());
                        }
                        connection.rememberFolder(folder.get());
                        return fanOut(request, plan, folder.get());
                    });
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        return outcome.whenComplete((o, err) -> {
            if (err != null && !request.phase().isTerminal()) {
                request.moveTo(ExportRequestPhase.ABORTED);
            }
        });
    }

    private Plan resolveLayers(Request request, Optional<Collection<Long>> layerIds, Map<Long, String> prefixes) {
        DocumentView document = requireDocument(request.documentId);

        List<LayerView> layers;
        if (layerIds.isPresent()) {
            List<LayerView> requested = new ArrayList<>(layerIds.get().size());
            for (Long id : layerIds.get()) {
                requested.add(document.layer(id).orElseThrow(() -> new TargetResolutionException(
                        "Cannot find layer " + id + " in document " + document.id())));
            }
            layers = document.filterExportable(requested);
        } else {
            Set<Long> configured = registry.documentExports(document.id()).layersWithExports();
            List<LayerView> enabled = new ArrayList<>();
            for (LayerView layer : document.exportEnabledLayers()) {
                if (configured.contains(layer.id())) {
                    enabled.add(layer);
                }
            }
            layers = document.filterExportable(enabled);
        }
        return new Plan(document, Optional.of(List.copyOf(layers)), prefixes);
    }

    private Plan resolveDocument(Request request) {
        return new Plan(requireDocument(request.documentId), Optional.empty(), Map.of());
    }

    private CompletableFuture<Void> ensureDefaults(Plan plan) {
        long documentId = plan.document.id();
        DocumentExports exports = registry.documentExports(documentId);

        if (plan.layers.isEmpty()) {
            return exports.rootExports().isEmpty()
                    ? service.addAsset(ExportTarget.root(documentId), Optional.empty())
                    : CompletableFuture.completedFuture(null);
        }

        List<Long> withoutExports = exports.layersWithoutExports(plan.layerIds());
        return withoutExports.isEmpty()
                ? CompletableFuture.completedFuture(null)
                : service.addAsset(ExportTarget.layers(documentId, withoutExports), Optional.empty());
    }

    /**
     * Suspends input policies, opens the folder chooser and restores the
     * policies on every exit path before the result (or failure) propagates.
     */
    private CompletableFuture<Optional<String>> promptForFolder() {
        CompletableFuture<Optional<String>> chosen;
        try {
            chosen = dialogs.suspendInputPolicies()
                    .handle((v, err) -> {
                        if (err != null) {
                            throw new CompletionException(new IllegalStateException(
                                    "Failed to suspend input policies before opening the folder dialog", unwrap(err)));
                        }
                        return null;
                    })
                    .thenCompose(v -> dialogs.chooseFolder(connection.folderSeed()));
        } catch (RuntimeException e) {
            chosen = CompletableFuture.failedFuture(e);
        }

        return chosen
                .handle((folder, err) -> restoreInputPolicies().thenApply(v -> {
                    if (err != null) {
                        throw new CompletionException(unwrap(err));
                    }
                    return folder == null ? Optional.<String>empty() : folder;
                }))
                .thenCompose(Function.identity());
    }

    private CompletableFuture<Void> restoreInputPolicies() {
        CompletableFuture<Void> restored;
        try {
            restored = dialogs.restoreInputPolicies();
        } catch (RuntimeException e) {
            restored = CompletableFuture.failedFuture(e);
        }
        return restored.exceptionally(err -> {
            report(ExportErrorEvent.Severity.WARNING, "Failed to restore input policies", unwrap(err));
            return null;
        });
    }

    private CompletableFuture<ExportRequestOutcome> fanOut(Request request, Plan plan, String folder) {
        Optional<ExportWorkerClient> client = connection.client();
        if (client.isEmpty()) {
            connection.markUnavailable();
            request.moveTo(ExportRequestPhase.ABORTED);
            return CompletableFuture.completedFuture(ExportRequestOutcome.serviceUnavailable());
        }

        List<AssetExportTask> tasks = planTasks(client.get(), plan, folder);

        CompletableFuture<BatchSummary> completion = new CompletableFuture<>();
        BatchJob job = new BatchJob(batchIds.incrementAndGet(), tasks.size(), completion);
        if (!activeBatch.compareAndSet(null, job)) {
            request.moveTo(ExportRequestPhase.REJECTED);
            return CompletableFuture.failedFuture(new BatchConflictException(
                    "Cannot export assets while another batch is in progress"));
        }

        request.moveTo(ExportRequestPhase.EXPORTING);

        CompletableFuture<Void> marked = plan.target()
                .map(service::markRequested)
                .orElseGet(() -> CompletableFuture.completedFuture(null));

        return marked
                .exceptionally(err -> {
                    report(ExportErrorEvent.Severity.WARNING,
                            "Failed to mark assets as requested in document " + plan.document.id(), unwrap(err));
                    return null;
                })
                .thenApply(v -> {
                    connection.setBusy(true);
                    launch(request, job, tasks);
                    return ExportRequestOutcome.started(tasks.size(), completion);
                });
    }

    private List<AssetExportTask> planTasks(ExportWorkerClient client, Plan plan, String folder) {
        DocumentView document = plan.document;
        DocumentExports exports = registry.documentExports(document.id());
        List<AssetExportTask> tasks = new ArrayList<>();

        if (plan.layers.isEmpty()) {
            String name = document.nameWithoutExtension();
            String base = name == null || name.isBlank() ? defaultDocumentFilename : name;
            List<ExportAsset> assets = exports.rootExports();
            for (int i = 0; i < assets.size(); i++) {
                tasks.add(new AssetExportTask(client, service, sink, wallClock, document.id(), OptionalLong.empty(),
                        i, assets.get(i), folder, base, null));
            }
            return tasks;
        }

        FilenameAllocator filenames = new FilenameAllocator();
        for (LayerView layer : plan.layers.get()) {
            String base = filenames.allocate(layer.name());
            String prefix = plan.prefixes.get(layer.id());
            List<ExportAsset> assets = exports.layerExports(layer.id());
            for (int i = 0; i < assets.size(); i++) {
                tasks.add(new AssetExportTask(client, service, sink, wallClock, document.id(),
                        OptionalLong.of(layer.id()), i, assets.get(i), folder, base, prefix));
            }
        }
        return tasks;
    }

    private void launch(Request request, BatchJob job, List<AssetExportTask> tasks) {
        List<CompletableFuture<AssetStatus>> running = new ArrayList<>(tasks.size());
        for (AssetExportTask task : tasks) {
            running.add(task.run());
        }

        CompletableFuture.allOf(running.toArray(new CompletableFuture<?>[0])).whenComplete((v, err) -> {
            BatchSummary summary = summarize(job, running);
            activeBatch.compareAndSet(job, null);
            try {
                connection.setBusy(false);
                if (summary.hasFailures()) {
                    report(ExportErrorEvent.Severity.ERROR, "There were errors while exporting: " + summary.failed()
                            + " of " + summary.taskCount() + " assets failed in document " + request.documentId, null);
                }
                request.moveTo(ExportRequestPhase.IDLE);
            } finally {
                job.completion().complete(summary);
            }
        });
    }

    /**
     * A task whose future failed counts as a failed asset.
     */
    private static BatchSummary summarize(BatchJob job, List<CompletableFuture<AssetStatus>> running) {
        int succeeded = 0;
        for (CompletableFuture<AssetStatus> f : running) {
            if (!f.isCompletedExceptionally() && f.getNow(null) == AssetStatus.STABLE) {
                succeeded++;
            }
        }
        return new BatchSummary(job.id(), job.taskCount(), succeeded, job.taskCount() - succeeded);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private DocumentView requireDocument(long documentId) {
        return documents.document(documentId)
                .orElseThrow(() -> new TargetResolutionException("Cannot find document " + documentId));
    }

    private void report(ExportErrorEvent.Severity severity, String message, Throwable cause) {
        sink.onError(new ExportErrorEvent(wallClock.now(), severity, message, cause));
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    /**
     * What one request exports. Empty {@code layers} means the document-level list.
     */
    private static final class Plan
    {
        final DocumentView document;
        final Optional<List<LayerView>> layers;
        final Map<Long, String> prefixes;

        Plan(DocumentView document, Optional<List<LayerView>> layers, Map<Long, String> prefixes) {
            this.document = document;
            this.layers = layers;
            this.prefixes = prefixes;
        }

        List<Long> layerIds() {
            List<Long> ids = new ArrayList<>();
            layers.ifPresent(list -> list.forEach(layer -> ids.add(layer.id())));
            return ids;
        }

        /**
         * Target to mark as requested; empty when a layer request resolved to no layers.
         */
        Optional<ExportTarget> target() {
            if (layers.isEmpty()) {
                return Optional.of(ExportTarget.root(document.id()));
            }
            List<Long> ids = layerIds();
            return ids.isEmpty() ? Optional.empty() : Optional.of(ExportTarget.layers(document.id(), ids));
        }
    }

    /**
     * Phase bookkeeping of one request.
     */
    private final class Request
    {
        final long id;
        final long documentId;
        private volatile ExportRequestPhase phase = ExportRequestPhase.IDLE;

        Request(long id, long documentId) {
            this.id = id;
            this.documentId = documentId;
        }

        ExportRequestPhase phase() {
            return phase;
        }

        synchronized void moveTo(ExportRequestPhase next) {
            ExportRequestPhase from = phase;
            phase = next;
            sink.onRequestPhase(new RequestPhaseTransitionEvent(wallClock.now(), id, documentId, from, next));
        }
    }
}
