package com.questrail.assetexport.runtime;

import com.questrail.assetexport.api.AssetExporter;
import com.questrail.assetexport.config.ExportRuntimeConfig;
import com.questrail.assetexport.connection.ExportWorkerClient;
import com.questrail.assetexport.connection.ServiceConnection;
import com.questrail.assetexport.connection.WorkerMessageCodec;
import com.questrail.assetexport.connection.WorkerPortResolver;
import com.questrail.assetexport.connection.transport.WorkerTransport;
import com.questrail.assetexport.connection.transport.netty.NettyWebSocketWorkerTransport;
import com.questrail.assetexport.core.AssetExportOrchestrator;
import com.questrail.assetexport.host.DialogHost;
import com.questrail.assetexport.host.DocumentStore;
import com.questrail.assetexport.host.MetadataStore;
import com.questrail.assetexport.host.PreferenceStore;
import com.questrail.assetexport.host.WorkerHost;
import com.questrail.assetexport.internal.exec.BatchExportCoordinator;
import com.questrail.assetexport.internal.time.MonotonicClock;
import com.questrail.assetexport.internal.time.MonotonicScheduler;
import com.questrail.assetexport.internal.time.ScheduledExecutorScheduler;
import com.questrail.assetexport.internal.time.SystemMonotonicClock;
import com.questrail.assetexport.internal.time.SystemWallClock;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.ExportObservabilitySink;
import com.questrail.assetexport.observability.NullObservabilitySink;
import com.questrail.assetexport.registry.ExportAssetRegistry;
import com.questrail.assetexport.registry.ExportAssetService;
import com.questrail.assetexport.registry.ExportsMetadataCodec;
import com.questrail.assetexport.registry.MetadataSynchronizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * AssetExportRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the export stack.
 *
 * <h2>Ownership</h2>
 * The runtime creates and later shuts down:
 * <ul>
 *   <li>the Netty event loop group, unless a transport factory was supplied</li>
 *   <li>the scheduler executor, unless a scheduler was supplied</li>
 * </ul>
 * Host ports are owned by the caller.
 */
public final class AssetExportRuntime {
    private final AssetExportOrchestrator orchestrator;
    private final ScheduledExecutorService schedulerExecutor;
    private final EventLoopGroup eventLoopGroup;

    private AssetExportRuntime(AssetExportOrchestrator orchestrator,
                               ScheduledExecutorService schedulerExecutor,
                               EventLoopGroup eventLoopGroup) {
        this.orchestrator = orchestrator;
        this.schedulerExecutor = schedulerExecutor;
        this.eventLoopGroup = eventLoopGroup;
    }

    /**
     * Runs the worker handshake and loads persisted settings.
     *
     * @return whether the worker became available; never completes exceptionally
     */
    public CompletableFuture<Boolean> start() {
        return orchestrator.start();
    }

    public AssetExporter exporter() {
        return orchestrator;
    }

    public void stop() {
        orchestrator.reset().join();

        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
            try {
                if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    schedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                schedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExportRuntimeConfig config = ExportRuntimeConfig.defaults();
        private DocumentStore documentStore;
        private PreferenceStore preferenceStore;
        private DialogHost dialogHost;
        private MetadataStore metadataStore;
        private WorkerHost workerHost;
        private ExportObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Supplier<WorkerTransport> transportFactory;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(ExportRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDocumentStore(DocumentStore store) {
            this.documentStore = store;
            return this;
        }

        public Builder withPreferenceStore(PreferenceStore store) {
            this.preferenceStore = store;
            return this;
        }

        public Builder withDialogHost(DialogHost host) {
            this.dialogHost = host;
            return this;
        }

        public Builder withMetadataStore(MetadataStore store) {
            this.metadataStore = store;
            return this;
        }

        public Builder withWorkerHost(WorkerHost host) {
            this.workerHost = host;
            return this;
        }

        public Builder withObservabilitySink(ExportObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty WebSocket transport; one transport is created per connection attempt.
         */
        public Builder withTransportFactory(Supplier<WorkerTransport> factory) {
            this.transportFactory = factory;
            return this;
        }

        /**
         * Replaces the executor-backed scheduler. The clock must be the one the scheduler measures against.
         */
        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock) {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public AssetExportRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(documentStore, "documentStore");
            Objects.requireNonNull(preferenceStore, "preferenceStore");
            Objects.requireNonNull(dialogHost, "dialogHost");
            Objects.requireNonNull(metadataStore, "metadataStore");
            Objects.requireNonNull(workerHost, "workerHost");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Time
            ScheduledExecutorService schedulerExec = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "asset-export-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            }

            // 2. Transport
            EventLoopGroup group = null;
            Supplier<WorkerTransport> transports = transportFactory;
            if (transports == null) {
                EventLoopGroup nettyGroup = new NioEventLoopGroup(1);
                group = nettyGroup;
                transports = () -> new NettyWebSocketWorkerTransport(nettyGroup);
            }

            // 3. Worker connection
            ObjectMapper mapper = new ObjectMapper();
            WorkerMessageCodec codec = new WorkerMessageCodec(mapper);
            MonotonicScheduler clientScheduler = effectiveScheduler;
            Supplier<WorkerTransport> clientTransports = transports;
            Supplier<ExportWorkerClient> clients = () -> new ExportWorkerClient(
                clientTransports.get(),
                codec,
                clientScheduler,
                clock,
                wallClock,
                config.handshake().requestTimeout(),
                observabilitySink
            );

            ServiceConnection connection = new ServiceConnection(
                config.handshake(),
                config.debugMode(),
                config.workerHost(),
                workerHost,
                new WorkerPortResolver(preferenceStore, config.workerSettingsKey(), mapper),
                clients,
                effectiveScheduler,
                clock,
                wallClock,
                observabilitySink
            );

            // 4. Asset model and persistence
            ExportAssetRegistry registry = new ExportAssetRegistry();
            MetadataSynchronizer synchronizer = new MetadataSynchronizer(
                registry,
                documentStore,
                metadataStore,
                new ExportsMetadataCodec(mapper),
                config.metadataNamespace(),
                config.metadataKey(),
                config.historyName()
            );
            ExportAssetService service = new ExportAssetService(
                registry, synchronizer, documentStore, observabilitySink, wallClock);

            // 5. Batches
            BatchExportCoordinator coordinator = new BatchExportCoordinator(
                connection,
                registry,
                service,
                documentStore,
                dialogHost,
                config.defaultDocumentFilename(),
                observabilitySink,
                wallClock
            );

            AssetExportOrchestrator orchestrator = new AssetExportOrchestrator(
                connection, registry, service, coordinator, preferenceStore, config.artboardPrefixKey());

            return new AssetExportRuntime(orchestrator, schedulerExec, group);
        }
    }
}
