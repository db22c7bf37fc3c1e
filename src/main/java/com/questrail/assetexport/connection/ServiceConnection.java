package com.questrail.assetexport.connection;

import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.host.WorkerHost;
import com.questrail.assetexport.internal.time.MonotonicClock;
import com.questrail.assetexport.internal.time.MonotonicScheduler;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.ExportObservabilitySink;
import com.questrail.assetexport.observability.ServiceStatusEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * ServiceConnection
 * =============================================================================
 * Owns the connection to the rendering worker and the service flags derived
 * from it.
 *
 * <h2>Handshake</h2>
 * The worker's port is not known statically; the worker publishes it in the
 * preferences once it is running. {@link #connect()} therefore:
 * <ol>
 *   <li>In debug mode, tries the stored port with a short timeout, to reattach
 *       to a worker left running by a previous session.</li>
 *   <li>Queries the worker feature flag. If it is off, switches it on and waits
 *       {@link HandshakePolicy#settleDelay()} for the worker to bind its port.
 *       A failed query counts as "off".</li>
 *   <li>Reads the port and connects.</li>
 *   <li>Repeats steps 2 and 3 until {@link HandshakePolicy#maxEnableAttempts()}
 *       attempts have been made.</li>
 * </ol>
 *
 * <h2>Service flags</h2>
 * <ul>
 *   <li>{@code available}: a connection is established</li>
 *   <li>{@code busy}: an export batch is running (independent of availability)</li>
 *   <li>{@code lastFolderPath}: seed for the next folder chooser</li>
 * </ul>
 * Every change of {@code available} or {@code busy} is reported to the sink.
 *
 * <h2>Thread Safety</h2>
 * Flags are volatile. The client handle is swapped under a private monitor.
 * Concurrent {@link #connect()} calls share one handshake. {@link #close()}
 * starts a new generation: a handshake begun before it can no longer install
 * a client or mark the service available.
 */
public final class ServiceConnection
{
    public static final String DEFAULT_FOLDER_SEED = "~";

    private final HandshakePolicy policy;
    private final boolean debugMode;
    private final String workerAddress;
    private final WorkerHost workerHost;
    private final WorkerPortResolver portResolver;
    private final Supplier<ExportWorkerClient> clientFactory;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ExportObservabilitySink sink;

    private final Object lock = new Object();
    private ExportWorkerClient client;
    private CompletableFuture<Boolean> handshake;
    private long generation;

    private volatile boolean available;
    private volatile boolean busy;
    private volatile String lastFolderPath;

    public ServiceConnection(HandshakePolicy policy,
                             boolean debugMode,
                             String workerAddress,
                             WorkerHost workerHost,
                             WorkerPortResolver portResolver,
                             Supplier<ExportWorkerClient> clientFactory,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             WallClock wallClock,
                             ExportObservabilitySink sink) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.debugMode = debugMode;
        this.workerAddress = Objects.requireNonNull(workerAddress, "workerAddress");
        this.workerHost = Objects.requireNonNull(workerHost, "workerHost");
        this.portResolver = Objects.requireNonNull(portResolver, "portResolver");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    public boolean isReady() {
        return available;
    }

    public boolean isBusy() {
        return busy;
    }

    public void setBusy(boolean busy) {
        if (this.busy != busy) {
            this.busy = busy;
            emitStatus();
        }
    }

    /**
     * Reports the worker as unavailable without closing the connection.
     */
    public void markUnavailable() {
        setAvailable(false);
    }

    public Optional<String> lastFolderPath() {
        return Optional.ofNullable(lastFolderPath);
    }

    /**
     * Folder the next chooser opens at: the last chosen folder, else the home directory.
     */
    public String folderSeed() {
        String last = lastFolderPath;
        return last != null ? last : DEFAULT_FOLDER_SEED;
    }

    public void rememberFolder(String path) {
        this.lastFolderPath = Objects.requireNonNull(path, "path");
    }

    public void forgetFolder() {
        this.lastFolderPath = null;
    }

    /**
     * The connected client, if the worker is available.
     */
    public Optional<ExportWorkerClient> client() {
        synchronized (lock) {
            return available ? Optional.ofNullable(client) : Optional.empty();
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Runs the handshake.
     *
     * @return a future completing with {@code true} once connected and
     *         {@code false} if every attempt failed or the connection was
     *         closed meanwhile; never completes exceptionally
     */
    public CompletableFuture<Boolean> connect() {
        CompletableFuture<Boolean> result;
        long gen;
        synchronized (lock) {
            if (handshake != null) {
                return handshake;
            }
            if (available && client != null) {
                return CompletableFuture.completedFuture(true);
            }
            result = new CompletableFuture<>();
            handshake = result;
            gen = generation;
        }

        quickCheck(gen)
                .thenCompose(attached -> attached
                        ? CompletableFuture.completedFuture(true)
                        : attemptEnableAndConnect(gen, 1))
                .whenComplete((connected, err) -> {
                    boolean current;
                    synchronized (lock) {
                        if (handshake == result) {
                            handshake = null;
                        }
                        current = gen == generation;
                    }
                    if (err == null) {
                        result.complete(connected);
                    } else if (!current) {
                        result.complete(false);
                    } else {
                        discardClient(gen);
                        setAvailable(false);
                        reportError(ExportErrorEvent.Severity.ERROR,
                                "Could not connect to export worker", unwrap(err));
                        result.complete(false);
                    }
                });
        return result;
    }

    /**
     * Closes the connection if there is one and abandons any handshake in
     * progress. Safe when never connected.
     */
    public CompletableFuture<Void> close() {
        ExportWorkerClient old;
        synchronized (lock) {
            generation++;
            handshake = null;
            old = client;
            client = null;
        }
        setAvailable(false);
        return old == null ? CompletableFuture.completedFuture(null) : old.close();
    }

    private CompletableFuture<Boolean> quickCheck(long gen) {
        if (!debugMode) {
            return CompletableFuture.completedFuture(false);
        }

        return resolvePortAndOpen(gen, policy.quickCheckTimeout()).handle((v, err) -> {
            if (err != null) {
                discardClient(gen);
                return false;
            }
            return true;
        });
    }

    private CompletableFuture<Boolean> attemptEnableAndConnect(long gen, int attempt) {
        if (isStale(gen)) {
            return CompletableFuture.failedFuture(closedDuringHandshake());
        }
        return enableAndConnect(gen).handle((v, err) -> {
            if (err == null) {
                return CompletableFuture.completedFuture(true);
            }

            discardClient(gen);
            Throwable cause = unwrap(err);
            if (isStale(gen)) {
                return CompletableFuture.<Boolean>failedFuture(cause);
            }
            if (attempt >= policy.maxEnableAttempts()) {
                return CompletableFuture.<Boolean>failedFuture(new WorkerConnectionException(
                        "Export worker unreachable after " + attempt + " attempts", cause));
            }

            reportError(ExportErrorEvent.Severity.WARNING,
                    "Export worker connection attempt " + attempt + " failed, retrying", cause);
            return attemptEnableAndConnect(gen, attempt + 1);
        }).thenCompose(next -> next);
    }

    private CompletableFuture<Void> enableAndConnect(long gen) {
        return workerHost.isWorkerEnabled()
                .exceptionally(err -> {
                    reportError(ExportErrorEvent.Severity.WARNING,
                            "Could not query export worker state", unwrap(err));
                    return false;
                })
                .thenCompose(enabled -> {
                    if (Boolean.TRUE.equals(enabled)) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    // Enabling returns before the worker has bound its port.
                    return workerHost.setWorkerEnabled(true)
                            .thenCompose(v -> scheduler.delay(policy.settleDelay(), clock));
                })
                .thenCompose(v -> resolvePortAndOpen(gen, policy.connectTimeout()));
    }

    private CompletableFuture<Void> resolvePortAndOpen(long gen, Duration timeout) {
        if (isStale(gen)) {
            return CompletableFuture.failedFuture(closedDuringHandshake());
        }

        int port;
        try {
            port = portResolver.resolve();
        } catch (WorkerConnectionException e) {
            return CompletableFuture.failedFuture(e);
        }

        ExportWorkerClient next = clientFactory.get();
        ExportWorkerClient previous;
        synchronized (lock) {
            if (gen != generation) {
                return CompletableFuture.failedFuture(closedDuringHandshake());
            }
            previous = client;
            client = next;
        }
        if (previous != null) {
            previous.close();
        }
        next.onDisconnect(cause -> onClientDisconnected(next, cause));

        return next.connect(workerAddress, port, timeout).thenRun(() -> activate(gen, next));
    }

    private void activate(long gen, ExportWorkerClient connected) {
        synchronized (lock) {
            if (gen == generation && client == connected) {
                setAvailable(true);
                return;
            }
        }
        connected.close();
        throw closedDuringHandshake();
    }

    private boolean isStale(long gen) {
        synchronized (lock) {
            return gen != generation;
        }
    }

    private static WorkerConnectionException closedDuringHandshake() {
        return new WorkerConnectionException("Export worker connection closed during handshake");
    }

    private void onClientDisconnected(ExportWorkerClient dropped, Throwable cause) {
        synchronized (lock) {
            if (client != dropped) {
                return;
            }
            client = null;
        }
        reportError(ExportErrorEvent.Severity.WARNING, "Export worker connection lost", cause);
        setAvailable(false);
    }

    private CompletableFuture<Void> discardClient(long gen) {
        ExportWorkerClient old;
        synchronized (lock) {
            if (gen != generation) {
                return CompletableFuture.completedFuture(null);
            }
            old = client;
            client = null;
        }
        return old == null ? CompletableFuture.completedFuture(null) : old.close();
    }

    private void setAvailable(boolean available) {
        if (this.available != available) {
            this.available = available;
            emitStatus();
        }
    }

    private void emitStatus() {
        sink.onServiceStatus(new ServiceStatusEvent(wallClock.now(), available, busy));
    }

    private void reportError(ExportErrorEvent.Severity severity, String message, Throwable cause) {
        sink.onError(new ExportErrorEvent(wallClock.now(), severity, message, cause));
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }
}
