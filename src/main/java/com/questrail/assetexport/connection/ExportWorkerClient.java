package com.questrail.assetexport.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.assetexport.api.WorkerCallException;
import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.connection.transport.WorkerTransport;
import com.questrail.assetexport.connection.transport.WorkerTransportListener;
import com.questrail.assetexport.internal.time.Cancellable;
import com.questrail.assetexport.internal.time.MonotonicClock;
import com.questrail.assetexport.internal.time.MonotonicScheduler;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.ExportObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * ExportWorkerClient
 * =============================================================================
 * Request/response client for the rendering worker, layered on a
 * {@link WorkerTransport}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Assign request ids and correlate responses with pending calls</li>
 *   <li>Fail calls that exceed the request timeout</li>
 *   <li>Fail all pending calls when the transport goes down</li>
 * </ul>
 *
 * <p>One client wraps exactly one transport instance. After a disconnect the
 * owning {@link ServiceConnection} discards the client and builds a new one.</p>
 */
public final class ExportWorkerClient implements WorkerTransportListener
{
    static final String METHOD_EXPORT_ASSET = "exportAsset";
    static final String METHOD_COPY_FILE = "copyFile";
    static final String METHOD_DELETE_FILES = "deleteFiles";

    private final WorkerTransport transport;
    private final WorkerMessageCodec codec;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration requestTimeout;
    private final ExportObservabilitySink sink;

    private final AtomicLong nextId = new AtomicLong();
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    private volatile Consumer<Throwable> disconnectListener = cause -> {};

    public ExportWorkerClient(WorkerTransport transport,
                              WorkerMessageCodec codec,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              WallClock wallClock,
                              Duration requestTimeout,
                              ExportObservabilitySink sink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.sink = Objects.requireNonNull(sink, "sink");

        transport.setListener(this);
    }

    /**
     * Registers the callback invoked once when an open connection drops.
     */
    public void onDisconnect(Consumer<Throwable> listener) {
        this.disconnectListener = Objects.requireNonNull(listener, "listener");
    }

    public CompletableFuture<Void> connect(String host, int port, Duration timeout) {
        return transport.open(host, port, timeout);
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    /**
     * Closes the transport. Pending calls fail with {@link WorkerConnectionException}.
     */
    public CompletableFuture<Void> close() {
        failPending(new WorkerConnectionException("Worker connection closed"));
        return transport.close();
    }

    // ---------------------------------------------------------------------
    // Worker methods
    // ---------------------------------------------------------------------

    /**
     * Renders one asset.
     *
     * @return paths of the written files, in the order the worker reported
     *         them; possibly empty
     */
    public CompletableFuture<List<String>> exportAsset(WorkerExportRequest request) {
        Objects.requireNonNull(request, "request");

        ObjectNode params = codec.newParams();
        params.put("documentId", request.documentId());
        request.layerId().ifPresent(id -> params.put("layerId", id));

        ObjectNode asset = params.putObject("asset");
        asset.put("scale", request.asset().scale().multiplier());
        asset.put("format", request.asset().format().wireName());
        asset.put("suffix", request.asset().suffix());

        params.put("filename", request.filename());
        params.put("baseDir", request.baseDir());

        return call(METHOD_EXPORT_ASSET, params).thenApply(ExportWorkerClient::toPaths);
    }

    public CompletableFuture<Void> copyFile(String sourcePath, String targetPath) {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(targetPath, "targetPath");

        ObjectNode params = codec.newParams();
        params.put("sourcePath", sourcePath);
        params.put("targetPath", targetPath);
        return call(METHOD_COPY_FILE, params).thenApply(result -> null);
    }

    public CompletableFuture<Void> deleteFiles(Collection<String> filePaths) {
        Objects.requireNonNull(filePaths, "filePaths");

        ObjectNode params = codec.newParams();
        ArrayNode paths = params.putArray("filePaths");
        filePaths.forEach(paths::add);
        return call(METHOD_DELETE_FILES, params).thenApply(result -> null);
    }

    CompletableFuture<JsonNode> call(String method, ObjectNode params) {
        long id = nextId.incrementAndGet();
        String text = codec.encodeRequest(id, method, params);

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        pending.put(id, result);

        Cancellable timeout = scheduler.scheduleAfter(requestTimeout, clock, () -> {
            if (pending.remove(id, result)) {
                result.completeExceptionally(new WorkerConnectionException(
                        "Worker call " + method + " timed out after " + requestTimeout.toMillis() + "ms"));
            }
        });
        result.whenComplete((r, err) -> {
            timeout.cancel();
            pending.remove(id, result);
        });

        transport.sendText(text).whenComplete((v, err) -> {
            if (err != null && pending.remove(id, result)) {
                result.completeExceptionally(err instanceof WorkerConnectionException
                        ? err
                        : new WorkerConnectionException("Failed to send " + method + " to worker", err));
            }
        });
        return result;
    }

    int pendingCalls() {
        return pending.size();
    }

    // ---------------------------------------------------------------------
    // Transport callbacks
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        // Readiness is driven by the open() future.
    }

    @Override
    public void onTransportDown(Throwable cause) {
        failPending(new WorkerConnectionException("Worker connection lost", cause));
        disconnectListener.accept(cause);
    }

    @Override
    public void onText(String message) {
        WorkerResponse response;
        try {
            response = codec.decodeResponse(message);
        } catch (WorkerMessageDecodeException e) {
            reportWarning("Dropping malformed worker message", e);
            return;
        }

        CompletableFuture<JsonNode> call = pending.remove(response.id());
        if (call == null) {
            reportWarning("Dropping worker response for unknown request " + response.id(), null);
            return;
        }

        if (response.isError()) {
            call.completeExceptionally(new WorkerCallException(response.error().get()));
        } else {
            call.complete(response.result());
        }
    }

    private void failPending(WorkerConnectionException failure) {
        for (Long id : List.copyOf(pending.keySet())) {
            CompletableFuture<JsonNode> call = pending.remove(id);
            if (call != null) {
                call.completeExceptionally(failure);
            }
        }
    }

    private void reportWarning(String message, Throwable cause) {
        sink.onError(new ExportErrorEvent(wallClock.now(), ExportErrorEvent.Severity.WARNING, message, cause));
    }

    private static List<String> toPaths(JsonNode result) {
        List<String> paths = new ArrayList<>();
        if (result.isArray()) {
            for (JsonNode entry : result) {
                if (entry.isTextual() && !entry.asText().isEmpty()) {
                    paths.add(entry.asText());
                }
            }
        } else if (result.isTextual() && !result.asText().isEmpty()) {
            paths.add(result.asText());
        }
        return paths;
    }
}
