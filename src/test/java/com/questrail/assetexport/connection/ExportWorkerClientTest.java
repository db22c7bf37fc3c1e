package com.questrail.assetexport.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.assetexport.api.AssetFormat;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportScale;
import com.questrail.assetexport.api.WorkerCallException;
import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.connection.transport.FakeWorkerTransport;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.RecordingObservabilitySink;
import com.questrail.assetexport.time.DeterministicScheduler;
import com.questrail.assetexport.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExportWorkerClientTest
 * -----------------------------------------------------------------------------
 * Request/response correlation against a fake transport. Time only moves when
 * the deterministic scheduler is advanced.
 */
class ExportWorkerClientTest {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeWorkerTransport transport = new FakeWorkerTransport();
    private ExportWorkerClient client;

    @BeforeEach
    void setUp() {
        client = new ExportWorkerClient(transport, new WorkerMessageCodec(mapper), scheduler, clock,
                (WallClock) () -> Instant.EPOCH, REQUEST_TIMEOUT, sink);
        client.connect("127.0.0.1", 9000, Duration.ofSeconds(1)).join();
    }

    private JsonNode lastRequest() throws Exception {
        List<String> sent = transport.sent();
        return mapper.readTree(sent.get(sent.size() - 1));
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        return assertThrows(CompletionException.class, future::join).getCause();
    }

    @Test
    void connectOpensTransportWithGivenAddress() {
        assertEquals(new FakeWorkerTransport.OpenCall("127.0.0.1", 9000, Duration.ofSeconds(1)), transport.opens().get(0));
        assertTrue(client.isOpen());
    }

    @Test
    void exportAssetSendsParamsAndReturnsPaths() throws Exception {
        CompletableFuture<List<String>> paths = client.exportAsset(new WorkerExportRequest(
                4, OptionalLong.of(12), ExportAsset.of(ExportScale.ONE_AND_HALF, AssetFormat.JPG), "Icon", "/out"));

        JsonNode request = lastRequest();
        assertEquals("exportAsset", request.get("method").asText());
        JsonNode params = request.get("params");
        assertEquals(4, params.get("documentId").longValue());
        assertEquals(12, params.get("layerId").longValue());
        assertEquals(1.5, params.get("asset").get("scale").doubleValue());
        assertEquals("jpg", params.get("asset").get("format").asText());
        assertEquals("@1.5x", params.get("asset").get("suffix").asText());
        assertEquals("Icon", params.get("filename").asText());
        assertEquals("/out", params.get("baseDir").asText());

        long id = request.get("id").longValue();
        transport.injectText("{\"id\": " + id + ", \"result\": [\"/out/Icon@1.5x.jpg\", \"\"]}");

        assertEquals(List.of("/out/Icon@1.5x.jpg"), paths.join());
        assertEquals(0, client.pendingCalls());
        assertEquals(0, scheduler.pendingTasks(), "timeout is cancelled on completion");
    }

    @Test
    void documentExportOmitsLayerId() throws Exception {
        client.exportAsset(new WorkerExportRequest(4, OptionalLong.empty(), ExportAsset.of(ExportScale.ONE), "poster", "/out"));

        assertFalse(lastRequest().get("params").has("layerId"));
    }

    @Test
    void singleStringResultIsOnePath() {
        transport.respondWith(text -> Optional.of("{\"id\": 1, \"result\": \"/out/a.png\"}"));

        List<String> paths = client.exportAsset(new WorkerExportRequest(
                1, OptionalLong.empty(), ExportAsset.of(ExportScale.ONE), "a", "/out")).join();

        assertEquals(List.of("/out/a.png"), paths);
    }

    @Test
    void copyAndDeleteSendTheirParams() throws Exception {
        transport.respondWith(text -> {
            try {
                return Optional.of("{\"id\": " + mapper.readTree(text).get("id").longValue() + ", \"result\": null}");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        client.copyFile("/a.png", "/b.png").join();
        JsonNode copy = lastRequest();
        assertEquals("copyFile", copy.get("method").asText());
        assertEquals("/b.png", copy.get("params").get("targetPath").asText());

        client.deleteFiles(List.of("/a.png", "/b.png")).join();
        JsonNode delete = lastRequest();
        assertEquals("deleteFiles", delete.get("method").asText());
        assertEquals(2, delete.get("params").get("filePaths").size());
    }

    @Test
    void workerErrorFailsCallWithItsMessage() throws Exception {
        CompletableFuture<Void> copy = client.copyFile("/a", "/b");
        long id = lastRequest().get("id").longValue();

        transport.injectText("{\"id\": " + id + ", \"error\": {\"message\": \"permission denied\"}}");

        WorkerCallException e = assertInstanceOf(WorkerCallException.class, causeOf(copy));
        assertEquals("permission denied", e.getMessage());
    }

    @Test
    void callTimesOutAfterRequestTimeout() {
        CompletableFuture<Void> copy = client.copyFile("/a", "/b");

        scheduler.advanceMillis(REQUEST_TIMEOUT.toMillis() - 1);
        assertFalse(copy.isDone());

        scheduler.advanceMillis(1);
        assertInstanceOf(WorkerConnectionException.class, causeOf(copy));
        assertEquals(0, client.pendingCalls());
    }

    @Test
    void responsesAreCorrelatedById() throws Exception {
        CompletableFuture<Void> first = client.copyFile("/1", "/x");
        long firstId = lastRequest().get("id").longValue();
        CompletableFuture<Void> second = client.copyFile("/2", "/x");
        long secondId = lastRequest().get("id").longValue();

        transport.injectText("{\"id\": " + secondId + ", \"result\": null}");
        assertTrue(second.isDone());
        assertFalse(first.isDone());

        transport.injectText("{\"id\": " + firstId + ", \"result\": null}");
        first.join();
    }

    @Test
    void malformedAndUnknownMessagesAreReportedAndDropped() {
        CompletableFuture<Void> copy = client.copyFile("/a", "/b");

        transport.injectText("garbage");
        transport.injectText("{\"id\": 999, \"result\": null}");

        assertFalse(copy.isDone());
        assertEquals(2, sink.errors(ExportErrorEvent.Severity.WARNING).size());
    }

    @Test
    void transportDropFailsPendingCallsAndNotifiesListener() {
        AtomicReference<Throwable> notified = new AtomicReference<>();
        client.onDisconnect(notified::set);
        CompletableFuture<Void> copy = client.copyFile("/a", "/b");
        IllegalStateException cause = new IllegalStateException("reset by peer");

        transport.drop(cause);

        assertInstanceOf(WorkerConnectionException.class, causeOf(copy));
        assertSame(cause, notified.get());
        assertFalse(client.isOpen());
    }

    @Test
    void sendOnClosedTransportFailsCall() {
        client.close().join();

        assertTrue(transport.wasClosed());
        assertInstanceOf(WorkerConnectionException.class, causeOf(client.copyFile("/a", "/b")));
        assertEquals(0, client.pendingCalls());
    }

    @Test
    void closeFailsPendingCalls() {
        CompletableFuture<Void> copy = client.copyFile("/a", "/b");

        client.close().join();

        assertInstanceOf(WorkerConnectionException.class, causeOf(copy));
    }
}
