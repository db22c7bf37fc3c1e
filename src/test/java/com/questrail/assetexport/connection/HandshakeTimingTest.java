package com.questrail.assetexport.connection;

import com.questrail.assetexport.api.WorkerConnectionException;
import com.questrail.assetexport.connection.transport.FakeWorkerTransport;
import com.questrail.assetexport.host.FakePreferenceStore;
import com.questrail.assetexport.host.FakeWorkerHost;
import com.questrail.assetexport.internal.time.ScheduledExecutorScheduler;
import com.questrail.assetexport.internal.time.SystemMonotonicClock;
import com.questrail.assetexport.internal.time.SystemWallClock;
import com.questrail.assetexport.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandshakeTimingTest
 * -----------------------------------------------------------------------------
 * Settle delay and request timeouts on the production scheduler.
 *
 * Note: These tests use real time. Delays are short and the upper bounds
 * generous so loaded machines do not produce false failures.
 */
class HandshakeTimingTest {

    private static final String SETTINGS_KEY = "workerSettings";
    private static final String PORT_JSON = "{\"websocketServerPort\": 4100}";

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakePreferenceStore preferences = new FakePreferenceStore();
    private final List<FakeWorkerTransport> transports = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ExportWorkerClient client(FakeWorkerTransport transport, Duration requestTimeout) {
        return new ExportWorkerClient(transport, new WorkerMessageCodec(), scheduler, SystemMonotonicClock.INSTANCE,
                SystemWallClock.INSTANCE, requestTimeout, sink);
    }

    private ServiceConnection connection(Duration settleDelay) {
        HandshakePolicy policy = HandshakePolicy.defaults().withSettleDelay(settleDelay);
        FakeWorkerHost host = new FakeWorkerHost(false).onEnable(() -> preferences.set(SETTINGS_KEY, PORT_JSON));
        return new ServiceConnection(policy, false, "127.0.0.1", host,
                new WorkerPortResolver(preferences, SETTINGS_KEY),
                () -> {
                    FakeWorkerTransport transport = new FakeWorkerTransport();
                    transports.add(transport);
                    return client(transport, policy.requestTimeout());
                },
                scheduler, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, sink);
    }

    @Test
    void portIsReadOnlyAfterTheSettleDelay() throws Exception {
        ServiceConnection connection = connection(Duration.ofMillis(60));
        long before = System.nanoTime();

        CompletableFuture<Boolean> connected = connection.connect();
        assertTrue(transports.isEmpty(), "no client before the worker has settled");

        assertTrue(connected.get(1, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - before >= TimeUnit.MILLISECONDS.toNanos(60));
        assertEquals(1, transports.size());
        assertTrue(connection.isReady());
    }

    @Test
    void zeroSettleDelayConnectsPromptly() throws Exception {
        ServiceConnection connection = connection(Duration.ZERO);

        assertTrue(connection.connect().get(500, TimeUnit.MILLISECONDS));
        assertTrue(connection.isReady());
    }

    @Test
    void closeDuringSettleDelayIsNotUndoneWhenTheDelayEnds() throws Exception {
        ServiceConnection connection = connection(Duration.ofMillis(60));

        CompletableFuture<Boolean> connected = connection.connect();
        connection.close().join();

        assertFalse(connected.get(1, TimeUnit.SECONDS));
        assertFalse(connection.isReady());
        assertTrue(transports.isEmpty());
    }

    @Test
    void unansweredCallFailsAfterRequestTimeout() throws Exception {
        FakeWorkerTransport transport = new FakeWorkerTransport();
        ExportWorkerClient client = client(transport, Duration.ofMillis(50));
        client.connect("127.0.0.1", 4100, Duration.ofSeconds(1)).join();

        CompletableFuture<Void> copy = client.copyFile("/a.png", "/b.png");

        ExecutionException e = assertThrows(ExecutionException.class, () -> copy.get(1, TimeUnit.SECONDS));
        assertInstanceOf(WorkerConnectionException.class, e.getCause());
        assertEquals(0, client.pendingCalls());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                scheduler.delay(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE));
    }
}
