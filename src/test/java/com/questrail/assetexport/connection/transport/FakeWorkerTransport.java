package com.questrail.assetexport.connection.transport;

import com.questrail.assetexport.api.WorkerConnectionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * FakeWorkerTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link WorkerTransport} implementation.
 *
 * <p>It contains no worker semantics; it records outbound messages, lets tests
 * inject inbound messages, and can answer requests synchronously through a
 * responder function.</p>
 */
public final class FakeWorkerTransport implements WorkerTransport {

    public record OpenCall(String host, int port, Duration timeout) {}

    private WorkerTransportListener listener;
    private final List<OpenCall> opens = new ArrayList<>();
    private final List<String> sent = new ArrayList<>();

    private Throwable openFailure;
    private Function<String, Optional<String>> responder = request -> Optional.empty();
    private boolean open;
    private boolean closed;

    @Override
    public void setListener(WorkerTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized CompletableFuture<Void> open(String host, int port, Duration timeout) {
        opens.add(new OpenCall(host, port, timeout));
        if (openFailure != null) {
            return CompletableFuture.failedFuture(openFailure);
        }
        open = true;
        if (listener != null) {
            listener.onTransportUp();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> sendText(String message) {
        Objects.requireNonNull(message, "message");
        Optional<String> reply;
        synchronized (this) {
            if (!open) {
                return CompletableFuture.failedFuture(new WorkerConnectionException("not connected"));
            }
            sent.add(message);
            reply = responder.apply(message);
        }
        reply.ifPresent(this::injectText);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> close() {
        open = false;
        closed = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized FakeWorkerTransport failOpenWith(Throwable failure) {
        this.openFailure = failure;
        return this;
    }

    /**
     * Answers each sent message with the responder's result, if any.
     */
    public synchronized FakeWorkerTransport respondWith(Function<String, Optional<String>> responder) {
        this.responder = Objects.requireNonNull(responder, "responder");
        return this;
    }

    public void injectText(String message) {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onText(message);
    }

    /**
     * Simulates the worker going away.
     */
    public void drop(Throwable cause) {
        synchronized (this) {
            open = false;
        }
        if (listener != null) {
            listener.onTransportDown(cause);
        }
    }

    public synchronized List<OpenCall> opens() {
        return Collections.unmodifiableList(new ArrayList<>(opens));
    }

    public synchronized List<String> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized boolean wasClosed() {
        return closed;
    }
}
