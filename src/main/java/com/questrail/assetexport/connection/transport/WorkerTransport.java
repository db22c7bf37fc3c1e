package com.questrail.assetexport.connection.transport;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * WorkerTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a message-oriented connection to the rendering worker.
 *
 * <p>An instance represents at most one connection. A failed or closed
 * transport is discarded and a new one created for the next attempt.</p>
 */
public interface WorkerTransport
{
    /**
     * Connect to the worker.
     *
     * <p>The future completes once the connection is usable for
     * {@link #sendText(String)}; the listener is notified via
     * {@link WorkerTransportListener#onTransportUp()} at the same point.</p>
     *
     * @param host    worker host
     * @param port    worker port, as discovered from the preferences
     * @param timeout limit for connecting and upgrading
     */
    CompletableFuture<Void> open(String host, int port, Duration timeout);

    /**
     * Send one complete text message.
     *
     * @return a future completing when the message was written, or failing if
     *         the transport is not connected
     */
    CompletableFuture<Void> sendText(String message);

    /**
     * Close the connection and release its resources. Safe to call when never opened.
     */
    CompletableFuture<Void> close();

    boolean isOpen();

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     * Must be called before {@link #open(String, int, Duration)}.
     */
    void setListener(WorkerTransportListener listener);
}
