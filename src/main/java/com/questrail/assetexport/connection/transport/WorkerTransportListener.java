package com.questrail.assetexport.connection.transport;

/**
 * Callback sink for {@link WorkerTransport}.
 *
 * <p>Callbacks are delivered serially per transport instance (Netty delivers
 * them on the channel's event loop).</p>
 */
public interface WorkerTransportListener
{
    /**
     * The connection became usable.
     */
    void onTransportUp();

    /**
     * The connection became unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete text message arrived.
     */
    void onText(String message);
}
