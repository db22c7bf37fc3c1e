package com.questrail.assetexport.host;

import java.util.concurrent.CompletableFuture;

/**
 * WorkerHost
 * -----------------------------------------------------------------------------
 * The host-side feature flag that runs the rendering worker.
 *
 * <p>Enabling is <strong>not synchronous</strong>: the returned future
 * completes once the flag is set, but the worker may need several seconds to
 * bind its listening port and publish it in the preferences.</p>
 */
public interface WorkerHost
{
    CompletableFuture<Boolean> isWorkerEnabled();

    CompletableFuture<Void> setWorkerEnabled(boolean enabled);
}
