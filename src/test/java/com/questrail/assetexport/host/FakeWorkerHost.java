package com.questrail.assetexport.host;

import java.util.concurrent.CompletableFuture;

/**
 * Worker feature flag. Enabling runs an optional hook, e.g. to publish a port.
 */
public final class FakeWorkerHost implements WorkerHost {

    private boolean enabled;
    private boolean failQuery;
    private Runnable onEnable = () -> {};
    private int queries;
    private int enables;

    public FakeWorkerHost(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public synchronized CompletableFuture<Boolean> isWorkerEnabled() {
        queries++;
        if (failQuery) {
            return CompletableFuture.failedFuture(new IllegalStateException("status unavailable"));
        }
        return CompletableFuture.completedFuture(enabled);
    }

    @Override
    public CompletableFuture<Void> setWorkerEnabled(boolean enabled) {
        Runnable hook;
        synchronized (this) {
            enables++;
            this.enabled = enabled;
            hook = onEnable;
        }
        if (enabled) {
            hook.run();
        }
        return CompletableFuture.completedFuture(null);
    }

    public synchronized FakeWorkerHost failQueries() {
        failQuery = true;
        return this;
    }

    public synchronized FakeWorkerHost onEnable(Runnable hook) {
        onEnable = hook;
        return this;
    }

    public synchronized int queryCount() {
        return queries;
    }

    public synchronized int enableCount() {
        return enables;
    }

    public synchronized boolean enabled() {
        return enabled;
    }
}
