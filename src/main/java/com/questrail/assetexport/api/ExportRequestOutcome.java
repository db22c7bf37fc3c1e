package com.questrail.assetexport.api;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * ExportRequestOutcome
 * -----------------------------------------------------------------------------
 * What happened to an export request once its folder step is over.
 *
 * <p>{@link Disposition#STARTED} carries the number of launched tasks and a
 * future that completes when all of them have settled. The other dispositions
 * carry an already-completed, empty summary.</p>
 */
public record ExportRequestOutcome(
        Disposition disposition,
        int taskCount,
        CompletableFuture<BatchSummary> completion
) {
    public enum Disposition
    {
        /** Tasks were launched as a batch. */
        STARTED,
        /** The user declined to choose a folder; nothing was exported. */
        CANCELLED,
        /** The worker is not connected; nothing was attempted. */
        SERVICE_UNAVAILABLE
    }

    public ExportRequestOutcome {
        Objects.requireNonNull(disposition, "disposition");
        Objects.requireNonNull(completion, "completion");
    }

    public static ExportRequestOutcome started(int taskCount, CompletableFuture<BatchSummary> completion) {
        return new ExportRequestOutcome(Disposition.STARTED, taskCount, completion);
    }

    public static ExportRequestOutcome cancelled() {
        return new ExportRequestOutcome(Disposition.CANCELLED, 0,
                CompletableFuture.completedFuture(BatchSummary.none()));
    }

    public static ExportRequestOutcome serviceUnavailable() {
        return new ExportRequestOutcome(Disposition.SERVICE_UNAVAILABLE, 0,
                CompletableFuture.completedFuture(BatchSummary.none()));
    }
}
