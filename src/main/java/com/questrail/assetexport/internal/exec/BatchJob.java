package com.questrail.assetexport.internal.exec;

import com.questrail.assetexport.api.BatchSummary;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The export batch currently in flight.
 *
 * @param id         batch identifier, unique per coordinator
 * @param taskCount  number of asset tasks in the batch
 * @param completion completes with the summary once every task has settled
 */
record BatchJob(long id, int taskCount, CompletableFuture<BatchSummary> completion)
{
    BatchJob {
        Objects.requireNonNull(completion, "completion");
    }
}
