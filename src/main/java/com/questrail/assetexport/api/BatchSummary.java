package com.questrail.assetexport.api;

/**
 * Aggregate result of one settled batch.
 *
 * @param batchId   identifier of the batch (0 when no batch ran)
 * @param taskCount number of asset tasks launched
 * @param succeeded tasks that produced a file
 * @param failed    tasks recorded as {@link AssetStatus#ERROR}
 */
public record BatchSummary(long batchId, int taskCount, int succeeded, int failed)
{
    private static final BatchSummary NONE = new BatchSummary(0, 0, 0, 0);

    public static BatchSummary none() {
        return NONE;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
