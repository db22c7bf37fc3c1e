package com.questrail.assetexport.api;

/**
 * Flags for an asset update.
 *
 * @param suppressHistory do not create an undo/history entry for the metadata write
 * @param suppressErrors  report failures to the observability sink and complete
 *                        normally instead of failing the returned future
 */
public record UpdateOptions(boolean suppressHistory, boolean suppressErrors)
{
    private static final UpdateOptions DEFAULTS = new UpdateOptions(false, false);
    private static final UpdateOptions QUIET = new UpdateOptions(true, true);

    /** History entry created, errors propagated. */
    public static UpdateOptions defaults() {
        return DEFAULTS;
    }

    /** No history entry, errors swallowed. Used for post-export status updates. */
    public static UpdateOptions quiet() {
        return QUIET;
    }
}
