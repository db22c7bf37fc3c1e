package com.questrail.assetexport.internal.exec;

/**
 * Phases of one export request.
 *
 * <pre>
 *   IDLE -> RESOLVING_TARGETS -> ENSURING_DEFAULT_ASSETS -> AWAITING_FOLDER -> EXPORTING -> IDLE
 *                                                                  |
 *                                                                  +-> ABORTED (no folder chosen, or a step failed)
 *   IDLE -> REJECTED (another batch is active)
 * </pre>
 */
public enum ExportRequestPhase
{
    IDLE,
    RESOLVING_TARGETS,
    ENSURING_DEFAULT_ASSETS,
    AWAITING_FOLDER,
    EXPORTING,
    ABORTED,
    REJECTED;

    /**
     * Whether a request in this phase has ended. {@link #IDLE} counts: a
     * request only returns there once its batch has settled.
     */
    public boolean isTerminal() {
        return this == IDLE || this == ABORTED || this == REJECTED;
    }
}
