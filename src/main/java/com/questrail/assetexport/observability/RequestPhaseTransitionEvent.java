package com.questrail.assetexport.observability;

import com.questrail.assetexport.internal.exec.ExportRequestPhase;

import java.time.Instant;

/**
 * A single export request moved from one phase to the next.
 */
public record RequestPhaseTransitionEvent(
    Instant timestamp,
    long requestId,
    long documentId,
    ExportRequestPhase from,
    ExportRequestPhase to
) {
    /**
     * Whether the request has ended (normally or not).
     */
    public boolean isTerminal() {
        return to.isTerminal();
    }
}
