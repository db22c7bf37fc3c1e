package com.questrail.assetexport.observability;

import java.time.Instant;

/**
 * An error or anomaly in the export core.
 *
 * @param severity {@link Severity#WARNING} for failures that were deliberately
 *                 suppressed, {@link Severity#ERROR} otherwise
 */
public record ExportErrorEvent(
    Instant timestamp,
    Severity severity,
    String message,
    Throwable cause
) {
    public enum Severity {
        WARNING,
        ERROR
    }
}
