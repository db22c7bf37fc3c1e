package com.questrail.assetexport.observability;

import java.time.Instant;

/**
 * Snapshot of the worker service flags after a change.
 */
public record ServiceStatusEvent(
    Instant timestamp,
    boolean available,
    boolean busy
) {
}
