package com.questrail.assetexport.host;

import java.util.Objects;

/**
 * Undo/history state to create alongside a metadata write.
 *
 * @param name       user-visible name of the history state
 * @param documentId document the state belongs to
 */
public record HistoryEntry(String name, long documentId)
{
    public HistoryEntry {
        Objects.requireNonNull(name, "name");
    }
}
