package com.questrail.assetexport.api;

import java.util.Collection;
import java.util.List;

/**
 * ExportTarget
 * -----------------------------------------------------------------------------
 * Addresses one asset list (the document root) or several parallel lists (a set
 * of layers) inside a document. Operations on a {@link Layers} target apply to
 * every listed layer at the same index.
 */
public sealed interface ExportTarget
        permits ExportTarget.DocumentRoot, ExportTarget.Layers
{
    long documentId();

    static DocumentRoot root(long documentId) {
        return new DocumentRoot(documentId);
    }

    static Layers layers(long documentId, Collection<Long> layerIds) {
        return new Layers(documentId, List.copyOf(layerIds));
    }

    static Layers layer(long documentId, long layerId) {
        return new Layers(documentId, List.of(layerId));
    }

    /** Document-level asset list. */
    record DocumentRoot(long documentId) implements ExportTarget {}

    /** One or more layer-level asset lists. */
    record Layers(long documentId, List<Long> layerIds) implements ExportTarget {
        public Layers {
            layerIds = List.copyOf(layerIds);
            if (layerIds.isEmpty()) {
                throw new IllegalArgumentException("layerIds must not be empty");
            }
        }
    }
}
