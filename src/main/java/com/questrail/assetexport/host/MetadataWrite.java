package com.questrail.assetexport.host;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * MetadataWrite
 * -----------------------------------------------------------------------------
 * One extension-data write: a JSON document stored under
 * {@code (namespace, key)} on a document, or on one of its layers.
 *
 * @param documentId owning document
 * @param layerId    target layer; empty for document-level data
 * @param namespace  extension-data namespace
 * @param key        key within the namespace
 * @param json       serialized JSON value (the store treats it as opaque)
 */
public record MetadataWrite(
        long documentId,
        OptionalLong layerId,
        String namespace,
        String key,
        String json
) {
    public MetadataWrite {
        Objects.requireNonNull(layerId, "layerId");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(json, "json");
    }

    public boolean isDocumentLevel() {
        return layerId.isEmpty();
    }
}
