package com.questrail.assetexport.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.assetexport.api.ExportAsset;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * JSON projection of export assets as persisted in document metadata.
 *
 * <pre>
 *   document: {"exportAssets": [asset, ...]}
 *   layer:    {"exportAssets": [asset, ...], "exportEnabled": true}
 *   asset:    {"scale": 2, "format": "png", "suffix": "@2x", "status": "stable", "filePath": "..."}
 * </pre>
 */
public final class ExportsMetadataCodec
{
    private final ObjectMapper mapper;

    public ExportsMetadataCodec() {
        this(new ObjectMapper());
    }

    public ExportsMetadataCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encodeDocument(List<ExportAsset> rootExports) {
        ObjectNode root = mapper.createObjectNode();
        writeAssets(root.putArray("exportAssets"), rootExports);
        return write(root);
    }

    public String encodeLayer(List<ExportAsset> layerExports, boolean exportEnabled) {
        ObjectNode root = mapper.createObjectNode();
        writeAssets(root.putArray("exportAssets"), layerExports);
        root.put("exportEnabled", exportEnabled);
        return write(root);
    }

    private static void writeAssets(ArrayNode array, List<ExportAsset> assets) {
        for (ExportAsset asset : assets) {
            ObjectNode node = array.addObject();
            node.put("scale", asset.scale().multiplier());
            node.put("format", asset.format().wireName());
            node.put("suffix", asset.suffix());
            node.put("status", asset.status().name().toLowerCase(Locale.ROOT));
            node.put("filePath", asset.filePath());
        }
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode export metadata", e);
        }
    }
}
