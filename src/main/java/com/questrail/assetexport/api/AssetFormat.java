package com.questrail.assetexport.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Output encodings the rendering worker understands.
 */
public enum AssetFormat
{
    PNG,
    JPG,
    SVG,
    PDF;

    /**
     * Identifier used on the worker wire and in persisted metadata.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AssetFormat> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (AssetFormat f : values()) {
            if (f.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
