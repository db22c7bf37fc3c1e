package com.questrail.assetexport.api;

import java.util.Objects;

/**
 * ExportAsset
 * -----------------------------------------------------------------------------
 * One configured export target: a scale, an output format and a filename
 * suffix, plus the status of its most recent export.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@link AssetStatus#STABLE} always carries a non-empty {@code filePath}</li>
 *   <li>{@link AssetStatus#ERROR} always carries an empty {@code filePath}</li>
 * </ul>
 *
 * <p>Instances are immutable. Partial changes go through {@link AssetUpdate}.</p>
 */
public record ExportAsset(
        ExportScale scale,
        AssetFormat format,
        String suffix,
        AssetStatus status,
        String filePath
) {
    public ExportAsset {
        Objects.requireNonNull(scale, "scale");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(suffix, "suffix");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(filePath, "filePath");

        if (status == AssetStatus.STABLE && filePath.isEmpty()) {
            throw new IllegalArgumentException("STABLE asset requires a file path");
        }
        if (status == AssetStatus.ERROR && !filePath.isEmpty()) {
            throw new IllegalArgumentException("ERROR asset must not carry a file path");
        }
    }

    /**
     * A fresh PNG asset at the given scale with the derived suffix.
     */
    public static ExportAsset of(ExportScale scale) {
        return of(scale, AssetFormat.PNG);
    }

    public static ExportAsset of(ExportScale scale, AssetFormat format) {
        return new ExportAsset(scale, format, scale.defaultSuffix(), AssetStatus.QUEUED, "");
    }

    /**
     * Whether the suffix is still the one derived from the scale.
     */
    public boolean hasDerivedSuffix() {
        return suffix.equals(scale.defaultSuffix());
    }

    public ExportAsset withStatus(AssetStatus newStatus) {
        return new ExportAsset(scale, format, suffix, newStatus, filePath);
    }

    /**
     * Same configuration, ignoring status and path. Used to detect assets that
     * are shared uniformly across several layers.
     */
    public boolean sameConfiguration(ExportAsset other) {
        return other != null
                && scale == other.scale
                && format == other.format
                && suffix.equals(other.suffix);
    }
}
