package com.questrail.assetexport.api;

import java.util.Objects;
import java.util.Optional;

/**
 * AssetUpdate
 * -----------------------------------------------------------------------------
 * Typed partial update of an {@link ExportAsset}. Fields left empty are never
 * touched by {@link #applyTo(ExportAsset)}.
 *
 * <h2>Merge rules</h2>
 * <ul>
 *   <li>A scale change re-derives the suffix unless the suffix was overridden
 *       (either on the current asset or in this update).</li>
 *   <li>{@link AssetStatus#ERROR} clears the path.</li>
 *   <li>{@link AssetStatus#STABLE} requires a path, supplied here or already
 *       present; otherwise the merge is rejected.</li>
 * </ul>
 */
public final class AssetUpdate
{
    private static final AssetUpdate EMPTY = builder().build();

    private final ExportScale scale;
    private final AssetFormat format;
    private final String suffix;
    private final AssetStatus status;
    private final String filePath;

    private AssetUpdate(Builder b) {
        this.scale = b.scale;
        this.format = b.format;
        this.suffix = b.suffix;
        this.status = b.status;
        this.filePath = b.filePath;
    }

    public static AssetUpdate empty() {
        return EMPTY;
    }

    public static AssetUpdate scale(ExportScale scale) {
        return builder().scale(scale).build();
    }

    public static AssetUpdate format(AssetFormat format) {
        return builder().format(format).build();
    }

    public static AssetUpdate suffix(String suffix) {
        return builder().suffix(suffix).build();
    }

    /**
     * Outcome of a successful export.
     */
    public static AssetUpdate stable(String filePath) {
        return builder().status(AssetStatus.STABLE).filePath(filePath).build();
    }

    /**
     * Outcome of a failed export.
     */
    public static AssetUpdate error() {
        return builder().status(AssetStatus.ERROR).filePath("").build();
    }

    public Optional<ExportScale> scale() { return Optional.ofNullable(scale); }
    public Optional<AssetFormat> format() { return Optional.ofNullable(format); }
    public Optional<String> suffix() { return Optional.ofNullable(suffix); }
    public Optional<AssetStatus> status() { return Optional.ofNullable(status); }
    public Optional<String> filePath() { return Optional.ofNullable(filePath); }

    public boolean isEmpty() {
        return scale == null && format == null && suffix == null && status == null && filePath == null;
    }

    /**
     * Merges this update into {@code asset}.
     *
     * @throws IllegalArgumentException if the merged asset would violate the
     *         {@link ExportAsset} invariants
     */
    public ExportAsset applyTo(ExportAsset asset) {
        Objects.requireNonNull(asset, "asset");

        ExportScale newScale = scale != null ? scale : asset.scale();
        AssetFormat newFormat = format != null ? format : asset.format();

        String newSuffix;
        if (suffix != null) {
            newSuffix = suffix;
        } else if (scale != null && asset.hasDerivedSuffix()) {
            newSuffix = newScale.defaultSuffix();
        } else {
            newSuffix = asset.suffix();
        }

        AssetStatus newStatus = status != null ? status : asset.status();
        String newPath = filePath != null ? filePath : asset.filePath();
        if (newStatus == AssetStatus.ERROR) {
            newPath = "";
        }

        return new ExportAsset(newScale, newFormat, newSuffix, newStatus, newPath);
    }

    @Override
    public String toString() {
        return "AssetUpdate{scale=" + scale + ", format=" + format + ", suffix=" + suffix
                + ", status=" + status + ", filePath=" + filePath + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExportScale scale;
        private AssetFormat format;
        private String suffix;
        private AssetStatus status;
        private String filePath;

        public Builder scale(ExportScale scale) {
            this.scale = Objects.requireNonNull(scale, "scale");
            return this;
        }

        public Builder format(AssetFormat format) {
            this.format = Objects.requireNonNull(format, "format");
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = Objects.requireNonNull(suffix, "suffix");
            return this;
        }

        public Builder status(AssetStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = Objects.requireNonNull(filePath, "filePath");
            return this;
        }

        public AssetUpdate build() {
            return new AssetUpdate(this);
        }
    }
}
