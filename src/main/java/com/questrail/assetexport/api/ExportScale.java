package com.questrail.assetexport.api;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * ExportScale
 * -----------------------------------------------------------------------------
 * The fixed set of scale multipliers an {@link ExportAsset} may carry.
 *
 * <p>Declaration order is the <em>defined order</em> used by the default-asset
 * policy: when a new asset is created without explicit properties, the first
 * scale in this order that is not already present on the target wins.</p>
 */
public enum ExportScale
{
    HALF("0.5"),
    ONE("1"),
    ONE_AND_HALF("1.5"),
    TWO("2"),
    THREE("3"),
    FOUR("4");

    private static final List<ExportScale> DEFINED_ORDER = List.of(values());

    private final BigDecimal multiplier;
    private final String label;

    ExportScale(String label) {
        this.label = label;
        this.multiplier = new BigDecimal(label);
    }

    /**
     * Rational multiplier applied by the worker when rendering.
     */
    public BigDecimal multiplier() {
        return multiplier;
    }

    /**
     * Compact textual form, e.g. {@code "1.5"}.
     */
    public String label() {
        return label;
    }

    /**
     * Filename suffix derived from this scale: empty for 1x, otherwise
     * {@code "@<label>x"}.
     */
    public String defaultSuffix() {
        return this == ONE ? "" : "@" + label + "x";
    }

    /**
     * All scales in defined order.
     */
    public static List<ExportScale> definedOrder() {
        return DEFINED_ORDER;
    }

    /**
     * The smallest defined scale; fallback when every scale is already in use.
     */
    public static ExportScale smallest() {
        return DEFINED_ORDER.get(0);
    }

    /**
     * Resolves a numeric multiplier to a defined scale.
     *
     * @return the matching scale, or empty if the value is not in the fixed set
     */
    public static Optional<ExportScale> of(BigDecimal value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.multiplier.compareTo(value) == 0)
                .findFirst();
    }

    public static Optional<ExportScale> of(double value) {
        return of(BigDecimal.valueOf(value));
    }
}
