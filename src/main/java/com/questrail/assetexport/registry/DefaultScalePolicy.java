package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportScale;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Picks the scale of an asset created without explicit settings: the first
 * scale in defined order that the existing assets do not use yet, or the
 * smallest scale once every scale is taken.
 */
public final class DefaultScalePolicy
{
    private DefaultScalePolicy() {}

    public static ExportScale nextScale(Collection<ExportAsset> existing) {
        Set<ExportScale> used = EnumSet.noneOf(ExportScale.class);
        for (ExportAsset asset : existing) {
            used.add(asset.scale());
        }
        for (ExportScale scale : ExportScale.definedOrder()) {
            if (!used.contains(scale)) {
                return scale;
            }
        }
        return ExportScale.smallest();
    }

    public static ExportAsset defaultAsset(Collection<ExportAsset> existing) {
        return ExportAsset.of(nextScale(existing));
    }
}
