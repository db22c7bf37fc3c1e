package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportScale;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultScalePolicyTest {

    @Test
    void picksHalfWhenOneAndTwoExist() {
        List<ExportAsset> existing = List.of(ExportAsset.of(ExportScale.ONE), ExportAsset.of(ExportScale.TWO));

        assertEquals(ExportScale.HALF, DefaultScalePolicy.nextScale(existing));
    }

    @Test
    void picksFirstUnusedInDefinedOrder() {
        List<ExportAsset> existing = List.of(ExportAsset.of(ExportScale.HALF), ExportAsset.of(ExportScale.ONE));

        assertEquals(ExportScale.ONE_AND_HALF, DefaultScalePolicy.nextScale(existing));
    }

    @Test
    void fallsBackToSmallestWhenAllUsed() {
        List<ExportAsset> existing = new ArrayList<>();
        for (ExportScale scale : ExportScale.definedOrder()) {
            existing.add(ExportAsset.of(scale));
        }

        assertEquals(ExportScale.smallest(), DefaultScalePolicy.nextScale(existing));
    }

    @Test
    void defaultAssetIsQueuedWithDerivedSuffix() {
        ExportAsset asset = DefaultScalePolicy.defaultAsset(List.of());

        assertEquals(ExportAsset.of(ExportScale.HALF), asset);
    }
}
