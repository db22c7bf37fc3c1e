package com.questrail.assetexport.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExportAssetTest {

    @Test
    void newAssetIsQueuedPngWithDerivedSuffix() {
        ExportAsset asset = ExportAsset.of(ExportScale.TWO);

        assertEquals(AssetFormat.PNG, asset.format());
        assertEquals("@2x", asset.suffix());
        assertEquals(AssetStatus.QUEUED, asset.status());
        assertEquals("", asset.filePath());
        assertTrue(asset.hasDerivedSuffix());
    }

    @Test
    void stableRequiresPath() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExportAsset(ExportScale.ONE, AssetFormat.PNG, "", AssetStatus.STABLE, ""));
    }

    @Test
    void errorMustNotCarryPath() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExportAsset(ExportScale.ONE, AssetFormat.PNG, "", AssetStatus.ERROR, "/tmp/a.png"));
    }

    @Test
    void sameConfigurationIgnoresStatusAndPath() {
        ExportAsset queued = ExportAsset.of(ExportScale.TWO);
        ExportAsset stable = new ExportAsset(ExportScale.TWO, AssetFormat.PNG, "@2x", AssetStatus.STABLE, "/out/a@2x.png");

        assertTrue(queued.sameConfiguration(stable));
        assertFalse(queued.sameConfiguration(ExportAsset.of(ExportScale.TWO, AssetFormat.JPG)));
        assertFalse(queued.sameConfiguration(null));
    }

    @Test
    void formatWireNamesAreLowerCase() {
        assertEquals("jpg", AssetFormat.JPG.wireName());
        assertEquals(AssetFormat.SVG, AssetFormat.fromWireName(" SVG ").orElseThrow());
        assertTrue(AssetFormat.fromWireName("gif").isEmpty());
    }
}
