package com.questrail.assetexport.registry;

import com.questrail.assetexport.api.AssetFormat;
import com.questrail.assetexport.api.AssetNotFoundException;
import com.questrail.assetexport.api.AssetUpdate;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportScale;
import com.questrail.assetexport.api.ExportTarget;
import com.questrail.assetexport.api.MetadataSyncException;
import com.questrail.assetexport.api.TargetResolutionException;
import com.questrail.assetexport.api.UpdateOptions;
import com.questrail.assetexport.host.FakeDocument;
import com.questrail.assetexport.host.FakeDocumentStore;
import com.questrail.assetexport.host.FakeLayer;
import com.questrail.assetexport.host.FakeMetadataStore;
import com.questrail.assetexport.internal.time.WallClock;
import com.questrail.assetexport.observability.ExportErrorEvent;
import com.questrail.assetexport.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ExportAssetServiceTest {

    private static final long DOC = 1;

    private final ExportAssetRegistry registry = new ExportAssetRegistry();
    private final FakeDocumentStore documents = new FakeDocumentStore();
    private final FakeMetadataStore metadata = new FakeMetadataStore();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private FakeDocument document;
    private ExportAssetService service;

    @BeforeEach
    void setUp() {
        document = new FakeDocument(DOC, "poster",
                FakeLayer.artboard(10, "Board"),
                FakeLayer.layer(11, "Icon"),
                FakeLayer.layer(12, "Logo"),
                FakeLayer.unexportable(13, "Adjustment"));
        documents.add(document);
        MetadataSynchronizer synchronizer = new MetadataSynchronizer(registry, documents, metadata,
                new ExportsMetadataCodec(), "exports", "assets", "Export settings");
        service = new ExportAssetService(registry, synchronizer, documents, sink, (WallClock) () -> Instant.EPOCH);
    }

    private List<ExportAsset> layer(long id) {
        return registry.documentExports(DOC).layerExports(id);
    }

    private static Throwable causeOf(Runnable join) {
        return assertThrows(CompletionException.class, join::run).getCause();
    }

    // ---------------------------------------------------------------------
    // addAsset
    // ---------------------------------------------------------------------

    @Test
    void addDefaultToDocumentRootPicksFirstUnusedScale() {
        ExportTarget root = ExportTarget.root(DOC);

        service.addAsset(root, Optional.empty()).join();
        service.addAsset(root, Optional.empty()).join();

        List<ExportAsset> exports = registry.documentExports(DOC).rootExports();
        assertEquals(List.of(ExportScale.HALF, ExportScale.ONE), List.of(exports.get(0).scale(), exports.get(1).scale()));
        assertEquals(2, metadata.batches().size());
        assertTrue(metadata.lastBatch().history().isPresent());
    }

    @Test
    void addToLayersInsertsAfterUniformPrefixAndEnablesExport() {
        service.addAsset(ExportTarget.layer(DOC, 11), Optional.of(List.of(
                ExportAsset.of(ExportScale.ONE), ExportAsset.of(ExportScale.TWO)))).join();
        service.addAsset(ExportTarget.layer(DOC, 12), Optional.of(List.of(
                ExportAsset.of(ExportScale.ONE), ExportAsset.of(ExportScale.THREE)))).join();

        service.addAsset(ExportTarget.layers(DOC, List.of(11L, 12L)), Optional.empty()).join();

        // uniform prefix is [1x]; default scale given {1x} is 0.5x, inserted at index 1
        assertEquals(ExportScale.HALF, layer(11).get(1).scale());
        assertEquals(ExportScale.TWO, layer(11).get(2).scale());
        assertEquals(ExportScale.HALF, layer(12).get(1).scale());
        assertEquals(ExportScale.THREE, layer(12).get(2).scale());

        assertTrue(document.fakeLayer(11).exportEnabled());
        assertTrue(document.fakeLayer(12).exportEnabled());
    }

    @Test
    void addToLayersSkipsUnexportableLayers() {
        service.addAsset(ExportTarget.layers(DOC, List.of(11L, 13L)), Optional.empty()).join();

        assertEquals(1, layer(11).size());
        assertTrue(layer(13).isEmpty());
        assertEquals(List.of(11L), documents.flagWrites().get(0).layerIds());
    }

    @Test
    void addToOnlyUnexportableLayersIsNoOp() {
        service.addAsset(ExportTarget.layer(DOC, 13), Optional.empty()).join();

        assertTrue(metadata.batches().isEmpty());
        assertTrue(documents.flagWrites().isEmpty());
    }

    @Test
    void addToMissingLayerFails() {
        Throwable cause = causeOf(() -> service.addAsset(ExportTarget.layer(DOC, 99), Optional.empty()).join());

        assertInstanceOf(TargetResolutionException.class, cause);
    }

    @Test
    void failedFlagWriteIsReportedAndAddProceeds() {
        documents.failFlagWritesWith(new IllegalStateException("read-only layer"));

        service.addAsset(ExportTarget.layer(DOC, 11), Optional.empty()).join();

        assertEquals(1, layer(11).size());
        assertEquals(1, sink.errors(ExportErrorEvent.Severity.WARNING).size());
        assertEquals(1, metadata.batches().size());
    }

    // ---------------------------------------------------------------------
    // addDefaultAsset
    // ---------------------------------------------------------------------

    @Test
    void addDefaultAssetUsesFirstArtboardWithoutHistory() {
        service.addDefaultAsset(DOC, OptionalLong.empty()).join();

        assertEquals(List.of(ExportAsset.of(ExportScale.HALF)), layer(10));
        assertTrue(metadata.lastBatch().history().isEmpty());
        assertTrue(document.fakeLayer(10).exportEnabled());
    }

    @Test
    void addDefaultAssetLeavesConfiguredLayerAlone() {
        service.addAsset(ExportTarget.layer(DOC, 11), Optional.of(List.of(ExportAsset.of(ExportScale.FOUR)))).join();
        int batches = metadata.batches().size();

        service.addDefaultAsset(DOC, OptionalLong.of(11)).join();

        assertEquals(1, layer(11).size());
        assertEquals(batches, metadata.batches().size());
    }

    @Test
    void addDefaultAssetWithoutArtboardIsNoOp() {
        documents.add(new FakeDocument(2, "plain", FakeLayer.layer(20, "Only")));

        service.addDefaultAsset(2, OptionalLong.empty()).join();

        assertTrue(metadata.batches().isEmpty());
    }

    @Test
    void addDefaultAssetForMissingLayerFails() {
        Throwable cause = causeOf(() -> service.addDefaultAsset(DOC, OptionalLong.of(99)).join());

        assertInstanceOf(TargetResolutionException.class, cause);
    }

    // ---------------------------------------------------------------------
    // update / delete
    // ---------------------------------------------------------------------

    @Test
    void scaleUpdateRederivesUntouchedSuffix() {
        ExportTarget root = ExportTarget.root(DOC);
        service.addAsset(root, Optional.of(List.of(ExportAsset.of(ExportScale.TWO)))).join();

        service.updateAssetScale(root, 0, ExportScale.THREE).join();
        assertEquals("@3x", registry.documentExports(DOC).rootExports().get(0).suffix());

        service.updateAssetSuffix(root, 0, "-large").join();
        service.updateAssetScale(root, 0, null).join();

        ExportAsset asset = registry.documentExports(DOC).rootExports().get(0);
        assertEquals(ExportScale.ONE, asset.scale());
        assertEquals("-large", asset.suffix());
    }

    @Test
    void formatUpdateIsPersisted() {
        ExportTarget root = ExportTarget.root(DOC);
        service.addAsset(root, Optional.empty()).join();

        service.updateAssetFormat(root, 0, AssetFormat.JPG).join();

        assertEquals(AssetFormat.JPG, registry.documentExports(DOC).rootExports().get(0).format());
        assertTrue(metadata.lastBatch().writes().get(0).json().contains("\"jpg\""));
    }

    @Test
    void updateOfMissingIndexFails() {
        Throwable cause = causeOf(() -> service.updateAssetScale(ExportTarget.root(DOC), 3, ExportScale.TWO).join());

        MetadataSyncException e = assertInstanceOf(MetadataSyncException.class, cause);
        assertInstanceOf(AssetNotFoundException.class, e.getCause());
    }

    @Test
    void quietUpdateReportsWarningInsteadOfFailing() {
        service.updateAsset(ExportTarget.root(DOC), 3, AssetUpdate.error(), UpdateOptions.quiet()).join();

        assertEquals(1, sink.errors(ExportErrorEvent.Severity.WARNING).size());
    }

    @Test
    void deleteShiftsAndSyncsWithHistory() {
        ExportTarget root = ExportTarget.root(DOC);
        service.addAsset(root, Optional.of(List.of(ExportAsset.of(ExportScale.ONE), ExportAsset.of(ExportScale.TWO)))).join();

        service.deleteAsset(root, 0).join();

        assertEquals(List.of(ExportAsset.of(ExportScale.TWO)), registry.documentExports(DOC).rootExports());
        assertTrue(metadata.lastBatch().history().isPresent());
    }

    // ---------------------------------------------------------------------
    // setLayerExportEnabled
    // ---------------------------------------------------------------------

    @Test
    void enablingLayersWithoutAssetsOnlyAddsDefaults() {
        service.setLayerExportEnabled(DOC, List.of(11L, 12L), true).join();

        assertEquals(1, layer(11).size());
        assertEquals(1, layer(12).size());
        assertEquals(1, documents.flagWrites().size());
        assertEquals(1, metadata.batches().size());
    }

    @Test
    void enablingMixedLayersAddsDefaultsThenWritesFlagAndSyncs() {
        service.addAsset(ExportTarget.layer(DOC, 11), Optional.of(List.of(ExportAsset.of(ExportScale.TWO)))).join();
        document.fakeLayer(11).setExportEnabled(false);
        int batches = metadata.batches().size();

        service.setLayerExportEnabled(DOC, List.of(11L, 12L), true).join();

        assertEquals(1, layer(11).size(), "configured layer keeps its assets");
        assertEquals(1, layer(12).size());
        assertTrue(document.fakeLayer(11).exportEnabled());
        assertEquals(batches + 2, metadata.batches().size());
        assertTrue(metadata.lastBatch().history().isEmpty());
    }

    @Test
    void disablingWritesFlagWithoutAddingAssets() {
        document.fakeLayer(11).setExportEnabled(true);

        service.setLayerExportEnabled(DOC, List.of(11L), false).join();

        assertFalse(document.fakeLayer(11).exportEnabled());
        assertTrue(layer(11).isEmpty());
        assertEquals(1, metadata.batches().size());
    }

    @Test
    void markRequestedSyncsWithoutHistory() {
        service.addAsset(ExportTarget.layer(DOC, 11), Optional.empty()).join();

        service.markRequested(ExportTarget.layer(DOC, 11)).join();

        assertTrue(metadata.lastBatch().history().isEmpty());
        assertTrue(metadata.lastBatch().writes().get(0).json().contains("\"requested\""));
    }
}
