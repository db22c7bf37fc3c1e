package com.questrail.assetexport.host;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an open document.
 *
 * <p>Views may be snapshots. Callers that need fresh state re-fetch the
 * document from {@link DocumentStore} rather than hold on to an instance.</p>
 */
public interface DocumentView
{
    long id();

    /**
     * Document name without its file extension; empty if the document was never saved.
     */
    String nameWithoutExtension();

    Optional<LayerView> layer(long layerId);

    /**
     * The subset of {@code layers} that can be exported, in input order.
     */
    List<LayerView> filterExportable(Collection<LayerView> layers);

    /**
     * All layers currently flagged export-enabled, in document order.
     */
    List<LayerView> exportEnabledLayers();

    Optional<LayerView> firstArtboard();
}
