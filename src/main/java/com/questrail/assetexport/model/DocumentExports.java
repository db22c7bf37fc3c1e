package com.questrail.assetexport.model;

import com.questrail.assetexport.api.AssetNotFoundException;
import com.questrail.assetexport.api.ExportAsset;
import com.questrail.assetexport.api.ExportTarget;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * DocumentExports
 * -----------------------------------------------------------------------------
 * Immutable snapshot of every export asset configured on one document: the
 * document-level ("root") list plus one list per layer.
 *
 * <h2>Index identity</h2>
 * The position of an asset in its list is its identity for updates and
 * deletes. Inserting {@code k} assets at {@code i} shifts every entry at
 * {@code >= i} up by {@code k}; deleting at {@code i} shifts every entry at
 * {@code > i} down by one. Lists never contain gaps.
 *
 * <h2>Multi-layer targets</h2>
 * An {@link ExportTarget.Layers} target addresses the same index in each
 * listed layer. Every list is validated before any is changed, so an
 * operation either applies to all layers or to none.
 */
public final class DocumentExports
{
    private final long documentId;
    private final List<ExportAsset> rootExports;
    private final Map<Long, List<ExportAsset>> layerExports;

    private DocumentExports(long documentId,
                            List<ExportAsset> rootExports,
                            Map<Long, List<ExportAsset>> layerExports) {
        this.documentId = documentId;
        this.rootExports = List.copyOf(rootExports);
        Map<Long, List<ExportAsset>> copy = new LinkedHashMap<>();
        layerExports.forEach((id, list) -> copy.put(id, List.copyOf(list)));
        this.layerExports = Collections.unmodifiableMap(copy);
    }

    public static DocumentExports empty(long documentId) {
        return new DocumentExports(documentId, List.of(), Map.of());
    }

    public long documentId() {
        return documentId;
    }

    public List<ExportAsset> rootExports() {
        return rootExports;
    }

    /**
     * Assets of a layer; empty if the layer has none configured.
     */
    public List<ExportAsset> layerExports(long layerId) {
        return layerExports.getOrDefault(layerId, List.of());
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Layers, in the given order, that have no asset configured.
     */
    public List<Long> layersWithoutExports(Collection<Long> layerIds) {
        List<Long> result = new ArrayList<>();
        for (Long id : layerIds) {
            if (layerExports(id).isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * Layers that have at least one asset configured, in insertion order.
     */
    public Set<Long> layersWithExports() {
        Set<Long> result = new LinkedHashSet<>();
        layerExports.forEach((id, list) -> {
            if (!list.isEmpty()) {
                result.add(id);
            }
        });
        return result;
    }

    /**
     * The longest common prefix of assets with the same configuration across
     * all given layers. A single layer's uniform assets are all of its assets.
     */
    public List<ExportAsset> uniformAssets(Collection<Long> layerIds) {
        if (layerIds.isEmpty()) {
            return List.of();
        }

        List<List<ExportAsset>> lists = new ArrayList<>();
        for (Long id : layerIds) {
            lists.add(layerExports(id));
        }

        List<ExportAsset> first = lists.get(0);
        int prefix = first.size();
        for (List<ExportAsset> other : lists) {
            int i = 0;
            while (i < prefix && i < other.size() && first.get(i).sameConfiguration(other.get(i))) {
                i++;
            }
            prefix = i;
        }
        return first.subList(0, prefix);
    }

    /**
     * Index of the last uniform asset, or -1 when the layers share none.
     */
    public int lastUniformAssetIndex(Collection<Long> layerIds) {
        return uniformAssets(layerIds).size() - 1;
    }

    // ---------------------------------------------------------------------
    // Mutations (return new snapshots)
    // ---------------------------------------------------------------------

    /**
     * Inserts {@code assets} at {@code index} in every list of the target.
     *
     * @throws AssetNotFoundException if {@code index} is outside {@code [0, size]} for any list
     */
    public DocumentExports insert(ExportTarget target, int index, List<ExportAsset> assets) {
        Objects.requireNonNull(assets, "assets");
        return rewrite(target, (label, list) -> {
            if (index < 0 || index > list.size()) {
                throw new AssetNotFoundException("Insert index " + index + " out of range [0, "
                        + list.size() + "] for " + label);
            }
            List<ExportAsset> next = new ArrayList<>(list);
            next.addAll(index, assets);
            return next;
        });
    }

    /**
     * Replaces the asset at {@code index} in every list of the target.
     *
     * @throws AssetNotFoundException if {@code index} is out of range for any list
     */
    public DocumentExports update(ExportTarget target, int index, UnaryOperator<ExportAsset> change) {
        Objects.requireNonNull(change, "change");
        return rewrite(target, (label, list) -> {
            requireIndex(label, list, index);
            List<ExportAsset> next = new ArrayList<>(list);
            next.set(index, change.apply(list.get(index)));
            return next;
        });
    }

    /**
     * Removes the asset at {@code index} from every list of the target.
     *
     * @throws AssetNotFoundException if {@code index} is out of range for any list
     */
    public DocumentExports delete(ExportTarget target, int index) {
        return rewrite(target, (label, list) -> {
            requireIndex(label, list, index);
            List<ExportAsset> next = new ArrayList<>(list);
            next.remove(index);
            return next;
        });
    }

    /**
     * Applies {@code change} to every asset of every list of the target.
     */
    public DocumentExports mapAll(ExportTarget target, UnaryOperator<ExportAsset> change) {
        Objects.requireNonNull(change, "change");
        return rewrite(target, (label, list) -> {
            List<ExportAsset> next = new ArrayList<>(list.size());
            for (ExportAsset asset : list) {
                next.add(change.apply(asset));
            }
            return next;
        });
    }

    private interface ListRewrite {
        List<ExportAsset> apply(String label, List<ExportAsset> list);
    }

    private DocumentExports rewrite(ExportTarget target, ListRewrite rewrite) {
        Objects.requireNonNull(target, "target");
        if (target.documentId() != documentId) {
            throw new IllegalArgumentException("Target document " + target.documentId()
                    + " does not match " + documentId);
        }

        if (target instanceof ExportTarget.DocumentRoot) {
            List<ExportAsset> root = rewrite.apply("document " + documentId, rootExports);
            return new DocumentExports(documentId, root, layerExports);
        }

        ExportTarget.Layers layers = (ExportTarget.Layers) target;
        Map<Long, List<ExportAsset>> next = new LinkedHashMap<>(layerExports);
        for (Long layerId : layers.layerIds()) {
            next.put(layerId, rewrite.apply("layer " + layerId + " of document " + documentId,
                    layerExports(layerId)));
        }
        return new DocumentExports(documentId, rootExports, next);
    }

    private static void requireIndex(String label, List<ExportAsset> list, int index) {
        if (index < 0 || index >= list.size()) {
            throw new AssetNotFoundException("No asset at index " + index + " for " + label
                    + " (size " + list.size() + ")");
        }
    }

    @Override
    public String toString() {
        return "DocumentExports{documentId=" + documentId + ", root=" + rootExports.size()
                + ", layers=" + layerExports.keySet() + "}";
    }
}
