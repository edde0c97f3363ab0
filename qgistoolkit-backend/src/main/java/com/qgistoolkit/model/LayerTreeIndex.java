package com.qgistoolkit.model;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of indexing one hierarchy.
 *
 * <p>{@code pathToNode} and {@code layerToPath} are the contract toward reporting. A layer placed
 * directly under the root maps to {@link GroupPath#ROOT}; a layer missing from the hierarchy has no
 * mapping at all.
 */
@Getter
public class LayerTreeIndex {
    private final TreeVocabulary vocabulary;
    private final Map<String, GroupEntry> pathToNode = new LinkedHashMap<>();
    private final Map<String, GroupPath> layerToPath = new LinkedHashMap<>();
    private final Map<String, LayerNode> layerNodes = new LinkedHashMap<>();

    public LayerTreeIndex(TreeVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public boolean isPlaced(String layerId) {
        return layerToPath.containsKey(layerId);
    }

    /**
     * Group path of a layer as a string; empty for root-level and ungrouped layers.
     */
    public String groupPathOf(String layerId) {
        GroupPath path = layerToPath.get(layerId);
        return path != null ? path.asString() : "";
    }

    /**
     * Number of named groups, the root excluded.
     */
    public int groupCount() {
        return pathToNode.containsKey("") ? pathToNode.size() - 1 : pathToNode.size();
    }
}
