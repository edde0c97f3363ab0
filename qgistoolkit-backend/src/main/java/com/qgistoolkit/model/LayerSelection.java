package com.qgistoolkit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matched set produced by the selector.
 *
 * <p>Iteration order is first-encounter order in the flat layer list. If an identifier repeats in
 * the flat list it keeps its first position but resolves to the last occurrence.
 */
public class LayerSelection {
    private final Map<String, MapLayer> matched = new LinkedHashMap<>();

    public void add(MapLayer layer) {
        matched.put(layer.getId(), layer);
    }

    public boolean contains(String layerId) {
        return matched.containsKey(layerId);
    }

    public List<String> ids() {
        return Collections.unmodifiableList(new ArrayList<>(matched.keySet()));
    }

    public List<MapLayer> layers() {
        return Collections.unmodifiableList(new ArrayList<>(matched.values()));
    }

    public boolean isEmpty() {
        return matched.isEmpty();
    }

    public int size() {
        return matched.size();
    }
}
