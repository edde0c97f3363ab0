package com.qgistoolkit.model;

import lombok.Builder;
import lombok.Getter;
import org.w3c.dom.Document;

import java.nio.file.Path;
import java.util.List;

/**
 * Parsed project document: the DOM plus the typed view of its four layer-indexed sections.
 */
@Getter
@Builder
public class ProjectDocument {
    private final Path source;
    private final Document dom;
    private final String encoding;
    private final String doctypePublicId;
    private final String doctypeSystemId;
    private final List<MapLayer> layers;
    private final GroupNode layerTree;
    private final GroupNode legend;
    private final List<String> drawOrder;

    /**
     * Looks up a layer by identifier; the last occurrence wins when the flat list repeats one.
     */
    public MapLayer findLayer(String layerId) {
        MapLayer found = null;
        for (MapLayer layer : layers) {
            if (layer.getId().equals(layerId)) {
                found = layer;
            }
        }
        return found;
    }
}
