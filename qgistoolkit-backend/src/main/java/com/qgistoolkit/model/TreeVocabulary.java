package com.qgistoolkit.model;

import com.qgistoolkit.util.XmlElements;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Element vocabulary of the two parallel hierarchies in a project document.
 *
 * <p>The display tree and the legend use different tag names but the same shape: named groups
 * holding leaves and nested groups. Indexing and reassembly work against this enum so they can
 * treat both hierarchies the same way.
 */
public enum TreeVocabulary {
    LAYER_TREE("layer-tree-group", "layer-tree-layer") {
        @Override
        public List<String> layerIdsOf(Element leaf) {
            String id = XmlElements.attribute(leaf, "id");
            return id == null || id.isBlank() ? List.of() : List.of(id);
        }
    },
    /** A legend leaf lists one {@code legendlayerfile} per layer it stands for. */
    LEGEND("legendgroup", "legendlayer") {
        @Override
        public List<String> layerIdsOf(Element leaf) {
            List<String> ids = new ArrayList<>();
            for (Element file : XmlElements.descendants(leaf, "legendlayerfile")) {
                String id = XmlElements.attribute(file, "layerid");
                if (id != null && !id.isBlank() && !ids.contains(id)) {
                    ids.add(id);
                }
            }
            return ids;
        }
    };

    private final String groupTag;
    private final String layerTag;

    TreeVocabulary(String groupTag, String layerTag) {
        this.groupTag = groupTag;
        this.layerTag = layerTag;
    }

    public String getGroupTag() {
        return groupTag;
    }

    public String getLayerTag() {
        return layerTag;
    }

    /**
     * Resolve the map layer identifiers a leaf element refers to.
     *
     * @param leaf leaf element of this vocabulary
     * @return layer identifiers in document order, empty when the leaf carries none
     */
    public abstract List<String> layerIdsOf(Element leaf);
}
