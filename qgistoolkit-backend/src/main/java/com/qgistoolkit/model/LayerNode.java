package com.qgistoolkit.model;

import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

/**
 * Leaf of a display or legend hierarchy, pointing at one map layer. A legend leaf listing several
 * layers yields one node per layer, all sharing the same element.
 */
@Getter
@ToString(exclude = "element")
public class LayerNode {
    private final TreeVocabulary vocabulary;
    private final String layerId;
    private final String name;
    private final Element element;

    public LayerNode(TreeVocabulary vocabulary, String layerId, String name, Element element) {
        this.vocabulary = vocabulary;
        this.layerId = layerId;
        this.name = name;
        this.element = element;
    }
}
