package com.qgistoolkit.model;

import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Named node of a display or legend hierarchy.
 *
 * <p>Sibling names are not unique in source documents. The root of each hierarchy is an unnamed
 * node; for the legend it is the {@code legend} element itself.
 */
@Getter
@ToString(exclude = {"element", "layers", "groups"})
public class GroupNode {
    public static final String UNNAMED = "Unnamed Group";

    private final TreeVocabulary vocabulary;
    private final String name;
    private final Element element;
    private final List<LayerNode> layers = new ArrayList<>();
    private final List<GroupNode> groups = new ArrayList<>();

    public GroupNode(TreeVocabulary vocabulary, String name, Element element) {
        this.vocabulary = vocabulary;
        this.name = name != null ? name : "";
        this.element = element;
    }

    /**
     * Creates an empty root for a document that lacks the hierarchy altogether.
     */
    public static GroupNode emptyRoot(TreeVocabulary vocabulary) {
        return new GroupNode(vocabulary, "", null);
    }

    /**
     * Name used for group paths: blank names become {@value #UNNAMED}.
     */
    public String getDisplayName() {
        return name.isBlank() ? UNNAMED : name;
    }
}
