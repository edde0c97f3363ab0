package com.qgistoolkit.project;

import com.qgistoolkit.model.GroupEntry;
import com.qgistoolkit.model.GroupNode;
import com.qgistoolkit.model.GroupPath;
import com.qgistoolkit.model.LayerNode;
import com.qgistoolkit.model.LayerSelection;
import com.qgistoolkit.model.LayerTreeIndex;
import com.qgistoolkit.model.MapLayer;
import com.qgistoolkit.model.ProjectDocument;
import com.qgistoolkit.model.TreeVocabulary;
import com.qgistoolkit.util.XmlElements;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds a minimal, internally consistent project document holding only the selected layers.
 *
 * <p>The flat list and draw order follow selection order. Groups and legend groups are recreated
 * along each layer's original path, reusing an already-built child whenever one with the same name
 * exists at that depth. Two distinct source siblings that share a name therefore end up merged.
 */
@Slf4j
@Component
public class LayerTreeReassembler {

    static final List<String> PASSTHROUGH_SECTIONS = List.of("properties", "relations", "mapcanvas");

    private final LayerTreeIndexer indexer;
    private final ProjectModelReader modelReader;

    public LayerTreeReassembler(LayerTreeIndexer indexer, ProjectModelReader modelReader) {
        this.indexer = indexer;
        this.modelReader = modelReader;
    }

    /**
     * Build the reduced document.
     *
     * @param original source document
     * @param selection matched layers, in flat-list order
     * @param layerTreeIndex index of the source display tree
     * @return the rebuilt document
     * @throws ReassemblyException when a subtree cannot be copied or the result is inconsistent
     */
    public ProjectDocument rebuild(ProjectDocument original, LayerSelection selection, LayerTreeIndex layerTreeIndex) {
        if (selection.isEmpty()) {
            throw new IllegalArgumentException("Cannot rebuild " + original.getSource() + " from an empty selection");
        }
        Path source = original.getSource();
        LayerTreeIndex legendIndex = indexer.index(original.getLegend());

        Document target = ProjectDocumentParser.newDocumentBuilder().newDocument();
        Element sourceRoot = original.getDom().getDocumentElement();
        Element root = target.createElement("qgis");
        XmlElements.copyAttributes(sourceRoot, root);
        target.appendChild(root);

        for (String section : PASSTHROUGH_SECTIONS) {
            Element element = XmlElements.firstChild(sourceRoot, section);
            if (element != null) {
                root.appendChild(copy(target, element, source, null));
            }
        }

        Element projectLayers = appendChild(root, "projectlayers");
        Element layerOrder = appendChild(root, "layerorder");
        Element layerTree = appendChild(root, TreeVocabulary.LAYER_TREE.getGroupTag());
        XmlElements.copyAttributes(original.getLayerTree().getElement(), layerTree);
        Element legend = appendChild(root, "legend");
        legend.setAttribute("updateDrawingOrder", "true");

        GroupAssembly treeRoot = new GroupAssembly(layerTree);
        GroupAssembly legendRoot = new GroupAssembly(legend);
        Set<Element> copiedLegendLeaves = Collections.newSetFromMap(new IdentityHashMap<>());

        for (MapLayer layer : selection.layers()) {
            String layerId = layer.getId();
            projectLayers.appendChild(copy(target, layer.getElement(), source, layerId));
            appendChild(layerOrder, "layer").setAttribute("id", layerId);

            if (!place(treeRoot, layerTreeIndex, layerId, target, source, null)) {
                log.debug("Layer {} is not part of the layer tree; leaving it ungrouped", layerId);
            }
            if (!place(legendRoot, legendIndex, layerId, target, source, copiedLegendLeaves)) {
                log.debug("Layer {} has no legend entry", layerId);
            }
        }

        ProjectDocument rebuilt = modelReader.read(target, source);
        verify(rebuilt);
        log.info("Rebuilt {} with {} layers", source, selection.size());
        return ProjectDocument.builder()
                .source(rebuilt.getSource())
                .dom(rebuilt.getDom())
                .encoding(original.getEncoding())
                .doctypePublicId(original.getDoctypePublicId())
                .doctypeSystemId(original.getDoctypeSystemId())
                .layers(rebuilt.getLayers())
                .layerTree(rebuilt.getLayerTree())
                .legend(rebuilt.getLegend())
                .drawOrder(rebuilt.getDrawOrder())
                .build();
    }

    /**
     * Walk the layer's original path from the rebuilt root, creating or reusing one group per
     * segment, and attach a copy of its leaf.
     *
     * @return {@code false} when the hierarchy does not mention the layer
     */
    private boolean place(GroupAssembly root, LayerTreeIndex index, String layerId, Document target,
                          Path source, Set<Element> copiedLeaves) {
        GroupPath path = index.getLayerToPath().get(layerId);
        if (path == null) {
            return false;
        }
        LayerNode leaf = index.getLayerNodes().get(layerId);
        if (copiedLeaves != null && !copiedLeaves.add(leaf.getElement())) {
            return true;
        }

        TreeVocabulary vocabulary = index.getVocabulary();
        GroupAssembly group = root;
        GroupPath walked = GroupPath.ROOT;
        for (String segment : path.getSegments()) {
            walked = walked.child(segment);
            GroupEntry sourceGroup = index.getPathToNode().get(walked.asString());
            group = group.child(segment, target, vocabulary, sourceGroup != null ? sourceGroup.getElement() : null);
        }
        group.element.appendChild(copy(target, leaf.getElement(), source, layerId));
        return true;
    }

    private void verify(ProjectDocument rebuilt) {
        Path source = rebuilt.getSource();
        Set<String> drawn = new HashSet<>();
        for (String layerId : rebuilt.getDrawOrder()) {
            if (!drawn.add(layerId)) {
                throw new ReassemblyException("Layer " + layerId + " appears twice in the draw order", source, layerId);
            }
        }
        for (MapLayer layer : rebuilt.getLayers()) {
            if (!drawn.contains(layer.getId())) {
                throw new ReassemblyException("Layer " + layer.getId() + " is missing from the draw order",
                        source, layer.getId());
            }
        }
        verifyTree(rebuilt.getLayerTree(), drawn, new HashSet<>(), source);
    }

    private void verifyTree(GroupNode group, Set<String> drawn, Set<String> placed, Path source) {
        for (LayerNode layer : group.getLayers()) {
            String layerId = layer.getLayerId();
            if (!placed.add(layerId)) {
                throw new ReassemblyException("Layer " + layerId + " is placed in more than one group", source, layerId);
            }
            if (!drawn.contains(layerId)) {
                throw new ReassemblyException("Layer tree references unknown layer " + layerId, source, layerId);
            }
        }
        for (GroupNode child : group.getGroups()) {
            verifyTree(child, drawn, placed, source);
        }
    }

    private static Element appendChild(Element parent, String tagName) {
        Element child = parent.getOwnerDocument().createElement(tagName);
        parent.appendChild(child);
        return child;
    }

    private static Node copy(Document target, Element element, Path source, String layerId) {
        try {
            return target.importNode(element, true);
        } catch (DOMException e) {
            String what = layerId != null ? "layer " + layerId : "section <" + element.getTagName() + ">";
            throw new ReassemblyException("Could not copy " + what + " from " + source + ": " + e.getMessage(),
                    source, layerId, e);
        }
    }

    /**
     * A group being built, with its children indexed by name for the current depth only.
     */
    private static final class GroupAssembly {
        private final Element element;
        private final Map<String, GroupAssembly> childrenByName = new LinkedHashMap<>();

        private GroupAssembly(Element element) {
            this.element = element;
        }

        private GroupAssembly child(String name, Document target, TreeVocabulary vocabulary, Element sourceGroup) {
            GroupAssembly existing = childrenByName.get(name);
            if (existing != null) {
                return existing;
            }
            Element created = target.createElement(vocabulary.getGroupTag());
            if (sourceGroup != null) {
                XmlElements.copyAttributes(sourceGroup, created);
            } else {
                created.setAttribute("name", name);
            }
            element.appendChild(created);
            GroupAssembly assembly = new GroupAssembly(created);
            childrenByName.put(name, assembly);
            return assembly;
        }
    }
}
