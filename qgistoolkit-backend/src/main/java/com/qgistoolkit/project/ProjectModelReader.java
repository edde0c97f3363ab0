package com.qgistoolkit.project;

import com.qgistoolkit.model.GroupNode;
import com.qgistoolkit.model.LayerNode;
import com.qgistoolkit.model.MapLayer;
import com.qgistoolkit.model.ProjectDocument;
import com.qgistoolkit.model.TreeVocabulary;
import com.qgistoolkit.util.XmlElements;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the typed view of a parsed project DOM.
 *
 * <p>Missing sections produce empty structures; only the flat layer list, the display tree, the
 * legend and the draw order are modelled. Everything else stays in the DOM.
 */
@Slf4j
@Component
public class ProjectModelReader {

    public static final String DEFAULT_ENCODING = "UTF-8";

    public ProjectDocument read(Document dom, Path source) {
        Element root = dom.getDocumentElement();
        String encoding = dom.getXmlEncoding() != null ? dom.getXmlEncoding() : DEFAULT_ENCODING;
        DocumentType doctype = dom.getDoctype();

        return ProjectDocument.builder()
                .source(source)
                .dom(dom)
                .encoding(encoding)
                .doctypePublicId(doctype != null ? doctype.getPublicId() : null)
                .doctypeSystemId(doctype != null ? doctype.getSystemId() : null)
                .layers(readLayers(root, source))
                .layerTree(readHierarchy(findLayerTreeRoot(root), TreeVocabulary.LAYER_TREE))
                .legend(readHierarchy(XmlElements.firstChild(root, "legend"), TreeVocabulary.LEGEND))
                .drawOrder(readDrawOrder(root))
                .build();
    }

    private List<MapLayer> readLayers(Element root, Path source) {
        List<MapLayer> layers = new ArrayList<>();
        Element projectLayers = XmlElements.firstChild(root, "projectlayers");
        for (Element mapLayer : XmlElements.children(projectLayers, "maplayer")) {
            String id = XmlElements.childText(mapLayer, "id");
            if (id == null || id.isBlank()) {
                id = XmlElements.attribute(mapLayer, "id");
            }
            if (id == null || id.isBlank()) {
                log.warn("Skipping maplayer without id in {} (layername='{}')",
                        source, XmlElements.childText(mapLayer, "layername"));
                continue;
            }
            String datasource = XmlElements.childText(mapLayer, "datasource");
            layers.add(MapLayer.builder()
                    .id(id.trim())
                    .name(XmlElements.childText(mapLayer, "layername"))
                    .datasource(datasource != null ? datasource : "")
                    .element(mapLayer)
                    .build());
        }
        return layers;
    }

    private Element findLayerTreeRoot(Element root) {
        Element direct = XmlElements.firstChild(root, TreeVocabulary.LAYER_TREE.getGroupTag());
        return direct != null ? direct : XmlElements.firstDescendant(root, TreeVocabulary.LAYER_TREE.getGroupTag());
    }

    private GroupNode readHierarchy(Element rootElement, TreeVocabulary vocabulary) {
        if (rootElement == null) {
            return GroupNode.emptyRoot(vocabulary);
        }
        return readGroup(rootElement, vocabulary);
    }

    private GroupNode readGroup(Element element, TreeVocabulary vocabulary) {
        GroupNode group = new GroupNode(vocabulary, XmlElements.attribute(element, "name"), element);
        for (Element child : XmlElements.children(element, null)) {
            String tag = child.getTagName();
            if (tag.equals(vocabulary.getGroupTag())) {
                group.getGroups().add(readGroup(child, vocabulary));
            } else if (tag.equals(vocabulary.getLayerTag())) {
                List<String> layerIds = vocabulary.layerIdsOf(child);
                if (layerIds.isEmpty()) {
                    log.debug("Ignoring {} without layer reference", tag);
                    continue;
                }
                String name = XmlElements.attribute(child, "name");
                for (String layerId : layerIds) {
                    group.getLayers().add(new LayerNode(vocabulary, layerId, name, child));
                }
            }
        }
        return group;
    }

    private List<String> readDrawOrder(Element root) {
        List<String> order = new ArrayList<>();
        for (Element layer : XmlElements.children(XmlElements.firstChild(root, "layerorder"), "layer")) {
            String id = XmlElements.attribute(layer, "id");
            if (id != null && !id.isBlank()) {
                order.add(id);
            }
        }
        return order;
    }
}
