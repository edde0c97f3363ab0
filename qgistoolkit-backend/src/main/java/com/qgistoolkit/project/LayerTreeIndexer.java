package com.qgistoolkit.project;

import com.qgistoolkit.model.GroupEntry;
import com.qgistoolkit.model.GroupNode;
import com.qgistoolkit.model.GroupPath;
import com.qgistoolkit.model.LayerNode;
import com.qgistoolkit.model.LayerRef;
import com.qgistoolkit.model.LayerTreeIndex;
import org.springframework.stereotype.Component;

/**
 * Indexes a display or legend hierarchy by group path.
 *
 * <p>Depth-first, pre-order, child groups visited before the next sibling. The walk only reads the
 * tree, so the same index feeds reporting and extraction.
 */
@Component
public class LayerTreeIndexer {

    public LayerTreeIndex index(GroupNode root) {
        LayerTreeIndex index = new LayerTreeIndex(root.getVocabulary());
        visit(root, GroupPath.ROOT, "", index);
        return index;
    }

    private void visit(GroupNode group, GroupPath path, String name, LayerTreeIndex index) {
        GroupEntry entry = index.getPathToNode()
                .computeIfAbsent(path.asString(), key -> new GroupEntry(name, key, group.getElement()));

        for (LayerNode layer : group.getLayers()) {
            entry.getLayers().add(new LayerRef(layer.getLayerId(), layer.getName()));
            // last write wins when a layer is listed under several groups
            index.getLayerToPath().put(layer.getLayerId(), path);
            index.getLayerNodes().put(layer.getLayerId(), layer);
        }

        for (GroupNode child : group.getGroups()) {
            GroupPath childPath = path.child(child.getDisplayName());
            entry.addChildPath(childPath.asString());
            visit(child, childPath, child.getDisplayName(), index);
        }
    }
}
