package com.qgistoolkit.project;

import com.qgistoolkit.model.LayerSelection;
import com.qgistoolkit.model.MapLayer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Selects layers whose datasource satisfies a predicate, in flat-list order.
 */
@Slf4j
@Component
public class LayerSelector {

    /**
     * Scan the flat layer list once.
     *
     * @param layers flat layer list in document order
     * @param datasourcePredicate predicate over the datasource string
     * @return matched set; empty when nothing matches
     */
    public LayerSelection select(List<MapLayer> layers, Predicate<String> datasourcePredicate) {
        LayerSelection selection = new LayerSelection();
        for (MapLayer layer : layers) {
            if (datasourcePredicate.test(layer.getDatasource())) {
                if (selection.contains(layer.getId())) {
                    log.warn("Layer id {} occurs more than once in the flat layer list; using the last occurrence",
                            layer.getId());
                }
                selection.add(layer);
                log.debug("Matched layer {} ({})", layer.getId(), layer.getName());
            }
        }
        return selection;
    }
}
