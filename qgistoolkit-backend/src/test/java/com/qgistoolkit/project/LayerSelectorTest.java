package com.qgistoolkit.project;

import com.qgistoolkit.model.LayerSelection;
import com.qgistoolkit.model.MapLayer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LayerSelectorTest {

    private final LayerSelector selector = new LayerSelector();

    @Test
    void keepsFlatListOrder() {
        List<MapLayer> layers = List.of(
                layer("C", "/data/topotest/c.fgb"),
                layer("A", "/data/other/a.fgb"),
                layer("B", "/data/topotest/b.fgb"));

        LayerSelection selection = selector.select(layers, DatasourcePredicates.forPattern("topotest", null));

        assertThat(selection.ids()).containsExactly("C", "B");
        assertThat(selection.size()).isEqualTo(2);
    }

    @Test
    void repeatedIdKeepsFirstPositionAndLastOccurrence() {
        MapLayer first = layer("A", "topotest/first");
        MapLayer last = layer("A", "topotest/last");

        LayerSelection selection = selector.select(
                List.of(first, layer("B", "topotest/b"), last),
                DatasourcePredicates.forPattern("topotest", MatchMode.CONTAINS));

        assertThat(selection.ids()).containsExactly("A", "B");
        assertThat(selection.layers().get(0)).isSameAs(last);
    }

    @Test
    void noMatchYieldsEmptySelection() {
        LayerSelection selection = selector.select(
                List.of(layer("A", "a.shp")), DatasourcePredicates.forPattern("postgres", null));

        assertThat(selection.isEmpty()).isTrue();
        assertThat(selection.ids()).isEmpty();
    }

    @Test
    void emptyLayerListYieldsEmptySelection() {
        assertThat(selector.select(List.of(), datasource -> true).isEmpty()).isTrue();
    }

    private static MapLayer layer(String id, String datasource) {
        return MapLayer.builder().id(id).name(id.toLowerCase()).datasource(datasource).build();
    }
}
