package com.qgistoolkit.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.qgistoolkit.model.LayerDocumentation;
import com.qgistoolkit.model.LayerTreeIndex;
import com.qgistoolkit.model.MapLayer;
import com.qgistoolkit.model.ProjectDocument;
import com.qgistoolkit.model.ProjectDocumentation;
import com.qgistoolkit.project.LayerTreeIndexer;
import com.qgistoolkit.project.ProjectDocumentParser;
import com.qgistoolkit.util.DatasourceSanitizer;
import com.qgistoolkit.util.ProviderClassifier;
import com.qgistoolkit.util.ScaleVisibility;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only reporting over a project's layer tree: the indexer's mappings plus per-layer
 * datasource, scale visibility and provider. Reported datasources have credentials redacted.
 */
@Slf4j
@Service
public class LayerDocumentationService {

    static final String UNGROUPED = "Ungrouped";

    private final ProjectDocumentParser parser;
    private final LayerTreeIndexer indexer;
    private final CsvMapper csvMapper;

    public LayerDocumentationService(ProjectDocumentParser parser, LayerTreeIndexer indexer) {
        this.parser = parser;
        this.indexer = indexer;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    public LayerTreeIndex indexLayerTree(Path project) {
        return indexer.index(parser.parse(project).getLayerTree());
    }

    /**
     * Describe every layer of the flat list, in document order.
     *
     * @param project project path
     * @return documentation rows and summary counts
     */
    public ProjectDocumentation describe(Path project) {
        ProjectDocument document = parser.parse(project);
        LayerTreeIndex index = indexer.index(document.getLayerTree());

        List<LayerDocumentation> rows = new ArrayList<>();
        Map<String, Integer> providers = new TreeMap<>();
        int ungrouped = 0;
        for (MapLayer layer : document.getLayers()) {
            String groupPath = index.groupPathOf(layer.getId());
            if (groupPath.isEmpty()) {
                ungrouped++;
            }
            ScaleVisibility scales = ScaleVisibility.of(layer.getElement());
            String provider = ProviderClassifier.classify(layer.getDatasource());
            providers.merge(provider, 1, Integer::sum);
            rows.add(LayerDocumentation.builder()
                    .name(layer.getName())
                    .id(layer.getId())
                    .groupPath(groupPath)
                    .datasource(DatasourceSanitizer.sanitize(layer.getDatasource()))
                    .minScale(scales.getMinScale())
                    .maxScale(scales.getMaxScale())
                    .provider(provider)
                    .build());
        }

        log.info("Documented {} layers in {} groups from {}", rows.size(), index.groupCount(), project);
        return ProjectDocumentation.builder()
                .project(project.toString())
                .layerCount(rows.size())
                .groupCount(index.groupCount())
                .ungroupedCount(ungrouped)
                .layers(rows)
                .providers(providers)
                .build();
    }

    /**
     * Render documentation rows as CSV with a header line.
     */
    public String toCsv(ProjectDocumentation documentation) {
        List<CsvRow> rows = new ArrayList<>();
        for (LayerDocumentation layer : documentation.getLayers()) {
            String groupPath = layer.getGroupPath() == null || layer.getGroupPath().isEmpty()
                    ? UNGROUPED
                    : layer.getGroupPath();
            rows.add(new CsvRow(layer.getName(), layer.getId(), groupPath, layer.getDatasource(),
                    layer.getMinScale(), layer.getMaxScale()));
        }
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render CSV for " + documentation.getProject(), e);
        }
    }

    @Getter
    @AllArgsConstructor
    @JsonPropertyOrder({"Layer Name", "Layer ID", "Group Path", "Datasource", "Min Scale", "Max Scale"})
    public static class CsvRow {
        @JsonProperty("Layer Name")
        private final String layerName;
        @JsonProperty("Layer ID")
        private final String layerId;
        @JsonProperty("Group Path")
        private final String groupPath;
        @JsonProperty("Datasource")
        private final String datasource;
        @JsonProperty("Min Scale")
        private final String minScale;
        @JsonProperty("Max Scale")
        private final String maxScale;
    }
}
