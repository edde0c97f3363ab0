package com.qgistoolkit.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.qgistoolkit.model.GroupEntry;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Response for {@code GET /v1/projects/tree}: the indexer's two mappings.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LayerTreeResponse {
    private String project;

    /**
     * Group path to direct layers and child paths; the root is keyed by the empty string.
     */
    private Map<String, GroupEntry> pathToNode;

    /**
     * Layer id to group path; root-level layers map to the empty string.
     */
    private Map<String, String> layerToPath;
}
