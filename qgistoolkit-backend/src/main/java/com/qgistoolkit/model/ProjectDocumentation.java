package com.qgistoolkit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProjectDocumentation {
    private String project;
    private int layerCount;
    private int groupCount;
    private int ungroupedCount;
    private List<LayerDocumentation> layers;
    private Map<String, Integer> providers;
}
