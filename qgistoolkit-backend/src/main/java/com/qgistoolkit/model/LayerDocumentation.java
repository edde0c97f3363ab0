package com.qgistoolkit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Reporting row for one map layer.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LayerDocumentation {
    private String name;
    private String id;
    private String groupPath;
    private String datasource;
    private String minScale;
    private String maxScale;
    private String provider;
}
