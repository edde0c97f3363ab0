package com.qgistoolkit.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.qgistoolkit.project.MatchMode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request payload for extracting matching layers into a new project.
 *
 * <p>An empty {@code projects} list falls back to the configured default candidates.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractLayersRequest {
    private List<String> projects = new ArrayList<>();

    @NotBlank(message = "datasource_pattern is required")
    private String datasourcePattern;

    private MatchMode matchMode = MatchMode.CONTAINS;

    @NotBlank(message = "output_project is required")
    private String outputProject;
}
