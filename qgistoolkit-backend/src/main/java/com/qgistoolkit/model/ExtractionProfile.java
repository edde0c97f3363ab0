package com.qgistoolkit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.qgistoolkit.project.MatchMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Named extraction preset loaded from profile YAML.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionProfile {
    private String name;
    private String description;
    private String datasourcePattern;
    private MatchMode matchMode = MatchMode.CONTAINS;
    private List<String> projects = new ArrayList<>();
    private String outputProject;
    private String sourceFile;
}
