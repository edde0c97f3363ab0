package com.qgistoolkit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionResult {
    private String sourceProject;
    private String outputProject;
    private int layerCount;
    private List<String> layerIds;

    /**
     * Candidates that failed before the winning one, as {@code path: reason}.
     */
    private List<String> skippedProjects;
}
