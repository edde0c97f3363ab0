package com.qgistoolkit.model;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Input of one extraction run: candidate documents in priority order, the datasource predicate and
 * where to write the result.
 */
@Getter
@Builder
public class ExtractionRequest {
    private final List<Path> projects;
    private final Predicate<String> datasourcePredicate;
    private final String patternDescription;
    private final Path outputProject;
}
