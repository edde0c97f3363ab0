package com.qgistoolkit.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Where extractions read from and write to: the default candidate project list, used when an
 * extraction names no projects of its own, and the directory every output project must stay in.
 */
@Component
public class ProjectSourceSettings {

    private final List<String> defaultProjects;
    private final Path outputDir;

    public ProjectSourceSettings(
            @Value("${toolkit.projects.defaults:}") List<String> defaultProjects,
            @Value("${toolkit.output.dir:./data/extracted}") String outputDir
    ) {
        this.defaultProjects = defaultProjects != null ? List.copyOf(defaultProjects) : List.of();
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Resolve a requested output project against the output directory.
     *
     * @param requested output path, normally relative to the output directory
     * @return normalised absolute path inside the output directory
     * @throws IllegalArgumentException when the path is blank or leaves the output directory
     */
    public Path resolveOutput(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new IllegalArgumentException("output_project is required");
        }
        Path resolved = outputDir.resolve(requested.trim()).normalize();
        if (!resolved.startsWith(outputDir) || resolved.equals(outputDir)) {
            throw new IllegalArgumentException(
                    "output_project must stay inside " + outputDir + ": " + requested);
        }
        return resolved;
    }

    /**
     * Resolve the candidates of one run: the requested ones if any, otherwise the defaults.
     *
     * @param requested project paths from the caller (may be null or empty)
     * @return candidate paths in priority order
     */
    public List<Path> resolveCandidates(List<String> requested) {
        List<String> source = requested != null && !requested.isEmpty() ? requested : defaultProjects;
        List<Path> candidates = new ArrayList<>();
        for (String project : source) {
            if (project != null && !project.isBlank()) {
                candidates.add(Paths.get(project.trim()));
            }
        }
        return candidates;
    }
}
