package com.qgistoolkit.service;

import com.qgistoolkit.model.ExtractionRequest;
import com.qgistoolkit.model.ExtractionResult;
import com.qgistoolkit.model.LayerSelection;
import com.qgistoolkit.model.LayerTreeIndex;
import com.qgistoolkit.model.ProjectDocument;
import com.qgistoolkit.project.LayerSelector;
import com.qgistoolkit.project.LayerTreeIndexer;
import com.qgistoolkit.project.LayerTreeReassembler;
import com.qgistoolkit.project.NoMatchingLayersException;
import com.qgistoolkit.project.ProjectDocumentParser;
import com.qgistoolkit.project.ProjectDocumentSerializer;
import com.qgistoolkit.project.ProjectFormat;
import com.qgistoolkit.project.ProjectNotFoundException;
import com.qgistoolkit.project.ProjectParseException;
import com.qgistoolkit.project.ReassemblyException;
import com.qgistoolkit.project.UnsupportedProjectFormatException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the layers matching a datasource predicate into a new project document.
 *
 * <p>Candidates are tried in order and the first one with any match wins; later candidates are not
 * read, and matches from several candidates are never merged. A candidate that cannot be parsed or
 * rebuilt is logged and skipped. Running out of candidates without a match is the only failure of
 * the run as a whole, apart from being unable to write the output.
 */
@Slf4j
@Service
public class LayerExtractionService {

    private static final String MDC_PROJECT_FILE = "project_file";

    private final ProjectDocumentParser parser;
    private final LayerTreeIndexer indexer;
    private final LayerSelector selector;
    private final LayerTreeReassembler reassembler;
    private final ProjectDocumentSerializer serializer;

    public LayerExtractionService(
            ProjectDocumentParser parser,
            LayerTreeIndexer indexer,
            LayerSelector selector,
            LayerTreeReassembler reassembler,
            ProjectDocumentSerializer serializer
    ) {
        this.parser = parser;
        this.indexer = indexer;
        this.selector = selector;
        this.reassembler = reassembler;
        this.serializer = serializer;
    }

    /**
     * Run one extraction.
     *
     * @param request candidates, predicate and output path
     * @return where the layers came from and their final order
     * @throws UnsupportedProjectFormatException when the output path is neither .qgs nor .qgz
     * @throws NoMatchingLayersException when no candidate yields a match
     * @throws com.qgistoolkit.project.ProjectWriteException when the output cannot be written
     */
    public ExtractionResult extract(ExtractionRequest request) {
        List<Path> candidates = request.getProjects() != null ? request.getProjects() : List.of();
        ProjectFormat outputFormat = ProjectFormat.fromPath(request.getOutputProject());
        log.info("Extracting layers matching {} from {} candidate project(s) to {} ({})",
                request.getPatternDescription(), candidates.size(), request.getOutputProject(), outputFormat);

        List<String> skipped = new ArrayList<>();
        for (Path candidate : candidates) {
            MDC.put(MDC_PROJECT_FILE, candidate.toString());
            try {
                ProjectDocument rebuilt = extractFrom(candidate, request);
                if (rebuilt == null) {
                    continue;
                }
                serializer.write(rebuilt, request.getOutputProject());
                List<String> layerIds = rebuilt.getDrawOrder();
                log.info("Extracted {} layers to {}", layerIds.size(), request.getOutputProject());
                log.debug("Layer order: {}", layerIds);
                return ExtractionResult.builder()
                        .sourceProject(candidate.toString())
                        .outputProject(request.getOutputProject().toString())
                        .layerCount(layerIds.size())
                        .layerIds(List.copyOf(layerIds))
                        .skippedProjects(List.copyOf(skipped))
                        .build();
            } catch (ProjectNotFoundException | UnsupportedProjectFormatException
                     | ProjectParseException | ReassemblyException e) {
                String layer = e.getLayerId() != null ? " (layer " + e.getLayerId() + ")" : "";
                log.warn("Skipping {}{}: {}", candidate, layer, e.getMessage());
                skipped.add(candidate + layer + ": " + e.getMessage());
            } finally {
                MDC.remove(MDC_PROJECT_FILE);
            }
        }

        log.warn("No layers matching {} found in any project file", request.getPatternDescription());
        throw new NoMatchingLayersException(request.getPatternDescription(), candidates.size(), skipped);
    }

    /**
     * @return the rebuilt document, or {@code null} when the candidate has no matching layer
     */
    private ProjectDocument extractFrom(Path candidate, ExtractionRequest request) {
        log.debug("Processing project file: {}", candidate);
        ProjectDocument document = parser.parse(candidate);
        LayerTreeIndex layerTreeIndex = indexer.index(document.getLayerTree());
        LayerSelection selection = selector.select(document.getLayers(), request.getDatasourcePredicate());
        if (selection.isEmpty()) {
            log.info("No layers found matching {} in {}", request.getPatternDescription(), candidate);
            return null;
        }
        return reassembler.rebuild(document, selection, layerTreeIndex);
    }
}
