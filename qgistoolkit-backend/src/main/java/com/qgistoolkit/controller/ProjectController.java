package com.qgistoolkit.controller;

import com.qgistoolkit.api.ExtractLayersRequest;
import com.qgistoolkit.api.LayerTreeResponse;
import com.qgistoolkit.api.ProfilesListResponse;
import com.qgistoolkit.api.ProfilesReloadResponse;
import com.qgistoolkit.config.ProjectSourceSettings;
import com.qgistoolkit.model.ExtractionProfile;
import com.qgistoolkit.model.ExtractionRequest;
import com.qgistoolkit.model.ExtractionResult;
import com.qgistoolkit.model.LayerTreeIndex;
import com.qgistoolkit.model.ProjectDocumentation;
import com.qgistoolkit.profile.ExtractionProfileRegistry;
import com.qgistoolkit.project.DatasourcePredicates;
import com.qgistoolkit.project.MatchMode;
import com.qgistoolkit.service.LayerDocumentationService;
import com.qgistoolkit.service.LayerExtractionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final LayerExtractionService extractionService;
    private final LayerDocumentationService documentationService;
    private final ExtractionProfileRegistry profileRegistry;
    private final ProjectSourceSettings projectSourceSettings;

    public ProjectController(
            LayerExtractionService extractionService,
            LayerDocumentationService documentationService,
            ExtractionProfileRegistry profileRegistry,
            ProjectSourceSettings projectSourceSettings
    ) {
        this.extractionService = extractionService;
        this.documentationService = documentationService;
        this.profileRegistry = profileRegistry;
        this.projectSourceSettings = projectSourceSettings;
    }

    /**
     * Extract the layers whose datasource matches a pattern into a new project file.
     *
     * POST /v1/layers/extract
     *
     * @param request candidate projects, pattern and output path relative to the output directory
     * @return source project, output project and the extracted layer ids in order
     */
    @PostMapping("/layers/extract")
    public ResponseEntity<ExtractionResult> extractLayers(@Valid @RequestBody ExtractLayersRequest request) {
        ExtractionResult result = runExtraction(
                request.getProjects(),
                request.getDatasourcePattern(),
                request.getMatchMode(),
                request.getOutputProject());
        return ResponseEntity.ok(result);
    }

    /**
     * Group structure of a project as the indexer sees it.
     *
     * GET /v1/projects/tree
     */
    @GetMapping("/projects/tree")
    public ResponseEntity<LayerTreeResponse> getLayerTree(@RequestParam("project") String project) {
        LayerTreeIndex index = documentationService.indexLayerTree(Paths.get(project));
        Map<String, String> layerToPath = new LinkedHashMap<>();
        index.getLayerToPath().forEach((layerId, path) -> layerToPath.put(layerId, path.asString()));
        return ResponseEntity.ok(LayerTreeResponse.builder()
                .project(project)
                .pathToNode(index.getPathToNode())
                .layerToPath(layerToPath)
                .build());
    }

    /**
     * Per-layer documentation: group, datasource, scale visibility and provider.
     *
     * GET /v1/projects/layers
     */
    @GetMapping("/projects/layers")
    public ResponseEntity<ProjectDocumentation> getLayerDocumentation(@RequestParam("project") String project) {
        return ResponseEntity.ok(documentationService.describe(Paths.get(project)));
    }

    /**
     * Same rows as {@code /projects/layers}, rendered as CSV.
     *
     * GET /v1/projects/layers.csv
     */
    @GetMapping(value = "/projects/layers.csv", produces = "text/csv")
    public ResponseEntity<String> getLayerDocumentationCsv(@RequestParam("project") String project) {
        ProjectDocumentation documentation = documentationService.describe(Paths.get(project));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(documentationService.toCsv(documentation));
    }

    @GetMapping("/profiles")
    public ResponseEntity<ProfilesListResponse> listProfiles() {
        return ResponseEntity.ok(ProfilesListResponse.builder()
                .profiles(profileRegistry.listProfiles())
                .build());
    }

    @PostMapping("/profiles/reload")
    public ResponseEntity<ProfilesReloadResponse> reloadProfiles() {
        int loaded = profileRegistry.reloadProfiles();
        ProfilesReloadResponse response = new ProfilesReloadResponse();
        response.setStatus("OK");
        response.setLoaded(loaded);
        response.setReloadedAt(OffsetDateTime.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Run an extraction with the values stored in a profile.
     *
     * POST /v1/profiles/{name}/extract
     */
    @PostMapping("/profiles/{name}/extract")
    public ResponseEntity<ExtractionResult> extractWithProfile(@PathVariable("name") String name) {
        ExtractionProfile profile = profileRegistry.getProfile(name);
        if (profile.getOutputProject() == null || profile.getOutputProject().isBlank()) {
            throw new IllegalArgumentException("Profile " + name + " has no output_project");
        }
        log.info("Running extraction profile {} ({})", name, profile.getSourceFile());
        ExtractionResult result = runExtraction(
                profile.getProjects(),
                profile.getDatasourcePattern(),
                profile.getMatchMode(),
                profile.getOutputProject());
        return ResponseEntity.ok(result);
    }

    /**
     * Health check endpoint.
     *
     * GET /v1/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, String>> getStatus() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private ExtractionResult runExtraction(List<String> projects, String pattern, MatchMode mode, String outputProject) {
        Path output = projectSourceSettings.resolveOutput(outputProject);
        List<Path> candidates = projectSourceSettings.resolveCandidates(projects);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No project files given and no default projects configured");
        }
        ExtractionRequest extraction = ExtractionRequest.builder()
                .projects(candidates)
                .datasourcePredicate(DatasourcePredicates.forPattern(pattern, mode))
                .patternDescription(DatasourcePredicates.describe(pattern, mode))
                .outputProject(output)
                .build();
        return extractionService.extract(extraction);
    }
}
