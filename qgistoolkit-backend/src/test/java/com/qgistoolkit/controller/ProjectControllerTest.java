package com.qgistoolkit.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qgistoolkit.ProjectFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "toolkit.profiles.path=" + ProjectControllerTest.PROFILES_DIR,
        "toolkit.projects.defaults=",
        "toolkit.output.dir=" + ProjectControllerTest.OUTPUT_DIR
})
@AutoConfigureMockMvc
class ProjectControllerTest {

    static final String PROFILES_DIR = "target/controller-test-profiles";
    static final String OUTPUT_DIR = "target/controller-test-output";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @TempDir
    Path tempDir;

    private Path sample;

    @BeforeEach
    void setUp() throws IOException {
        sample = ProjectFixtures.copySample(tempDir, "Topo_2025.qgs");
    }

    @Test
    void extractsMatchingLayers() throws Exception {
        Path output = outputDir().resolve("extracted/navn.qgs");
        Files.deleteIfExists(output);

        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projects", List.of(sample.toString()),
                                "datasource_pattern", "topotest/navn",
                                "output_project", "extracted/navn.qgs"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source_project").value(sample.toString()))
                .andExpect(jsonPath("$.output_project").value(output.toString()))
                .andExpect(jsonPath("$.layer_count").value(2))
                .andExpect(jsonPath("$.layer_ids[0]").value("T2"))
                .andExpect(jsonPath("$.layer_ids[1]").value("T1"));

        assertThat(Files.isRegularFile(output)).isTrue();
    }

    @Test
    void extractRejectsOutputOutsideTheOutputDirectory() throws Exception {
        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projects", List.of(sample.toString()),
                                "datasource_pattern", "topotest/navn",
                                "output_project", "../escape.qgs"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value(containsString("must stay inside")));

        assertThat(Files.exists(outputDir().resolve("../escape.qgs").normalize())).isFalse();
    }

    @Test
    void extractRejectsUnsupportedOutputFormat() throws Exception {
        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projects", List.of(sample.toString()),
                                "datasource_pattern", "topotest/navn",
                                "output_project", "navn.xml"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_FORMAT"));
    }

    @Test
    void extractRequiresPatternAndOutput() throws Exception {
        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("projects", List.of(sample.toString())))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details").value(containsString("datasource_pattern is required")));
    }

    @Test
    void extractWithoutAnyCandidateIsRejected() throws Exception {
        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "datasource_pattern", "topotest",
                                "output_project", "x.qgs"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void extractReportsNoMatch() throws Exception {
        Path output = outputDir().resolve("none.qgs");

        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projects", List.of(tempDir.resolve("missing.qgs").toString(), sample.toString()),
                                "datasource_pattern", "no-such-source",
                                "output_project", "none.qgs"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_MATCHING_LAYERS"))
                .andExpect(jsonPath("$.details").value(containsString("missing.qgs")));

        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void extractRejectsInvalidRegex() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projects", List.of(sample.toString()));
        body.put("datasource_pattern", "(unclosed");
        body.put("match_mode", "REGEX");
        body.put("output_project", "x.qgs");

        mockMvc.perform(post("/v1/layers/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void returnsLayerTree() throws Exception {
        mockMvc.perform(get("/v1/projects/tree").param("project", sample.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path_to_node['A/Land'].layers[0].id").value("L1"))
                .andExpect(jsonPath("$.path_to_node['Names'].groups[0]").value("Names/Text"))
                .andExpect(jsonPath("$.layer_to_path.L3").value("B"))
                .andExpect(jsonPath("$.layer_to_path.L4").value(""))
                .andExpect(jsonPath("$.layer_to_path.L5").doesNotExist());
    }

    @Test
    void returnsLayerDocumentation() throws Exception {
        mockMvc.perform(get("/v1/projects/layers").param("project", sample.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.layer_count").value(7))
                .andExpect(jsonPath("$.ungrouped_count").value(2))
                .andExpect(jsonPath("$.providers.postgres").value(2))
                .andExpect(jsonPath("$.layers[0].min_scale").value("1:50000"));
    }

    @Test
    void returnsLayerDocumentationAsCsv() throws Exception {
        mockMvc.perform(get("/v1/projects/layers.csv").param("project", sample.toString()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("Layer Name,Layer ID,Group Path,Datasource,Min Scale,Max Scale")));
    }

    @Test
    void mapsDocumentErrorsToStatusCodes() throws Exception {
        Path broken = ProjectFixtures.writeProject(tempDir, "broken.qgs", "<qgis>\n<projectlayers>\n</qgis>\n");

        mockMvc.perform(get("/v1/projects/tree").param("project", tempDir.resolve("missing.qgs").toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROJECT_NOT_FOUND"))
                .andExpect(jsonPath("$.project").value(tempDir.resolve("missing.qgs").toString()));

        mockMvc.perform(get("/v1/projects/tree").param("project", tempDir.resolve("notes.txt").toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_FORMAT"));

        mockMvc.perform(get("/v1/projects/layers").param("project", broken.toString()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("PARSE_ERROR"))
                .andExpect(jsonPath("$.details").value(startsWith("line ")));

        mockMvc.perform(get("/v1/projects/layers"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void runsExtractionProfiles() throws Exception {
        Path profilesDir = Paths.get(PROFILES_DIR);
        Files.createDirectories(profilesDir);
        Path output = outputDir().resolve("profile/db.qgs");
        Files.deleteIfExists(output);
        Files.writeString(profilesDir.resolve("controller-test.yml"), String.join("\n",
                "profiles:",
                "  - name: database-layers",
                "    datasourcePattern: host=kv-vm-00436",
                "    projects:",
                "      - " + sample,
                "    outputProject: profile/db.qgs",
                "  - name: no-output",
                "    datasourcePattern: x",
                ""));

        try {
            mockMvc.perform(post("/v1/profiles/reload"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("OK"))
                    .andExpect(jsonPath("$.loaded").value(2));

            mockMvc.perform(get("/v1/profiles"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.profiles[0].name").value("database-layers"))
                    .andExpect(jsonPath("$.profiles[0].source_file").value("controller-test.yml"));

            mockMvc.perform(post("/v1/profiles/database-layers/extract"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.layer_ids[0]").value("L3"))
                    .andExpect(jsonPath("$.layer_ids[1]").value("L2"));
            assertThat(Files.isRegularFile(output)).isTrue();

            mockMvc.perform(post("/v1/profiles/no-output/extract"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

            mockMvc.perform(post("/v1/profiles/unknown/extract"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("PROFILE_NOT_FOUND"));
        } finally {
            Files.deleteIfExists(profilesDir.resolve("controller-test.yml"));
            mockMvc.perform(post("/v1/profiles/reload"));
        }
    }

    @Test
    void reportsStatus() throws Exception {
        mockMvc.perform(get("/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private static Path outputDir() {
        return Paths.get(OUTPUT_DIR).toAbsolutePath().normalize();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
