package com.qgistoolkit.project;

import com.qgistoolkit.ProjectFixtures;
import com.qgistoolkit.model.GroupNode;
import com.qgistoolkit.model.LayerNode;
import com.qgistoolkit.model.MapLayer;
import com.qgistoolkit.model.ProjectDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectDocumentParserTest {

    private final ProjectDocumentParser parser = new ProjectDocumentParser(new ProjectModelReader());

    @TempDir
    Path tempDir;

    @Test
    void parsesSampleProject() throws IOException {
        Path project = ProjectFixtures.copySample(tempDir, "sample.qgs");

        ProjectDocument document = parser.parse(project);

        assertThat(document.getSource()).isEqualTo(project);
        assertThat(document.getEncoding()).isEqualTo("UTF-8");
        assertThat(document.getLayers()).extracting(MapLayer::getId)
                .containsExactly("L3", "L1", "L2", "T2", "T1", "L4", "L5");
        assertThat(document.getDrawOrder()).containsExactly("L3", "L1", "L2", "T2", "T1", "L4", "L5");
        assertThat(document.getLayerTree().getGroups()).extracting(GroupNode::getName)
                .containsExactly("A", "B", "Names");
        assertThat(document.getLayerTree().getLayers()).extracting(LayerNode::getLayerId).containsExactly("L4");
        assertThat(document.getLegend().getGroups()).extracting(GroupNode::getName)
                .containsExactly("A", "B", "Names");
        assertThat(document.getLegend().getLayers()).extracting(LayerNode::getLayerId).containsExactly("L4");
        assertThat(document.getDoctypePublicId()).isEqualTo("http://mrcc.com/qgis.dtd");
    }

    @Test
    void readsLayerDetails() throws IOException {
        ProjectDocument document = parser.parse(ProjectFixtures.copySample(tempDir, "sample.qgs"));

        MapLayer bygning = document.findLayer("L3");
        assertThat(bygning.getName()).isEqualTo("bygning");
        assertThat(bygning.getDatasource()).startsWith("dbname='topo' host=kv-vm-00436");

        // id given as an attribute instead of a child element
        MapLayer janMayen = document.findLayer("L5");
        assertThat(janMayen.getName()).isEqualTo("jan_mayen");
        assertThat(janMayen.getDatasource()).contains("layers=jan_mayen&url=");
    }

    @Test
    void removesDefaultNamespaceDeclaration() throws IOException {
        ProjectDocument document = parser.parse(ProjectFixtures.copySample(tempDir, "sample.qgs"));

        assertThat(document.getDom().getDocumentElement().getTagName()).isEqualTo("qgis");
        assertThat(document.getDom().getDocumentElement().hasAttribute("xmlns")).isFalse();
        assertThat(document.getDom().getDocumentElement().getAttribute("projectname")).isEqualTo("Topo test");
    }

    @Test
    void stripNamespaceDeclarationLeavesOtherBytesAlone() {
        byte[] stripped = ProjectDocumentParser.stripNamespaceDeclaration(
                "<qgis a=\"1\" xmlns=\"http://www.qgis.org/dtd\"><x/></qgis>".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(stripped, StandardCharsets.UTF_8)).isEqualTo("<qgis a=\"1\" ><x/></qgis>");
    }

    @Test
    void parsesGzipCompressedProject() throws IOException {
        Path project = tempDir.resolve("sample.qgz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(project))) {
            out.write(ProjectFixtures.sampleBytes());
        }

        ProjectDocument document = parser.parse(project);

        assertThat(document.getLayers()).hasSize(7);
    }

    @Test
    void parsesZipCompressedProjectPreferringQgsMember() throws IOException {
        Path project = tempDir.resolve("sample.QGZ");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(project))) {
            zip.putNextEntry(new ZipEntry("sample.qgd"));
            zip.write(new byte[]{1, 2, 3});
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("sample.qgs"));
            zip.write(ProjectFixtures.sampleBytes());
            zip.closeEntry();
        }

        ProjectDocument document = parser.parse(project);

        assertThat(document.getLayers()).hasSize(7);
        assertThat(document.getSource()).isEqualTo(project);
    }

    @Test
    void rejectsCompressedProjectThatIsNeitherZipNorGzip() throws IOException {
        Path project = ProjectFixtures.writeProject(tempDir, "plain.qgz", "<qgis/>");

        assertThatThrownBy(() -> parser.parse(project))
                .isInstanceOf(ProjectParseException.class)
                .hasMessageContaining("plain.qgz");
    }

    @Test
    void missingFileIsReportedAsNotFound() {
        Path project = tempDir.resolve("missing.qgs");

        assertThatThrownBy(() -> parser.parse(project))
                .isInstanceOf(ProjectNotFoundException.class)
                .satisfies(e -> assertThat(((ProjectDocumentException) e).getProject()).isEqualTo(project));
    }

    @Test
    void unknownExtensionIsRejectedBeforeLookingForTheFile() {
        Path project = tempDir.resolve("missing.xml");

        assertThatThrownBy(() -> parser.parse(project)).isInstanceOf(UnsupportedProjectFormatException.class);
    }

    @Test
    void malformedXmlReportsPosition() throws IOException {
        Path project = ProjectFixtures.writeProject(tempDir, "broken.qgs",
                "<qgis>\n<projectlayers>\n</qgis>\n");

        assertThatThrownBy(() -> parser.parse(project))
                .isInstanceOf(ProjectParseException.class)
                .hasMessageContaining("broken.qgs")
                .satisfies(e -> assertThat(((ProjectParseException) e).getLineNumber()).isGreaterThan(0));
    }

    @Test
    void missingSectionsYieldEmptyStructures() {
        ProjectDocument document = parser.parse("<qgis/>".getBytes(StandardCharsets.UTF_8), Path.of("empty.qgs"));

        assertThat(document.getLayers()).isEmpty();
        assertThat(document.getDrawOrder()).isEmpty();
        assertThat(document.getLayerTree().getGroups()).isEmpty();
        assertThat(document.getLayerTree().getLayers()).isEmpty();
        assertThat(document.getLegend().getGroups()).isEmpty();
    }

    @Test
    void skipsMapLayersWithoutId() {
        String xml = ProjectFixtures.project(
                ProjectFixtures.mapLayer("", "nameless", "a.shp") + ProjectFixtures.mapLayer("K1", "kept", "b.shp"),
                "", "", ProjectFixtures.orderEntry("K1"));

        ProjectDocument document = parser.parse(xml.getBytes(StandardCharsets.UTF_8), Path.of("ids.qgs"));

        assertThat(document.getLayers().stream().map(MapLayer::getId).collect(Collectors.toList()))
                .containsExactly("K1");
    }
}
