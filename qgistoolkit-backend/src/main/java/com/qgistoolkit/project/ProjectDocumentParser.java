package com.qgistoolkit.project;

import com.qgistoolkit.model.ProjectDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Loads a project document from disk into a {@link ProjectDocument}.
 *
 * <p>The default QGIS namespace declaration is removed from the raw bytes before parsing so that
 * lookups can use unqualified tag names. It is never re-attached: a written document is
 * schema-equivalent to its source but not byte-identical in that declaration.
 */
@Slf4j
@Component
public class ProjectDocumentParser {

    static final byte[] QGIS_NAMESPACE_DECLARATION =
            "xmlns=\"http://www.qgis.org/dtd\"".getBytes(StandardCharsets.US_ASCII);

    private final ProjectModelReader modelReader;

    public ProjectDocumentParser(ProjectModelReader modelReader) {
        this.modelReader = modelReader;
    }

    /**
     * Parse a {@code .qgs} or {@code .qgz} file.
     *
     * @param projectFile project path
     * @return parsed document
     * @throws UnsupportedProjectFormatException for an unknown extension
     * @throws ProjectNotFoundException when the file does not exist
     * @throws ProjectParseException when the file cannot be read or is malformed
     */
    public ProjectDocument parse(Path projectFile) {
        ProjectFormat format = ProjectFormat.fromPath(projectFile);
        if (!Files.isRegularFile(projectFile)) {
            throw new ProjectNotFoundException(projectFile);
        }

        byte[] content;
        try {
            content = format.decode(Files.readAllBytes(projectFile), projectFile);
        } catch (NoSuchFileException e) {
            throw new ProjectNotFoundException(projectFile);
        } catch (IOException e) {
            throw new ProjectParseException("Could not read " + projectFile + ": " + e.getMessage(), projectFile, e);
        }

        ProjectDocument document = parse(content, projectFile);
        log.debug("Parsed {} ({} layers, encoding {})", projectFile, document.getLayers().size(), document.getEncoding());
        return document;
    }

    /**
     * Parse document XML that is already in memory.
     *
     * @param content XML bytes
     * @param source path used in error messages and on the returned document
     * @return parsed document
     */
    public ProjectDocument parse(byte[] content, Path source) {
        Document dom = parseXml(stripNamespaceDeclaration(content), source);
        return modelReader.read(dom, source);
    }

    static byte[] stripNamespaceDeclaration(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length);
        int i = 0;
        while (i < content.length) {
            if (regionMatches(content, i, QGIS_NAMESPACE_DECLARATION)) {
                i += QGIS_NAMESPACE_DECLARATION.length;
            } else {
                out.write(content[i]);
                i++;
            }
        }
        return out.toByteArray();
    }

    private static boolean regionMatches(byte[] content, int offset, byte[] needle) {
        if (offset + needle.length > content.length) {
            return false;
        }
        for (int j = 0; j < needle.length; j++) {
            if (content[offset + j] != needle[j]) {
                return false;
            }
        }
        return true;
    }

    private Document parseXml(byte[] content, Path source) {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(content));
        } catch (SAXParseException e) {
            throw new ProjectParseException(
                    "Could not parse XML in " + source + " at line " + e.getLineNumber()
                            + ", column " + e.getColumnNumber() + ": " + e.getMessage(),
                    source, e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new ProjectParseException("Could not parse XML in " + source + ": " + e.getMessage(), source, e);
        }
    }

    static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }
}
