package com.qgistoolkit.project;

import com.qgistoolkit.model.ProjectDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes project documents as XML with a declaration in the source document's encoding.
 * The target extension picks the container, see {@link ProjectFormat#encode(byte[], Path)}.
 */
@Slf4j
@Component
public class ProjectDocumentSerializer {

    public byte[] serialize(ProjectDocument document) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            newTransformer(document).transform(new DOMSource(document.getDom()), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new ProjectWriteException("Could not serialize " + document.getSource() + ": " + e.getMessage(),
                    document.getSource(), e);
        }
    }

    /**
     * Serialize and write to {@code target}, creating missing parent directories.
     *
     * @param document document to write
     * @param target output path
     * @throws UnsupportedProjectFormatException when the target is neither {@code .qgs} nor {@code .qgz}
     * @throws ProjectWriteException when serialization or writing fails
     */
    public void write(ProjectDocument document, Path target) {
        ProjectFormat format = ProjectFormat.fromPath(target);
        byte[] content;
        try {
            content = format.encode(serialize(document), target);
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, content);
        } catch (IOException e) {
            throw new ProjectWriteException("Could not write " + target + ": " + e.getMessage(), target, e);
        }
        log.info("Wrote {} ({} bytes, {}, {})", target, content.length, document.getEncoding(), format);
    }

    private Transformer newTransformer(ProjectDocument document) throws TransformerException {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        transformer.setOutputProperty(OutputKeys.ENCODING, document.getEncoding());
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
        transformer.setOutputProperty(OutputKeys.INDENT, "no");
        if (document.getDoctypeSystemId() != null) {
            transformer.setOutputProperty(OutputKeys.DOCTYPE_SYSTEM, document.getDoctypeSystemId());
            if (document.getDoctypePublicId() != null) {
                transformer.setOutputProperty(OutputKeys.DOCTYPE_PUBLIC, document.getDoctypePublicId());
            }
        }
        return transformer;
    }
}
