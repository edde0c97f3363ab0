package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Thrown when a path has neither a {@code .qgs} nor a {@code .qgz} extension.
 */
public class UnsupportedProjectFormatException extends ProjectDocumentException {
    public UnsupportedProjectFormatException(Path project) {
        super("Unsupported file type: " + project + ". Expected a .qgs or .qgz file.", project, null, null);
    }
}
