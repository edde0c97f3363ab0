package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Thrown when a rebuilt document cannot be serialized or persisted.
 */
public class ProjectWriteException extends ProjectDocumentException {
    public ProjectWriteException(String message, Path target, Throwable cause) {
        super(message, target, null, cause);
    }
}
