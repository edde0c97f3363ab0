package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Thrown when a project document path does not exist.
 */
public class ProjectNotFoundException extends ProjectDocumentException {
    public ProjectNotFoundException(Path project) {
        super("Project file not found: " + project, project, null, null);
    }
}
