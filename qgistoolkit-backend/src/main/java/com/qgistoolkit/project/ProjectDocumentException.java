package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Base class for failures tied to one project document and, where known, one layer.
 */
public class ProjectDocumentException extends RuntimeException {
    private final Path project;
    private final String layerId;

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param project offending project document (may be null)
     * @param layerId offending layer identifier (may be null)
     * @param cause underlying cause (may be null)
     */
    public ProjectDocumentException(String message, Path project, String layerId, Throwable cause) {
        super(message, cause);
        this.project = project;
        this.layerId = layerId;
    }

    public Path getProject() {
        return project;
    }

    public String getLayerId() {
        return layerId;
    }
}
