package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Thrown when a rebuilt document would violate the consistency of its layer-indexed sections, or a
 * source subtree cannot be copied.
 */
public class ReassemblyException extends ProjectDocumentException {
    public ReassemblyException(String message, Path project, String layerId) {
        super(message, project, layerId, null);
    }

    public ReassemblyException(String message, Path project, String layerId, Throwable cause) {
        super(message, project, layerId, cause);
    }
}
