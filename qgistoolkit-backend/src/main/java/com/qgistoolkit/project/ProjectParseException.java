package com.qgistoolkit.project;

import java.nio.file.Path;

/**
 * Thrown when a project document cannot be read or is not well-formed XML.
 */
public class ProjectParseException extends ProjectDocumentException {
    private final int lineNumber;
    private final int columnNumber;

    public ProjectParseException(String message, Path project, Throwable cause) {
        this(message, project, -1, -1, cause);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param project project document
     * @param lineNumber line reported by the XML parser, or -1
     * @param columnNumber column reported by the XML parser, or -1
     * @param cause underlying cause
     */
    public ProjectParseException(String message, Path project, int lineNumber, int columnNumber, Throwable cause) {
        super(message, project, null, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}
