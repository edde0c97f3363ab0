package com.qgistoolkit.project;

import java.util.List;

/**
 * Thrown when no candidate project contains a layer matching the datasource predicate.
 */
public class NoMatchingLayersException extends ProjectDocumentException {
    private final List<String> failures;

    /**
     * Create a new exception.
     *
     * @param patternDescription human-readable form of the predicate
     * @param candidateCount number of candidate projects examined
     * @param failures candidates that could not be processed, as {@code path: reason}
     */
    public NoMatchingLayersException(String patternDescription, int candidateCount, List<String> failures) {
        super("No layers matching " + patternDescription + " found in any of " + candidateCount + " project file(s)",
                null, null, null);
        this.failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public List<String> getFailures() {
        return failures;
    }
}
