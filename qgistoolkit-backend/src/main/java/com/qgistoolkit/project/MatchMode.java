package com.qgistoolkit.project;

/**
 * How a datasource pattern is applied.
 */
public enum MatchMode {
    CONTAINS,
    CONTAINS_IGNORE_CASE,
    REGEX
}
