package com.qgistoolkit.project;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds datasource predicates from user-supplied patterns.
 */
public final class DatasourcePredicates {

    private DatasourcePredicates() {
    }

    /**
     * Build a predicate over datasource strings.
     *
     * @param pattern pattern text
     * @param mode match mode; {@code null} means {@link MatchMode#CONTAINS}
     * @return predicate, never matching a {@code null} datasource
     * @throws IllegalArgumentException for a blank pattern or an invalid regular expression
     */
    public static Predicate<String> forPattern(String pattern, MatchMode mode) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("datasource_pattern is required");
        }
        MatchMode resolved = mode != null ? mode : MatchMode.CONTAINS;
        switch (resolved) {
            case CONTAINS_IGNORE_CASE: {
                String needle = pattern.toLowerCase(Locale.ROOT);
                return datasource -> datasource != null && datasource.toLowerCase(Locale.ROOT).contains(needle);
            }
            case REGEX: {
                Pattern compiled;
                try {
                    compiled = Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid datasource regex: " + e.getDescription(), e);
                }
                return datasource -> datasource != null && compiled.matcher(datasource).find();
            }
            case CONTAINS:
            default:
                return datasource -> datasource != null && datasource.contains(pattern);
        }
    }

    /**
     * Human-readable description of a pattern, for logs and error messages.
     */
    public static String describe(String pattern, MatchMode mode) {
        MatchMode resolved = mode != null ? mode : MatchMode.CONTAINS;
        return "'" + pattern + "' (" + resolved.name().toLowerCase(Locale.ROOT) + ")";
    }
}
