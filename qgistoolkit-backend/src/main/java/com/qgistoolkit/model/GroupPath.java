package com.qgistoolkit.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root-to-node sequence of group names.
 *
 * <p>The root group contributes no segment, so {@link #ROOT} is the empty path. The string form
 * joins segments with {@code /}; segments are kept separately so names containing a slash still
 * walk correctly during reassembly.
 */
@EqualsAndHashCode
public final class GroupPath {
    public static final String SEPARATOR = "/";
    public static final GroupPath ROOT = new GroupPath(List.of());

    private final List<String> segments;

    private GroupPath(List<String> segments) {
        this.segments = segments;
    }

    public GroupPath child(String name) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(name);
        return new GroupPath(Collections.unmodifiableList(next));
    }

    public List<String> getSegments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public String asString() {
        return String.join(SEPARATOR, segments);
    }

    @Override
    public String toString() {
        return asString();
    }
}
