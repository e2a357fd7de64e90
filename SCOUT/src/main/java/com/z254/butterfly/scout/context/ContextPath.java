package com.z254.butterfly.scout.context;

import com.z254.butterfly.scout.exception.ContextPathException;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slash-delimited key into the shared context, e.g. {@code repo/analysis_status/security}.
 * Leading and trailing slashes are ignored; empty segments are rejected.
 * The root path has no segments and is a prefix of every path.
 */
@EqualsAndHashCode
public final class ContextPath implements Comparable<ContextPath> {

    public static final String SEPARATOR = "/";

    public static final ContextPath ROOT = new ContextPath(List.of());

    private final List<String> segments;

    private ContextPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Parse a raw path. {@code null}, blank and {@code "/"} all denote the root.
     */
    public static ContextPath of(String raw) {
        if (raw == null) {
            return ROOT;
        }
        String trimmed = raw.strip();
        while (trimmed.startsWith(SEPARATOR)) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(SEPARATOR)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return ROOT;
        }
        String[] parts = trimmed.split(SEPARATOR, -1);
        List<String> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isBlank()) {
                throw new ContextPathException("Context path contains an empty segment", raw);
            }
            segments.add(part);
        }
        return new ContextPath(segments);
    }

    public List<String> getSegments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Last segment, or the empty string for the root.
     */
    public String leaf() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public ContextPath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new ContextPath(new ArrayList<>(segments.subList(0, segments.size() - 1)));
    }

    /**
     * Segment-wise prefix test: {@code repo} is a prefix of {@code repo/files} and of itself,
     * but not of {@code repository}.
     */
    public boolean isPrefixOf(ContextPath other) {
        if (other.segments.size() < segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).equals(other.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    public ContextPath resolve(ContextPath child) {
        if (child.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return child;
        }
        List<String> joined = new ArrayList<>(segments.size() + child.segments.size());
        joined.addAll(segments);
        joined.addAll(child.segments);
        return new ContextPath(joined);
    }

    public ContextPath resolve(String child) {
        return resolve(of(child));
    }

    /**
     * Strip this path from the front of {@code descendant}.
     *
     * @throws IllegalArgumentException if this path is not a prefix of {@code descendant}
     */
    public ContextPath relativize(ContextPath descendant) {
        if (!isPrefixOf(descendant)) {
            throw new IllegalArgumentException(descendant + " is not under " + this);
        }
        return new ContextPath(new ArrayList<>(descendant.segments.subList(segments.size(), descendant.segments.size())));
    }

    @Override
    public int compareTo(ContextPath other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
