package com.xjx.xnode.path;

import com.xjx.common.Paths;
import com.xjx.xnode.context.TransformContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Compiled dot-path patterns. A path matches when any pattern matches all of its segments.
 * <ul>
 *     <li>{@code name} matches that segment exactly</li>
 *     <li>{@code *} matches exactly one segment</li>
 *     <li>{@code **} matches zero or more segments</li>
 *     <li>{@code @name} and {@code @*} match the last segment of an attribute context only;
 *     a plain {@code name} never matches an attribute</li>
 * </ul>
 * {@code root.items.*.price} matches {@code root.items.0.price} but not {@code root.items.0.price.currency}.
 */
public final class PathMatcher {
    private static final String ANY = "*";
    private static final String DEEP = "**";

    private final List<List<String>> patterns;

    private PathMatcher(List<List<String>> patterns) {
        this.patterns = patterns;
    }

    public static PathMatcher compile(String... patterns) {
        if (patterns == null || patterns.length == 0)
            throw new IllegalArgumentException("At least one path pattern is required");
        List<List<String>> compiled = new ArrayList<>();
        for (String p : patterns) {
            if (p == null || p.isBlank()) throw new IllegalArgumentException("Blank path pattern in " + Arrays.toString(patterns));
            List<String> segs = Paths.segments(p.trim());
            if (segs.stream().anyMatch(String::isEmpty))
                throw new IllegalArgumentException("Empty segment in path pattern '" + p + "'");
            compiled.add(List.copyOf(segs));
        }
        return new PathMatcher(List.copyOf(compiled));
    }

    public boolean matches(String path) {
        return matches(Paths.segments(path), false);
    }

    public boolean matches(TransformContext context) {
        return matches(Paths.segments(context.path()), context.attribute());
    }

    private boolean matches(List<String> segments, boolean lastIsAttribute) {
        for (List<String> pattern : patterns)
            if (match(pattern, 0, segments, 0, lastIsAttribute)) return true;
        return false;
    }

    private static boolean match(List<String> pattern, int pi, List<String> path, int si, boolean lastIsAttribute) {
        if (pi == pattern.size()) return si == path.size();
        String p = pattern.get(pi);
        if (p.equals(DEEP)) {
            for (int k = si; k <= path.size(); k++)
                if (match(pattern, pi + 1, path, k, lastIsAttribute)) return true;
            return false;
        }
        if (si == path.size()) return false;
        boolean attributeSegment = lastIsAttribute && si == path.size() - 1;
        return segmentMatches(p, path.get(si), attributeSegment) && match(pattern, pi + 1, path, si + 1, lastIsAttribute);
    }

    private static boolean segmentMatches(String pattern, String segment, boolean attributeSegment) {
        if (pattern.equals(ANY)) return true;
        if (pattern.startsWith("@")) {
            String name = pattern.substring(1);
            if (attributeSegment) return name.equals(ANY) || name.equals(segment);
            return pattern.equals(segment); // a field named "@x" from an attributes-as-fields source
        }
        return !attributeSegment && pattern.equals(segment);
    }

    @Override
    public String toString() {
        return "PathMatcher" + patterns;
    }
}
