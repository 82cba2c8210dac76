package com.xjx.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Dot-notation paths: {@code root.items.item.price}.
 * Segments never contain a dot; an empty path has no segments.
 */
public interface Paths {

    String SEPARATOR = ".";

    static String append(String parent, String segment) {
        if (segment == null || segment.isEmpty()) return parent == null ? "" : parent;
        if (parent == null || parent.isEmpty()) return segment;
        return parent + SEPARATOR + segment;
    }

    static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        if (path == null || path.isEmpty()) return out;
        int start = 0;
        while (true) {
            int dot = path.indexOf('.', start);
            if (dot < 0) {
                out.add(path.substring(start));
                return out;
            }
            out.add(path.substring(start, dot));
            start = dot + 1;
        }
    }
}
