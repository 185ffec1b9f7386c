package com.bko.gateway.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for response paths. A concrete path holds field names ({@link String}) and list
 * indexes ({@link Integer}); a declared flatten path may also hold the list wildcard.
 */
public final class ResponsePath {

    public static final String WILDCARD = "@";

    private ResponsePath() {
    }

    public static boolean isWildcard(Object segment) {
        return WILDCARD.equals(segment);
    }

    public static List<Object> append(List<Object> base, List<?> suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return base;
        }
        List<Object> path = new ArrayList<>(base.size() + suffix.size());
        path.addAll(base);
        path.addAll(suffix);
        return Collections.unmodifiableList(path);
    }

    public static List<Object> appendSegment(List<Object> base, Object segment) {
        List<Object> path = new ArrayList<>(base.size() + 1);
        path.addAll(base);
        path.add(segment);
        return Collections.unmodifiableList(path);
    }

    /**
     * Returns the segments of {@code path} before its first wildcard.
     */
    public static List<Object> concretePrefix(List<?> path) {
        List<Object> prefix = new ArrayList<>();
        for (Object segment : path) {
            if (isWildcard(segment)) {
                break;
            }
            prefix.add(segment);
        }
        return Collections.unmodifiableList(prefix);
    }
}
