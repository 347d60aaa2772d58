package com.nfv.structmatch.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * Matching of tree paths such as {@code metadata.labels.app} or {@code items[2].name}
 * against ignore patterns.
 *
 * Supported patterns:
 * - Exact match: "field.name" also matches "field.name.sub" and "field.name[0]" (auto-prefix)
 * - Prefix match: "field.name*" or "field.name.*"
 * - Suffix match: "*field.name" or ".*field.name"
 * - Contains match: "*field.name*"
 */
@Slf4j
public final class PathPatterns {

    private PathPatterns() {
    }

    /**
     * Check if a path is matched by any of the patterns
     *
     * @param path path without the v1/v2 root, e.g. "spec.replicas"
     * @param patterns ignore patterns, may be null
     */
    public static boolean matchesAny(String path, Collection<String> patterns) {
        if (path == null || patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(path, pattern)) {
                log.debug("Path '{}' ignored by pattern '{}'", path, pattern);
                return true;
            }
        }
        return false;
    }

    public static boolean matches(String path, String pattern) {
        if (path == null || pattern == null || pattern.isEmpty()) {
            return false;
        }

        int startOffset = 0;
        if (pattern.startsWith(".*")) {
            startOffset = 2;
        } else if (pattern.startsWith("*")) {
            startOffset = 1;
        }

        int endOffset = 0;
        if (pattern.endsWith(".*")) {
            endOffset = 2;
        } else if (pattern.endsWith("*")) {
            endOffset = 1;
        }

        if (startOffset + endOffset >= pattern.length()) {
            // "*" or ".*" alone
            return true;
        }

        boolean startsWithWildcard = startOffset > 0;
        boolean endsWithWildcard = endOffset > 0;
        String body = pattern.substring(startOffset, pattern.length() - endOffset);

        if (startsWithWildcard && endsWithWildcard) {
            return path.contains(body);
        }
        if (startsWithWildcard) {
            return path.endsWith(body);
        }
        // prefix and exact patterns both cover nested paths
        return path.equals(body)
                || path.startsWith(body + ".")
                || path.startsWith(body + "[");
    }
}
