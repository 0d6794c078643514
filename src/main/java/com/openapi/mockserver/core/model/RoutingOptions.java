package com.openapi.mockserver.core.model;

import java.util.Locale;

/**
 * Routing rules used when comparing request paths and resource keys.
 *
 * @param caseSensitive whether {@code /Pets} and {@code /pets} are different paths
 * @param strict        whether {@code /pets/} and {@code /pets} are different paths
 */
public record RoutingOptions(boolean caseSensitive, boolean strict) {

    /**
     * Case-insensitive, non-strict routing.
     */
    public static RoutingOptions defaults() {
        return new RoutingOptions(false, false);
    }

    /**
     * Normalizes a path according to these options.
     * Lower-cases unless case-sensitive; strips a single trailing slash unless strict.
     */
    public String normalize(String path) {
        String value = path == null ? "" : path;
        if (!caseSensitive) {
            value = value.toLowerCase(Locale.ROOT);
        }
        if (!strict && value.length() > 1 && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
