package com.openapi.mockserver.openapi;

import java.time.Duration;

/**
 * Configuration for the {@link OperationResolver} path-match cache.
 *
 * @param cacheEnabled whether resolved paths are cached
 * @param maxSize      maximum number of cached request paths
 * @param ttl          how long a cached match is kept after it was written
 */
public record ResolverConfig(boolean cacheEnabled, long maxSize, Duration ttl) {

    public ResolverConfig {
        if (maxSize <= 0) {
            maxSize = 1000;
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            ttl = Duration.ofMinutes(10);
        }
    }

    public static ResolverConfig defaults() {
        return new ResolverConfig(true, 1000, Duration.ofMinutes(10));
    }

    public static ResolverConfig disabled() {
        return new ResolverConfig(false, 1000, Duration.ofMinutes(10));
    }
}
