package com.openapi.mockserver.rest.security;

import java.util.Arrays;

/**
 * Configuration for Cross-Origin Resource Sharing (CORS).
 *
 * <p>Populated from MicroProfile Config:</p>
 * <pre>
 * openapi-mock:
 *   cors:
 *     enabled: true
 *     allowed-origins: "*"
 *     allowed-methods: "GET,POST,PUT,PATCH,DELETE,OPTIONS"
 *     allowed-headers: "Content-Type,Authorization"
 *     max-age: 86400
 * </pre>
 *
 * <p>{@code allowedMethods} and {@code allowedHeaders} are fallbacks: the filter prefers
 * the methods the OpenAPI path defines and the headers the preflight asks for.</p>
 *
 * @param enabled        whether CORS filtering is enabled
 * @param allowedOrigins comma-separated allowed origins ("*" for all)
 * @param allowedMethods comma-separated fallback HTTP methods
 * @param allowedHeaders comma-separated fallback headers
 * @param maxAge         preflight cache duration in seconds
 */
public record CorsConfig(
        boolean enabled,
        String allowedOrigins,
        String allowedMethods,
        String allowedHeaders,
        long maxAge
) {

    public CorsConfig {
        if (allowedOrigins == null || allowedOrigins.isBlank()) {
            allowedOrigins = "*";
        }
        if (allowedMethods == null || allowedMethods.isBlank()) {
            allowedMethods = "GET,POST,PUT,PATCH,DELETE,OPTIONS";
        }
        if (allowedHeaders == null || allowedHeaders.isBlank()) {
            allowedHeaders = "Content-Type,Authorization";
        }
        if (maxAge < 0) {
            maxAge = 86400;
        }
    }

    /**
     * Default CORS configuration: all origins, standard methods, 24h cache.
     */
    public static CorsConfig defaults() {
        return new CorsConfig(true, "*", null, null, 86400);
    }

    /**
     * Disabled CORS configuration.
     */
    public static CorsConfig disabled() {
        return new CorsConfig(false, "*", null, null, 86400);
    }

    public boolean allowsAnyOrigin() {
        return "*".equals(allowedOrigins.trim());
    }

    /**
     * Returns true if the origin may access the server.
     */
    public boolean isOriginAllowed(String origin) {
        if (allowsAnyOrigin()) {
            return true;
        }
        return origin != null && Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .anyMatch(origin::equalsIgnoreCase);
    }
}
