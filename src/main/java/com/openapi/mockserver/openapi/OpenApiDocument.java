package com.openapi.mockserver.openapi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of a Swagger 2.0 / OpenAPI 3.x document the mock server works with:
 * base path, operations by path template, global security and security schemes.
 */
public class OpenApiDocument {
    private final String title;
    private final String basePath;
    private final Map<String, Map<String, ApiOperation>> paths;
    private final List<SecurityRequirement> security;
    private final Map<String, SecurityScheme> securitySchemes;

    private OpenApiDocument(Builder builder) {
        this.title = builder.title;
        this.basePath = normalizeBasePath(builder.basePath);
        Map<String, Map<String, ApiOperation>> copy = new LinkedHashMap<>();
        builder.paths.forEach((template, operations) ->
                copy.put(template, Collections.unmodifiableMap(new LinkedHashMap<>(operations))));
        this.paths = Collections.unmodifiableMap(copy);
        this.security = List.copyOf(builder.security);
        this.securitySchemes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.securitySchemes));
    }

    private static String normalizeBasePath(String basePath) {
        if (basePath == null || basePath.isBlank() || basePath.equals("/")) {
            return "";
        }
        String value = basePath.trim();
        if (!value.startsWith("/")) {
            value = "/" + value;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Path prefix shared by all operations, without a trailing slash; {@code ""} if none.
     */
    public String getBasePath() {
        return basePath;
    }

    /**
     * Operations keyed by path template, then by upper-case HTTP method.
     */
    public Map<String, Map<String, ApiOperation>> getPaths() {
        return paths;
    }

    public Map<String, ApiOperation> getOperations(String pathTemplate) {
        return paths.getOrDefault(pathTemplate, Collections.emptyMap());
    }

    /**
     * Document-level security requirements, inherited by operations that declare none.
     */
    public List<SecurityRequirement> getSecurity() {
        return security;
    }

    public Map<String, SecurityScheme> getSecuritySchemes() {
        return securitySchemes;
    }

    public Optional<SecurityScheme> findSecurityScheme(String id) {
        return Optional.ofNullable(securitySchemes.get(id));
    }

    public int operationCount() {
        return paths.values().stream().mapToInt(Map::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String basePath;
        private final Map<String, Map<String, ApiOperation>> paths = new LinkedHashMap<>();
        private List<SecurityRequirement> security = List.of();
        private final Map<String, SecurityScheme> securitySchemes = new LinkedHashMap<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        /**
         * Declares a path template, possibly without operations.
         */
        public Builder path(String pathTemplate) {
            paths.computeIfAbsent(pathTemplate, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder operation(ApiOperation operation) {
            paths.computeIfAbsent(operation.getPathTemplate(), k -> new LinkedHashMap<>())
                    .put(operation.getMethod(), operation);
            return this;
        }

        public Builder security(List<SecurityRequirement> security) {
            this.security = security != null ? security : List.of();
            return this;
        }

        public Builder securityScheme(SecurityScheme scheme) {
            securitySchemes.put(scheme.id(), scheme);
            return this;
        }

        public OpenApiDocument build() {
            return new OpenApiDocument(this);
        }
    }

    @Override
    public String toString() {
        return "OpenApiDocument{" +
                "title='" + title + '\'' +
                ", basePath='" + basePath + '\'' +
                ", paths=" + paths.size() +
                ", securitySchemes=" + securitySchemes.keySet() +
                '}';
    }
}
