package com.openapi.mockserver.openapi;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * A single operation (path template + HTTP method) of an OpenAPI document,
 * reduced to what the mock server needs.
 */
public class ApiOperation {
    private final String method;
    private final String pathTemplate;
    private final String operationId;
    private final List<SecurityRequirement> security;
    private final int successStatus;
    private final boolean collectionResponse;
    private final boolean emptyResponse;
    private final JsonNode example;

    private ApiOperation(Builder builder) {
        this.method = builder.method.toUpperCase(Locale.ROOT);
        this.pathTemplate = builder.pathTemplate;
        this.operationId = builder.operationId;
        this.security = builder.security != null ? List.copyOf(builder.security) : null;
        this.successStatus = builder.successStatus;
        this.collectionResponse = builder.collectionResponse;
        this.emptyResponse = builder.emptyResponse;
        this.example = builder.example;
    }

    /**
     * Upper-case HTTP method, e.g. {@code POST}.
     */
    public String getMethod() {
        return method;
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    public String getOperationId() {
        return operationId;
    }

    /**
     * Operation-level security requirements.
     *
     * @return the requirements, an empty list when security is explicitly disabled,
     *         or null when the operation inherits the document's global requirements
     */
    public List<SecurityRequirement> getSecurity() {
        return security;
    }

    /**
     * Status code of the operation's primary success response.
     */
    public int getSuccessStatus() {
        return successStatus;
    }

    /**
     * True if the success response body is an array.
     */
    public boolean isCollectionResponse() {
        return collectionResponse;
    }

    /**
     * True if the success response has no body.
     */
    public boolean isEmptyResponse() {
        return emptyResponse;
    }

    /**
     * Example body of the success response, or null if the document gives none.
     */
    public JsonNode getExample() {
        return example;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String method;
        private String pathTemplate;
        private String operationId;
        private List<SecurityRequirement> security;
        private int successStatus = 200;
        private boolean collectionResponse;
        private boolean emptyResponse;
        private JsonNode example;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder pathTemplate(String pathTemplate) {
            this.pathTemplate = pathTemplate;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = operationId;
            return this;
        }

        public Builder security(List<SecurityRequirement> security) {
            this.security = security;
            return this;
        }

        public Builder successStatus(int successStatus) {
            this.successStatus = successStatus;
            return this;
        }

        public Builder collectionResponse(boolean collectionResponse) {
            this.collectionResponse = collectionResponse;
            return this;
        }

        public Builder emptyResponse(boolean emptyResponse) {
            this.emptyResponse = emptyResponse;
            return this;
        }

        public Builder example(JsonNode example) {
            this.example = example == null || example.isMissingNode() || example.isNull() ? null : example;
            return this;
        }

        public ApiOperation build() {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("method must not be null or blank");
            }
            if (pathTemplate == null || !pathTemplate.startsWith("/")) {
                throw new IllegalArgumentException("pathTemplate must start with '/': " + pathTemplate);
            }
            return new ApiOperation(this);
        }
    }

    @Override
    public String toString() {
        return method + " " + pathTemplate;
    }
}
