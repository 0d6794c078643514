package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Locale;

/**
 * The parts of an HTTP request the mock handlers work with.
 *
 * @param method upper-case HTTP method
 * @param path   full request path, e.g. {@code /api/pets/fido}
 * @param body   parsed request body; {@link MissingNode} when there is none
 */
public record MockRequest(String method, String path, JsonNode body) {

    public MockRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
        method = method.toUpperCase(Locale.ROOT);
        body = body != null ? body : MissingNode.getInstance();
    }

    public MockRequest(String method, String path) {
        this(method, path, null);
    }
}
