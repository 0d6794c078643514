package com.openapi.mockserver.handler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime exception carrying the HTTP status (and any extra headers) the mock server
 * should respond with.
 */
public class MockException extends RuntimeException {

    private final int status;
    private final Map<String, String> headers;

    public MockException(int status, String message) {
        this(status, message, Map.of());
    }

    public MockException(int status, String message, Map<String, String> headers) {
        super(message);
        this.status = status;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static MockException notFound(String path) {
        return new MockException(404, "Not Found: " + path);
    }

    public static MockException methodNotAllowed(String method, String path, Collection<String> allowed) {
        return new MockException(405, method + " is not allowed on " + path,
                Map.of("Allow", String.join(", ", allowed)));
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }
}
