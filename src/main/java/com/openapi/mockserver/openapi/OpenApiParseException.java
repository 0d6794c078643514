package com.openapi.mockserver.openapi;

/**
 * Runtime exception thrown when an OpenAPI document cannot be read or is not a
 * Swagger 2.0 / OpenAPI 3.x document.
 */
public class OpenApiParseException extends RuntimeException {

    public OpenApiParseException(String message) {
        super(message);
    }

    public OpenApiParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
