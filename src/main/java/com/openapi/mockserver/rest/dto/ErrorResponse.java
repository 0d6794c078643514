package com.openapi.mockserver.rest.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public static ErrorResponse unauthorized(String message, String path) {
        return new ErrorResponse(401, "Unauthorized", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse methodNotAllowed(String message, String path) {
        return new ErrorResponse(405, "Method Not Allowed", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    /**
     * Builds an error response for an arbitrary status, using its standard reason phrase.
     */
    public static ErrorResponse of(int status, String reason, String message, String path) {
        return new ErrorResponse(status, reason, message, path);
    }
}
