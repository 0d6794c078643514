package com.openapi.mockserver.openapi;

/**
 * Security scheme types from Swagger 2.0 {@code securityDefinitions}
 * and OpenAPI 3 {@code components.securitySchemes}.
 */
public enum SecuritySchemeType {

    /** Swagger 2.0 HTTP Basic authentication. */
    BASIC("basic"),

    /** OpenAPI 3 HTTP authentication; the concrete scheme is in {@link SecurityScheme#scheme()}. */
    HTTP("http"),

    API_KEY("apiKey"),

    OAUTH2("oauth2"),

    OPEN_ID_CONNECT("openIdConnect"),

    MUTUAL_TLS("mutualTLS"),

    /** A type this server does not know, or a scheme name that is not defined. */
    UNKNOWN("unknown");

    private final String value;

    SecuritySchemeType(String value) {
        this.value = value;
    }

    /**
     * Returns the name used for this type in OpenAPI documents.
     */
    public String value() {
        return value;
    }

    /**
     * Parses a document type name, case-insensitively. Unrecognized names map to {@link #UNKNOWN}.
     */
    public static SecuritySchemeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (SecuritySchemeType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
