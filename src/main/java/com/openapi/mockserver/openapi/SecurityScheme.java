package com.openapi.mockserver.openapi;

/**
 * A named security scheme declared by an OpenAPI document.
 *
 * @param id        the key under which the scheme is declared, referenced by security requirements
 * @param type      the scheme type
 * @param paramName for {@code apiKey}: the header, query parameter or cookie name
 * @param in        for {@code apiKey}: {@code header}, {@code query} or {@code cookie}
 * @param scheme    for {@code http}: the HTTP authorization scheme, e.g. {@code basic} or {@code bearer}
 */
public record SecurityScheme(
        String id,
        SecuritySchemeType type,
        String paramName,
        String in,
        String scheme
) {

    public SecurityScheme {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Security scheme id must not be null or blank");
        }
        if (type == null) {
            type = SecuritySchemeType.UNKNOWN;
        }
    }

    public static SecurityScheme basic(String id) {
        return new SecurityScheme(id, SecuritySchemeType.BASIC, null, null, "basic");
    }

    public static SecurityScheme http(String id, String scheme) {
        return new SecurityScheme(id, SecuritySchemeType.HTTP, null, null, scheme);
    }

    public static SecurityScheme apiKey(String id, String paramName, String in) {
        return new SecurityScheme(id, SecuritySchemeType.API_KEY, paramName, in, null);
    }

    public static SecurityScheme oauth2(String id) {
        return new SecurityScheme(id, SecuritySchemeType.OAUTH2, null, null, null);
    }

    /**
     * Type name as shown in authentication error messages, e.g. {@code apiKey}.
     */
    public String typeName() {
        return type.value();
    }
}
