package com.openapi.mockserver.openapi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of an OpenAPI {@code security} list: scheme names mapped to required scopes.
 * All schemes of a requirement must be satisfied together; an empty requirement allows
 * anonymous access.
 *
 * @param schemes scheme id to scopes, in document order
 */
public record SecurityRequirement(Map<String, List<String>> schemes) {

    public SecurityRequirement {
        schemes = schemes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(schemes));
    }

    public static SecurityRequirement of(String... schemeIds) {
        Map<String, List<String>> schemes = new LinkedHashMap<>();
        for (String id : schemeIds) {
            schemes.put(id, List.of());
        }
        return new SecurityRequirement(schemes);
    }

    public boolean isAnonymous() {
        return schemes.isEmpty();
    }
}
