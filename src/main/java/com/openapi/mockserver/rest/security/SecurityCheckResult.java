package com.openapi.mockserver.rest.security;

import java.util.List;

/**
 * Outcome of a security-requirement check.
 *
 * @param satisfied   true if at least one security requirement is met
 * @param schemeTypes distinct scheme type names seen while checking, in encounter order
 */
public record SecurityCheckResult(boolean satisfied, List<String> schemeTypes) {

    public SecurityCheckResult {
        schemeTypes = schemeTypes == null ? List.of() : List.copyOf(schemeTypes);
    }

    /**
     * Result for requests that carry no security requirements.
     */
    public static SecurityCheckResult notRequired() {
        return new SecurityCheckResult(true, List.of());
    }

    public String describeTypes() {
        return String.join(", ", schemeTypes);
    }
}
