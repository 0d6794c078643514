package com.openapi.mockserver.rest.security;

import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.openapi.SecurityRequirement;
import com.openapi.mockserver.openapi.SecurityScheme;
import com.openapi.mockserver.openapi.SecuritySchemeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks whether a request carries the credentials its OpenAPI operation asks for.
 *
 * <p>Security requirements are alternatives: the request passes if <em>any</em> of them
 * is met. The schemes within one requirement must <em>all</em> be met. Only the
 * presence of credentials is checked; nothing is authenticated.</p>
 *
 * <ul>
 *   <li>{@code basic} / {@code http basic}: {@code Authorization: Basic ...}</li>
 *   <li>{@code http bearer} (or any other http scheme): {@code Authorization: <scheme> ...}</li>
 *   <li>{@code apiKey}: the named header, query parameter or cookie is present</li>
 *   <li>{@code oauth2}, {@code openIdConnect}, {@code mutualTLS}: assumed present</li>
 * </ul>
 */
public class SecurityRequirementChecker {
    private static final Logger log = LoggerFactory.getLogger(SecurityRequirementChecker.class);

    static final String AUTHORIZATION = "Authorization";

    public SecurityCheckResult check(OpenApiRequest request, CredentialSource credentials) {
        if (request == null || !request.hasOperation()) {
            return SecurityCheckResult.notRequired();
        }

        List<SecurityRequirement> requirements = request.effectiveSecurity();
        if (requirements.isEmpty()) {
            return SecurityCheckResult.notRequired();
        }

        log.debug("security.validating operation={} requirements={}", request.getOperation(), requirements.size());

        // A requirement stops at its first unmet scheme; the check stops at the first met requirement
        Set<String> schemeTypes = new LinkedHashSet<>();
        for (SecurityRequirement requirement : requirements) {
            if (isMet(request, requirement, credentials, schemeTypes)) {
                return new SecurityCheckResult(true, new ArrayList<>(schemeTypes));
            }
        }

        return new SecurityCheckResult(false, new ArrayList<>(schemeTypes));
    }

    private boolean isMet(OpenApiRequest request, SecurityRequirement requirement,
                          CredentialSource credentials, Set<String> schemeTypes) {
        for (String schemeId : requirement.schemes().keySet()) {
            Optional<SecurityScheme> scheme = request.getDocument().findSecurityScheme(schemeId);
            if (scheme.isEmpty()) {
                log.warn("security.undefinedScheme scheme={} operation={}", schemeId, request.getOperation());
                schemeTypes.add(SecuritySchemeType.UNKNOWN.value());
                return false;
            }
            schemeTypes.add(scheme.get().typeName());
            if (!isPresent(scheme.get(), credentials)) {
                return false;
            }
        }
        return true;
    }

    boolean isPresent(SecurityScheme scheme, CredentialSource credentials) {
        return switch (scheme.type()) {
            case BASIC -> hasAuthorizationScheme(credentials, "Basic");
            case HTTP -> hasAuthorizationScheme(credentials,
                    scheme.scheme() == null || scheme.scheme().isBlank() ? "Basic" : scheme.scheme());
            case API_KEY -> isApiKeyPresent(scheme, credentials);
            case OAUTH2, OPEN_ID_CONNECT, MUTUAL_TLS -> true;
            case UNKNOWN -> false;
        };
    }

    private static boolean isApiKeyPresent(SecurityScheme scheme, CredentialSource credentials) {
        String in = scheme.in() == null ? "" : scheme.in().toLowerCase(Locale.ROOT);
        return switch (in) {
            case "header" -> credentials.header(scheme.paramName()) != null;
            case "query" -> credentials.hasQueryParam(scheme.paramName());
            case "cookie" -> credentials.hasCookie(scheme.paramName());
            default -> {
                log.warn("security.unsupportedApiKeyLocation scheme={} in={}", scheme.id(), scheme.in());
                yield false;
            }
        };
    }

    private static boolean hasAuthorizationScheme(CredentialSource credentials, String authScheme) {
        String authorization = credentials.header(AUTHORIZATION);
        if (authorization == null) {
            return false;
        }
        String prefix = authScheme + " ";
        return authorization.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
