package com.openapi.mockserver.rest.security;

import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.metrics.NoOpMetricsService;
import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.rest.OpenApiRequestFilter;
import com.openapi.mockserver.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jakarta RS filter that enforces the OpenAPI security requirements of the matched operation.
 *
 * <p>If the operation requires security and the request carries credentials for none of
 * its requirements, the request is aborted with {@code 401 Unauthorized} and a
 * {@code WWW-Authenticate: Basic realm="..."} challenge. Credentials are never validated;
 * see {@link SecurityRequirementChecker}.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class SecurityRequirementFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SecurityRequirementFilter.class);

    private final SecurityConfig securityConfig;
    private final SecurityRequirementChecker checker;
    private final MetricsService metrics;

    public SecurityRequirementFilter(SecurityConfig securityConfig) {
        this(securityConfig, new SecurityRequirementChecker(), new NoOpMetricsService());
    }

    public SecurityRequirementFilter(SecurityConfig securityConfig, SecurityRequirementChecker checker,
                                     MetricsService metrics) {
        this.securityConfig = securityConfig;
        this.checker = checker;
        this.metrics = metrics;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        // Allow CORS preflight through without credentials
        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }

        OpenApiRequest request = OpenApiRequestFilter.from(requestContext);
        if (request == null) {
            return;
        }

        SecurityCheckResult result = checker.check(request, new RequestContextCredentials(requestContext));
        if (result.satisfied()) {
            return;
        }

        String types = result.describeTypes();
        log.warn("auth.rejected reason=missing_credentials types={} method={} path={}",
                types, request.getMethod(), request.getRequestPath());
        metrics.incrementSecurityRejected(types);

        String message = request.getMethod() + " " + request.getRequestPath()
                + " requires authentication (" + types + ")";
        requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + realm(requestContext) + "\"")
                .entity(ErrorResponse.unauthorized(message, request.getRequestPath()))
                .build());
    }

    private String realm(ContainerRequestContext requestContext) {
        if (securityConfig.getRealm() != null) {
            return securityConfig.getRealm();
        }
        UriInfo uriInfo = requestContext.getUriInfo();
        if (uriInfo != null && uriInfo.getRequestUri() != null && uriInfo.getRequestUri().getHost() != null) {
            return uriInfo.getRequestUri().getHost();
        }
        String host = requestContext.getHeaderString(HttpHeaders.HOST);
        if (host != null && !host.isBlank()) {
            int colon = host.lastIndexOf(':');
            return (colon > 0 && !host.endsWith("]") ? host.substring(0, colon) : host).replace("\"", "");
        }
        return "server";
    }
}
