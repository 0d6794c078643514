package com.openapi.mockserver.rest.security;

import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.rest.OpenApiRequestFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Jakarta RS filter that handles CORS headers.
 *
 * <p>Implements both {@link ContainerRequestFilter} (answers preflight {@code OPTIONS}
 * requests with {@code 200}) and {@link ContainerResponseFilter} (decorates every
 * response). The request's {@code Origin} is echoed back with credentials allowed;
 * allowed methods come from the OpenAPI path when it is known.</p>
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String ORIGIN = "Origin";
    static final String REQUEST_HEADERS = "Access-Control-Request-Headers";
    static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
    static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
    static final String MAX_AGE = "Access-Control-Max-Age";

    private final CorsConfig corsConfig;

    public CorsFilter(CorsConfig corsConfig) {
        this.corsConfig = corsConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!corsConfig.enabled()) {
            return;
        }

        // Handle CORS preflight
        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            Response.ResponseBuilder builder = Response.ok();
            corsHeaders(requestContext).forEach(builder::header);
            requestContext.abortWith(builder.build());
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!corsConfig.enabled()) {
            return;
        }

        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        corsHeaders(requestContext).forEach((name, value) -> {
            if (!headers.containsKey(name)) {
                headers.putSingle(name, value);
            }
        });
    }

    private Map<String, String> corsHeaders(ContainerRequestContext requestContext) {
        Map<String, String> headers = new LinkedHashMap<>();

        String origin = requestContext.getHeaderString(ORIGIN);
        if (origin != null && !origin.isBlank() && corsConfig.isOriginAllowed(origin)) {
            headers.put(ALLOW_ORIGIN, origin);
            headers.put(ALLOW_CREDENTIALS, "true");
        } else if (corsConfig.allowsAnyOrigin()) {
            headers.put(ALLOW_ORIGIN, "*");
        }

        headers.put(ALLOW_METHODS, allowedMethods(requestContext));

        String requestedHeaders = requestContext.getHeaderString(REQUEST_HEADERS);
        headers.put(ALLOW_HEADERS, requestedHeaders != null && !requestedHeaders.isBlank()
                ? requestedHeaders
                : corsConfig.allowedHeaders());

        headers.put(MAX_AGE, String.valueOf(corsConfig.maxAge()));
        return headers;
    }

    private String allowedMethods(ContainerRequestContext requestContext) {
        OpenApiRequest request = OpenApiRequestFilter.from(requestContext);
        if (request == null || request.getAllowedMethods().isEmpty()) {
            return corsConfig.allowedMethods();
        }
        Set<String> methods = new LinkedHashSet<>(request.getAllowedMethods());
        methods.add("OPTIONS");
        return String.join(", ", methods);
    }
}
