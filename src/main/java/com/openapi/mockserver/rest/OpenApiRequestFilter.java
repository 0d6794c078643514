package com.openapi.mockserver.rest;

import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.openapi.OperationResolver;
import jakarta.annotation.Priority;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Jakarta RS filter that resolves each request against the OpenAPI document.
 *
 * <p>Runs before authentication. When the request path matches a path template, the
 * resulting {@link OpenApiRequest} is stored under {@link #OPENAPI_REQUEST_PROPERTY}
 * for the filters and resources that follow.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class OpenApiRequestFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(OpenApiRequestFilter.class);

    /** Context property key for the resolved {@link OpenApiRequest}. */
    public static final String OPENAPI_REQUEST_PROPERTY = "openapi-mock.request";

    private final OperationResolver resolver;

    public OpenApiRequestFilter(OperationResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String method = requestContext.getMethod();
        String path = requestPath(requestContext.getUriInfo());
        resolve(method, path).ifPresentOrElse(
                request -> {
                    requestContext.setProperty(OPENAPI_REQUEST_PROPERTY, request);
                    log.debug("openapi.resolved method={} path={} template={} operation={}",
                            request.getMethod(), path, request.getPathTemplate(), request.hasOperation());
                },
                () -> log.debug("openapi.unresolved method={} path={}", method, path));
    }

    /**
     * Resolves the request, treating {@code HEAD} as {@code GET} when the document declares
     * no {@code HEAD} operation. Jakarta RS answers such requests with the {@code GET} resource method.
     */
    Optional<OpenApiRequest> resolve(String method, String path) {
        Optional<OpenApiRequest> resolved = resolver.resolve(method, path);
        if (HttpMethod.HEAD.equalsIgnoreCase(method) && resolved.isPresent() && !resolved.get().hasOperation()) {
            return resolver.resolve(HttpMethod.GET, path);
        }
        return resolved;
    }

    /**
     * Returns the resolved request stored by this filter, or null if the path is not in the document.
     */
    public static OpenApiRequest from(ContainerRequestContext requestContext) {
        Object property = requestContext.getProperty(OPENAPI_REQUEST_PROPERTY);
        return property instanceof OpenApiRequest request ? request : null;
    }

    /**
     * The request path with a leading slash, relative to the application root.
     */
    public static String requestPath(UriInfo uriInfo) {
        String path = uriInfo == null ? null : uriInfo.getPath();
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
