package com.openapi.mockserver.rest.security;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.UriInfo;

import java.util.Map;

/**
 * {@link CredentialSource} backed by a Jakarta RS {@link ContainerRequestContext}.
 */
public class RequestContextCredentials implements CredentialSource {

    private final ContainerRequestContext requestContext;

    public RequestContextCredentials(ContainerRequestContext requestContext) {
        this.requestContext = requestContext;
    }

    @Override
    public String header(String name) {
        return name == null ? null : requestContext.getHeaderString(name);
    }

    @Override
    public boolean hasQueryParam(String name) {
        if (name == null) {
            return false;
        }
        UriInfo uriInfo = requestContext.getUriInfo();
        if (uriInfo == null) {
            return false;
        }
        MultivaluedMap<String, String> params = uriInfo.getQueryParameters();
        return params != null && params.containsKey(name);
    }

    @Override
    public boolean hasCookie(String name) {
        if (name == null) {
            return false;
        }
        Map<String, Cookie> cookies = requestContext.getCookies();
        return cookies != null && cookies.containsKey(name);
    }
}
