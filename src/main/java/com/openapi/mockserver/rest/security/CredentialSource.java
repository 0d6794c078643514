package com.openapi.mockserver.rest.security;

/**
 * Read-only view of the places a request can carry credentials.
 */
public interface CredentialSource {

    /**
     * @return the first value of the header (case-insensitive name), or null
     */
    String header(String name);

    /**
     * @return true if the query string contains the parameter, even with an empty value
     */
    boolean hasQueryParam(String name);

    /**
     * @return true if the request carries the cookie
     */
    boolean hasCookie(String name);
}
