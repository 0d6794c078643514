package com.openapi.mockserver.handler;

/**
 * One mock behaviour, e.g. "merge the request body into the resource at the URL".
 */
@FunctionalInterface
public interface MockOperation {

    /**
     * Performs the operation and shapes the response.
     *
     * @throws MockException if the request cannot be fulfilled, e.g. the resource does not exist
     */
    void handle(MockRequest request, MockResponse response);
}
