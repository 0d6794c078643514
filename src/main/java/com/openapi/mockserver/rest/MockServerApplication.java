package com.openapi.mockserver.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;

/**
 * Jakarta RS Application class. The mock server answers every path from the root;
 * the OpenAPI document's base path is part of the request path.
 */
@ApplicationPath("/")
public class MockServerApplication extends Application {
}
