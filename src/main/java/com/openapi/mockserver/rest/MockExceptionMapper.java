package com.openapi.mockserver.rest;

import com.openapi.mockserver.handler.MockException;
import com.openapi.mockserver.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link MockException} as an {@link ErrorResponse} with the exception's status and headers.
 */
@Provider
public class MockExceptionMapper implements ExceptionMapper<MockException> {
    private static final Logger log = LoggerFactory.getLogger(MockExceptionMapper.class);

    @Context
    private UriInfo uriInfo;

    public MockExceptionMapper() {
    }

    MockExceptionMapper(UriInfo uriInfo) {
        this.uriInfo = uriInfo;
    }

    @Override
    public Response toResponse(MockException exception) {
        String path = OpenApiRequestFilter.requestPath(uriInfo);
        log.debug("mock.error status={} path={} message={}", exception.getStatus(), path, exception.getMessage());

        Response.Status status = Response.Status.fromStatusCode(exception.getStatus());
        String reason = status != null ? status.getReasonPhrase() : "Error";

        Response.ResponseBuilder builder = Response.status(exception.getStatus())
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(ErrorResponse.of(exception.getStatus(), reason, exception.getMessage(), path));
        exception.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
