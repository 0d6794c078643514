package com.openapi.mockserver.rest;

import com.openapi.mockserver.rest.dto.ErrorResponse;
import com.openapi.mockserver.store.DataStoreException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps data store failures to {@code 500 Internal Server Error}.
 */
@Provider
public class DataStoreExceptionMapper implements ExceptionMapper<DataStoreException> {
    private static final Logger log = LoggerFactory.getLogger(DataStoreExceptionMapper.class);

    @Context
    private UriInfo uriInfo;

    public DataStoreExceptionMapper() {
    }

    DataStoreExceptionMapper(UriInfo uriInfo) {
        this.uriInfo = uriInfo;
    }

    @Override
    public Response toResponse(DataStoreException exception) {
        String path = OpenApiRequestFilter.requestPath(uriInfo);
        log.error("store.failed path={} error={}", path, exception.getMessage(), exception);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                .build();
    }
}
