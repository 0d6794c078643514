package com.openapi.mockserver.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openapi.mockserver.handler.MockException;
import com.openapi.mockserver.handler.MockHandler;
import com.openapi.mockserver.handler.MockRequest;
import com.openapi.mockserver.handler.MockResponse;
import com.openapi.mockserver.logging.LogContext;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.openapi.OperationResolver;
import com.openapi.mockserver.rest.dto.ErrorResponse;
import com.openapi.mockserver.store.DataStoreException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Locale;

/**
 * Catch-all REST resource that answers every path of the OpenAPI document from the data store.
 *
 * <p>Paths the document does not define respond {@code 404}; methods a defined path does not
 * declare respond {@code 405}. Request bodies are read as JSON, as form fields, or as plain
 * text, in that order of preference.</p>
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
public class MockResource {
    private static final Logger log = LoggerFactory.getLogger(MockResource.class);

    private final OperationResolver resolver;
    private final MockHandler handler;
    private final MetricsService metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Inject
    public MockResource(OperationResolver resolver, MockHandler handler, MetricsService metrics) {
        this.resolver = resolver;
        this.handler = handler;
        this.metrics = metrics;
    }

    @GET
    @Path("{path: .*}")
    public Response get(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return handle("GET", uriInfo, headers, null);
    }

    @POST
    @Path("{path: .*}")
    public Response post(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
        return handle("POST", uriInfo, headers, body);
    }

    @PUT
    @Path("{path: .*}")
    public Response put(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
        return handle("PUT", uriInfo, headers, body);
    }

    @PATCH
    @Path("{path: .*}")
    public Response patch(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
        return handle("PATCH", uriInfo, headers, body);
    }

    @DELETE
    @Path("{path: .*}")
    public Response delete(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
        return handle("DELETE", uriInfo, headers, null);
    }

    Response handle(String method, UriInfo uriInfo, HttpHeaders headers, String body) {
        String path = OpenApiRequestFilter.requestPath(uriInfo);
        long start = System.nanoTime();
        int status = Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();

        try (LogContext ctx = LogContext.forRequest(LogContext.generateCorrelationId(), method, path)) {
            OpenApiRequest openApiRequest = resolver.resolve(method, path)
                    .orElseThrow(() -> {
                        log.debug("mock.unknownPath method={} path={}", method, path);
                        return MockException.notFound(path);
                    });
            if (openApiRequest.hasOperation() && openApiRequest.getOperation().getOperationId() != null) {
                ctx.with("operationId", openApiRequest.getOperation().getOperationId());
            }

            MockRequest request = new MockRequest(method, path,
                    parseBody(body, headers != null ? headers.getMediaType() : null));
            MockResponse response = handler.handle(openApiRequest, request);
            status = response.getStatus();
            return toResponse(response);
        } catch (MockException e) {
            status = e.getStatus();
            throw e;
        } catch (RuntimeException e) {
            if (e instanceof DataStoreException) {
                throw e;
            }
            log.error("Mock request failed: method={} path={}", method, path, e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        } finally {
            metrics.recordRequest(method, status, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    JsonNode parseBody(String body, MediaType mediaType) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }

        if (mediaType == null || isJson(mediaType)) {
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                if (mediaType != null) {
                    throw new MockException(400, "Invalid JSON request body: " + e.getOriginalMessage());
                }
                return TextNode.valueOf(body);
            }
        }

        if (mediaType.isCompatible(MediaType.APPLICATION_FORM_URLENCODED_TYPE)) {
            return parseForm(body);
        }

        return TextNode.valueOf(body);
    }

    private static boolean isJson(MediaType mediaType) {
        return mediaType.isCompatible(MediaType.APPLICATION_JSON_TYPE)
                || mediaType.getSubtype().toLowerCase(Locale.ROOT).endsWith("+json");
    }

    private static ObjectNode parseForm(String body) {
        ObjectNode form = JsonNodeFactory.instance.objectNode();
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);

            JsonNode existing = form.get(name);
            if (existing == null) {
                form.put(name, value);
            } else if (existing.isArray()) {
                ((ArrayNode) existing).add(value);
            } else {
                ArrayNode values = form.arrayNode();
                values.add(existing);
                values.add(value);
                form.set(name, values);
            }
        }
        return form;
    }

    private static Response toResponse(MockResponse mockResponse) {
        Response.ResponseBuilder builder = Response.status(mockResponse.getStatus());
        if (mockResponse.hasBody()) {
            builder.entity(mockResponse.getBody()).type(MediaType.APPLICATION_JSON_TYPE);
        }
        if (mockResponse.getLastModified() != null) {
            builder.lastModified(Date.from(mockResponse.getLastModified()));
        }
        mockResponse.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
