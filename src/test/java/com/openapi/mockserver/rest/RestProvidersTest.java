package com.openapi.mockserver.rest;

import com.openapi.mockserver.handler.MockException;
import com.openapi.mockserver.openapi.ApiOperation;
import com.openapi.mockserver.openapi.OpenApiDocument;
import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.openapi.OperationResolver;
import com.openapi.mockserver.openapi.SecurityRequirement;
import com.openapi.mockserver.openapi.SecurityScheme;
import com.openapi.mockserver.rest.dto.ErrorResponse;
import com.openapi.mockserver.rest.security.SecurityConfig;
import com.openapi.mockserver.rest.security.SecurityRequirementFilter;
import com.openapi.mockserver.store.DataStoreException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Jakarta RS providers: the OpenAPI request filter and the exception mappers.
 */
@DisplayName("REST Providers")
class RestProvidersTest {

    private static UriInfo uri(String path) {
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn(path);
        return uriInfo;
    }

    @Nested
    @DisplayName("OpenApiRequestFilter")
    class OpenApiRequestFilterTest {

        private final OpenApiRequestFilter filter = new OpenApiRequestFilter(new OperationResolver(
                OpenApiDocument.builder()
                        .basePath("/api")
                        .operation(ApiOperation.builder().method("GET").pathTemplate("/pets/{petId}").build())
                        .build()));

        @Test
        @DisplayName("stores the resolved request as a context property")
        void storesResolvedRequest() {
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);
            when(ctx.getMethod()).thenReturn("GET");
            UriInfo uriInfo = uri("api/pets/fido");
            when(ctx.getUriInfo()).thenReturn(uriInfo);

            filter.filter(ctx);

            verify(ctx).setProperty(eq(OpenApiRequestFilter.OPENAPI_REQUEST_PROPERTY), argThat(value ->
                    value instanceof OpenApiRequest request
                            && request.getPathParams().get("petId").equals("fido")
                            && request.getRequestPath().equals("/api/pets/fido")));
        }

        @Test
        @DisplayName("HEAD is resolved and secured as the path's GET operation")
        void headUsesGetOperation() {
            OperationResolver resolver = new OperationResolver(OpenApiDocument.builder()
                    .security(List.of(SecurityRequirement.of("basic")))
                    .securityScheme(SecurityScheme.basic("basic"))
                    .operation(ApiOperation.builder().method("GET").pathTemplate("/pets").build())
                    .build());
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);
            when(ctx.getMethod()).thenReturn("HEAD");
            UriInfo uriInfo = uri("pets");
            when(ctx.getUriInfo()).thenReturn(uriInfo);
            Map<String, Object> properties = new HashMap<>();
            doAnswer(invocation -> properties.put(invocation.getArgument(0), invocation.getArgument(1)))
                    .when(ctx).setProperty(anyString(), any());
            when(ctx.getProperty(anyString())).thenAnswer(invocation -> properties.get(invocation.getArgument(0)));

            new OpenApiRequestFilter(resolver).filter(ctx);
            new SecurityRequirementFilter(SecurityConfig.defaults()).filter(ctx);

            OpenApiRequest request = OpenApiRequestFilter.from(ctx);
            assertNotNull(request);
            assertEquals("GET", request.getOperation().getMethod());
            verify(ctx).abortWith(argThat(response -> response.getStatus() == 401));
        }

        @Test
        @DisplayName("HEAD keeps its own operation when the document declares one")
        void headWithOwnOperation() {
            OpenApiRequestFilter headFilter = new OpenApiRequestFilter(new OperationResolver(OpenApiDocument.builder()
                    .operation(ApiOperation.builder().method("GET").pathTemplate("/pets").build())
                    .operation(ApiOperation.builder().method("HEAD").pathTemplate("/pets").build())
                    .build()));

            OpenApiRequest request = headFilter.resolve("HEAD", "/pets").orElseThrow();

            assertEquals("HEAD", request.getOperation().getMethod());
        }

        @Test
        @DisplayName("leaves unknown paths unresolved")
        void unknownPath() {
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);
            when(ctx.getMethod()).thenReturn("GET");
            UriInfo uriInfo = uri("api/owners");
            when(ctx.getUriInfo()).thenReturn(uriInfo);

            filter.filter(ctx);

            verify(ctx, never()).setProperty(anyString(), any());
        }

        @Test
        @DisplayName("from() ignores foreign property values")
        void fromIgnoresOtherTypes() {
            ContainerRequestContext ctx = mock(ContainerRequestContext.class);
            when(ctx.getProperty(OpenApiRequestFilter.OPENAPI_REQUEST_PROPERTY)).thenReturn("not a request");

            assertNull(OpenApiRequestFilter.from(ctx));
        }

        @Test
        @DisplayName("requestPath always starts with a slash")
        void requestPath() {
            assertEquals("/", OpenApiRequestFilter.requestPath(null));
            assertEquals("/", OpenApiRequestFilter.requestPath(uri("")));
            assertEquals("/pets", OpenApiRequestFilter.requestPath(uri("pets")));
            assertEquals("/pets", OpenApiRequestFilter.requestPath(uri("/pets")));
        }
    }

    @Nested
    @DisplayName("Exception mappers")
    class ExceptionMappers {

        @Test
        @DisplayName("MockException keeps its status, message and headers")
        void mockException() {
            MockExceptionMapper mapper = new MockExceptionMapper(uri("pets"));

            Response response = mapper.toResponse(MockException.methodNotAllowed("PATCH", "/pets", List.of("GET", "POST")));

            assertEquals(405, response.getStatus());
            assertEquals("GET, POST", response.getHeaders().getFirst("Allow"));
            ErrorResponse error = (ErrorResponse) response.getEntity();
            assertEquals("Method Not Allowed", error.error());
            assertEquals("PATCH is not allowed on /pets", error.message());
            assertEquals("/pets", error.path());
        }

        @Test
        @DisplayName("not found errors use the standard reason phrase")
        void notFound() {
            Response response = new MockExceptionMapper(uri("pets/ghost"))
                    .toResponse(MockException.notFound("/pets/ghost"));

            assertEquals(404, response.getStatus());
            assertEquals("Not Found", ((ErrorResponse) response.getEntity()).error());
            assertEquals("Not Found: /pets/ghost", ((ErrorResponse) response.getEntity()).message());
        }

        @Test
        @DisplayName("data store failures become a generic 500")
        void dataStoreException() {
            DataStoreExceptionMapper mapper = new DataStoreExceptionMapper(uri("pets"));

            Response response = mapper.toResponse(new DataStoreException("disk full"));

            assertEquals(500, response.getStatus());
            ErrorResponse error = (ErrorResponse) response.getEntity();
            assertEquals("Internal Server Error", error.error());
            assertFalse(error.message().contains("disk full"));
        }
    }
}
