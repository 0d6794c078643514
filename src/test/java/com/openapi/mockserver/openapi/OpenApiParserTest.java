package com.openapi.mockserver.openapi;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenApiParser Tests")
class OpenApiParserTest {

    private OpenApiParser parser;

    @BeforeEach
    void setUp() {
        parser = new OpenApiParser();
    }

    @Nested
    @DisplayName("OpenAPI 3 (YAML)")
    class OpenApi3 {

        private OpenApiDocument document;

        @BeforeEach
        void load() throws Exception {
            document = parser.parse(Path.of(getClass().getResource("/petstore.yaml").toURI()));
        }

        @Test
        @DisplayName("reads title, base path and operations")
        void readsDocument() {
            assertEquals("Swagger Petstore", document.getTitle());
            assertEquals("/api/v1", document.getBasePath());
            assertEquals(List.of("/pets", "/pets/mine", "/pets/{petId}"), List.copyOf(document.getPaths().keySet()));
            assertEquals(8, document.operationCount());
            assertEquals(Set.of("GET", "PUT", "PATCH", "DELETE"),
                    document.getOperations("/pets/{petId}").keySet());
        }

        @Test
        @DisplayName("array schemas mark collection responses")
        void collectionResponses() {
            ApiOperation listPets = document.getOperations("/pets").get("GET");
            assertEquals("listPets", listPets.getOperationId());
            assertTrue(listPets.isCollectionResponse());
            assertFalse(listPets.isEmptyResponse());

            ApiOperation getPet = document.getOperations("/pets/{petId}").get("GET");
            assertFalse(getPet.isCollectionResponse());
        }

        @Test
        @DisplayName("response and schema $refs are followed")
        void followsRefs() {
            ApiOperation myPets = document.getOperations("/pets/mine").get("GET");

            assertTrue(myPets.isCollectionResponse());
            assertEquals(200, myPets.getSuccessStatus());
        }

        @Test
        @DisplayName("lowest 2xx response sets the status; no content means an empty response")
        void successStatus() {
            ApiOperation createPet = document.getOperations("/pets").get("POST");
            assertEquals(201, createPet.getSuccessStatus());
            assertFalse(createPet.isEmptyResponse());

            ApiOperation deletePets = document.getOperations("/pets").get("DELETE");
            assertEquals(204, deletePets.getSuccessStatus());
            assertTrue(deletePets.isEmptyResponse());
        }

        @Test
        @DisplayName("operation security overrides, disables or inherits global security")
        void security() {
            assertEquals(List.of(SecurityRequirement.of("api_key")), document.getSecurity());

            assertEquals(List.of(), document.getOperations("/pets").get("GET").getSecurity());
            assertNull(document.getOperations("/pets").get("POST").getSecurity());

            List<SecurityRequirement> mine = document.getOperations("/pets/mine").get("GET").getSecurity();
            assertEquals(2, mine.size());
            assertEquals(List.of("read:pets"), mine.get(1).schemes().get("petstore_auth"));

            List<SecurityRequirement> replace = document.getOperations("/pets/{petId}").get("PUT").getSecurity();
            assertEquals(1, replace.size());
            assertEquals(List.of("api_key", "bearer_auth"), List.copyOf(replace.get(0).schemes().keySet()));
        }

        @Test
        @DisplayName("security schemes come from components")
        void securitySchemes() {
            SecurityScheme apiKey = document.findSecurityScheme("api_key").orElseThrow();
            assertEquals(SecuritySchemeType.API_KEY, apiKey.type());
            assertEquals("X-API-Key", apiKey.paramName());
            assertEquals("header", apiKey.in());

            SecurityScheme basic = document.findSecurityScheme("basic_auth").orElseThrow();
            assertEquals(SecuritySchemeType.HTTP, basic.type());
            assertEquals("basic", basic.scheme());

            assertEquals(SecuritySchemeType.OAUTH2, document.findSecurityScheme("petstore_auth").orElseThrow().type());
            assertTrue(document.findSecurityScheme("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Swagger 2 (JSON)")
    class Swagger2 {

        private OpenApiDocument document;

        @BeforeEach
        void load() throws Exception {
            try (InputStream in = getClass().getResourceAsStream("/petstore-swagger.json")) {
                document = parser.parse(in);
            }
        }

        @Test
        @DisplayName("reads basePath and operations")
        void readsDocument() {
            assertEquals("/v2", document.getBasePath());
            assertEquals(4, document.operationCount());
            assertTrue(document.getSecurity().isEmpty());
        }

        @Test
        @DisplayName("response schema decides collection and empty responses")
        void responses() {
            assertTrue(document.getOperations("/pets").get("GET").isCollectionResponse());
            assertEquals(201, document.getOperations("/pets").get("POST").getSuccessStatus());
            assertTrue(document.getOperations("/pets/{petId}").get("DELETE").isEmptyResponse());
        }

        @Test
        @DisplayName("a default response counts as 200")
        void defaultResponse() {
            ApiOperation getPet = document.getOperations("/pets/{petId}").get("GET");

            assertEquals(200, getPet.getSuccessStatus());
            assertFalse(getPet.isEmptyResponse());
        }

        @Test
        @DisplayName("security definitions are read; basic becomes http basic")
        void securityDefinitions() {
            SecurityScheme basic = document.findSecurityScheme("basic").orElseThrow();
            assertEquals(SecuritySchemeType.HTTP, basic.type());
            assertEquals("basic", basic.scheme());

            SecurityScheme key = document.findSecurityScheme("key").orElseThrow();
            assertEquals(SecuritySchemeType.API_KEY, key.type());
            assertEquals("api_key", key.paramName());
            assertEquals("query", key.in());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("server URLs may be relative or templated")
        void serverUrls() {
            OpenApiDocument relative = parser.parse("""
                    openapi: 3.0.0
                    servers:
                      - url: /api/
                    paths: {}
                    """);
            assertEquals("/api", relative.getBasePath());

            OpenApiDocument templated = parser.parse("""
                    openapi: 3.0.0
                    servers:
                      - url: https://{host}/v1
                    paths: {}
                    """);
            assertEquals("", templated.getBasePath());
        }

        @Test
        @DisplayName("operations without responses are empty 200 responses")
        void noResponses() {
            OpenApiDocument document = parser.parse("""
                    openapi: 3.0.0
                    paths:
                      /ping:
                        get: {}
                    """);

            ApiOperation ping = document.getOperations("/ping").get("GET");
            assertEquals(200, ping.getSuccessStatus());
            assertTrue(ping.isEmptyResponse());
        }

        @Test
        @DisplayName("non-method keys of a path item are ignored")
        void ignoresNonMethodKeys() {
            OpenApiDocument document = parser.parse("""
                    swagger: '2.0'
                    info:
                      title: Pets
                      version: '1'
                    paths:
                      /pets:
                        parameters: []
                        x-extension: true
                        get:
                          responses:
                            '200':
                              description: ok
                    """);

            assertEquals(1, document.operationCount());
        }

        @Test
        @DisplayName("path templates that do not start with a slash are skipped")
        void skipsInvalidPaths() {
            OpenApiDocument document = parser.parse("""
                    openapi: 3.0.0
                    paths:
                      pets:
                        get: {}
                      /owners:
                        get: {}
                    """);

            assertEquals(List.of("/owners"), List.copyOf(document.getPaths().keySet()));
        }

        @Test
        @DisplayName("documents without a version field are rejected")
        void missingVersion() {
            assertThrows(OpenApiParseException.class, () -> parser.parse("paths: {}"));
        }

        @Test
        @DisplayName("non-object documents are rejected")
        void notAnObject() {
            assertThrows(OpenApiParseException.class, () -> parser.parse("- a\n- b\n"));
        }

        @Test
        @DisplayName("references into other files are resolved")
        void externalRef(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("schemas.yaml"), """
                    PetList:
                      type: array
                      items:
                        type: object
                    """);
            Path main = Files.writeString(dir.resolve("main.yaml"), """
                    openapi: 3.0.0
                    info:
                      title: Pets
                      version: '1'
                    paths:
                      /pets:
                        get:
                          responses:
                            '200':
                              description: ok
                              content:
                                application/json:
                                  schema:
                                    $ref: 'schemas.yaml#/PetList'
                    """);

            ApiOperation listPets = parser.parse(main).getOperations("/pets").get("GET");

            assertTrue(listPets.isCollectionResponse());
            assertFalse(listPets.isEmptyResponse());
        }

        @Test
        @DisplayName("response examples are kept on the operation")
        void examples() {
            OpenApiDocument document = parser.parse("""
                    openapi: 3.0.0
                    info:
                      title: Pets
                      version: '1'
                    paths:
                      /pets/{petId}:
                        get:
                          responses:
                            '200':
                              description: ok
                              content:
                                application/json:
                                  schema:
                                    type: object
                                  example:
                                    name: Fido
                      /owners:
                        get:
                          responses:
                            '200':
                              description: ok
                              content:
                                application/json:
                                  schema:
                                    type: array
                                    items:
                                      type: string
                    """);

            assertEquals("Fido", document.getOperations("/pets/{petId}").get("GET").getExample().get("name").asText());
            assertNull(document.getOperations("/owners").get("GET").getExample());
        }

        @Test
        @DisplayName("unresolvable $refs are rejected")
        void unresolvableRef() {
            assertThrows(OpenApiParseException.class, () -> parser.parse("""
                    openapi: 3.0.0
                    paths:
                      /pets:
                        get:
                          responses:
                            '200':
                              $ref: '#/components/responses/Missing'
                    """));
        }

        @Test
        @DisplayName("missing files are reported as parse errors")
        void missingFile() {
            assertThrows(OpenApiParseException.class, () -> parser.parse(Path.of("does-not-exist.yaml")));
        }
    }
}
