package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.openapi.ApiOperation;
import com.openapi.mockserver.store.InMemoryDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ResourceEditor Tests")
class ResourceEditorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryDataStore store;
    private MetricsService metrics;
    private ResourceEditor editor;

    @BeforeEach
    void setUp() {
        store = new InMemoryDataStore();
        metrics = mock(MetricsService.class);
        editor = new ResourceEditor(store, metrics);
    }

    private JsonNode json(String value) throws Exception {
        return mapper.readTree(value);
    }

    private MockResponse singleResponse() {
        return new MockResponse(200, false, false);
    }

    @Nested
    @DisplayName("mergeResource")
    class Merge {

        @Test
        @DisplayName("creates a missing resource and returns its data")
        void creates() throws Exception {
            MockResponse response = singleResponse();

            editor.mergeResource(new MockRequest("POST", "/pets/fido", json("{\"name\":\"Fido\"}")), response);

            assertEquals(json("{\"name\":\"Fido\"}"), response.getBody());
            assertNotNull(response.getLastModified());
            assertTrue(store.get(new Resource("/pets/fido")).isPresent());
            verify(metrics).incrementResourceSaved();
        }

        @Test
        @DisplayName("merges into an existing resource")
        void merges() throws Exception {
            store.save(new Resource("/pets/fido", json("{\"name\":\"Fido\",\"age\":3}")));
            MockResponse response = singleResponse();

            editor.mergeResource(new MockRequest("PATCH", "/pets/fido", json("{\"age\":4}")), response);

            assertEquals(json("{\"name\":\"Fido\",\"age\":4}"), response.getBody());
        }

        @Test
        @DisplayName("collection responses return the whole collection")
        void collectionResponse() throws Exception {
            store.save(new Resource("/pets/rex", json("{\"name\":\"Rex\"}")));
            MockResponse response = new MockResponse(200, true, false);

            editor.mergeResource(new MockRequest("PATCH", "/pets/fido", json("{\"name\":\"Fido\"}")), response);

            assertTrue(response.getBody().isArray());
            assertEquals(2, response.getBody().size());
        }

        @Test
        @DisplayName("a response example is returned instead of the stored data")
        void keepsExampleBody() throws Exception {
            MockResponse response = MockResponse.forOperation(ApiOperation.builder()
                    .method("POST").pathTemplate("/pets/{petId}")
                    .example(TextNode.valueOf("example")).build());

            editor.mergeResource(new MockRequest("POST", "/pets/fido", json("{\"name\":\"Fido\"}")), response);

            assertEquals(TextNode.valueOf("example"), response.getBody());
            assertNotNull(response.getLastModified());
            assertTrue(store.get(new Resource("/pets/fido")).isPresent());
        }
    }

    @Nested
    @DisplayName("overwriteResource")
    class Overwrite {

        @Test
        @DisplayName("replaces existing data instead of merging")
        void replaces() throws Exception {
            store.save(new Resource("/pets/fido", json("{\"name\":\"Fido\",\"age\":3}")));
            MockResponse response = singleResponse();

            editor.overwriteResource(new MockRequest("PUT", "/pets/fido", json("{\"name\":\"Rex\"}")), response);

            assertEquals(json("{\"name\":\"Rex\"}"), response.getBody());
            assertEquals(json("{\"name\":\"Rex\"}"), store.get(new Resource("/pets/fido")).orElseThrow().getData());
        }

        @Test
        @DisplayName("creates a missing resource")
        void creates() throws Exception {
            MockResponse response = singleResponse();

            editor.overwriteResource(new MockRequest("PUT", "/pets/fido", json("{\"name\":\"Fido\"}")), response);

            assertEquals(1, store.getCollection("/pets").size());
        }
    }

    @Nested
    @DisplayName("deleteResource")
    class Delete {

        @Test
        @DisplayName("deletes the resource and returns its data")
        void deletes() throws Exception {
            store.save(new Resource("/pets/fido", json("{\"name\":\"Fido\"}")));
            MockResponse response = singleResponse();

            editor.deleteResource(new MockRequest("DELETE", "/pets/fido"), response);

            assertEquals(json("{\"name\":\"Fido\"}"), response.getBody());
            assertTrue(store.get(new Resource("/pets/fido")).isEmpty());
            verify(metrics).incrementResourceDeleted();
        }

        @Test
        @DisplayName("collection responses return the collection after the removal")
        void collectionResponse() throws Exception {
            store.save(new Resource("/pets/fido", json("{\"name\":\"Fido\"}")));
            store.save(new Resource("/pets/rex", json("{\"name\":\"Rex\"}")));
            MockResponse response = new MockResponse(200, true, false);

            editor.deleteResource(new MockRequest("DELETE", "/pets/fido"), response);

            assertEquals(json("[{\"name\":\"Rex\"}]"), response.getBody());
        }

        @Test
        @DisplayName("missing resources respond 404")
        void missing() {
            MockException e = assertThrows(MockException.class,
                    () -> editor.deleteResource(new MockRequest("DELETE", "/pets/ghost"), singleResponse()));

            assertEquals(404, e.getStatus());
            assertEquals("Not Found: /pets/ghost", e.getMessage());
            verify(metrics).incrementResourceNotFound();
            verify(metrics, never()).incrementResourceDeleted();
        }
    }

    @Test
    @DisplayName("operationFor maps edit methods case-insensitively")
    void operationFor() {
        assertTrue(editor.operationFor("post").isPresent());
        assertTrue(editor.operationFor("PATCH").isPresent());
        assertTrue(editor.operationFor("PUT").isPresent());
        assertTrue(editor.operationFor("DELETE").isPresent());
        assertTrue(editor.operationFor("GET").isEmpty());
    }
}
