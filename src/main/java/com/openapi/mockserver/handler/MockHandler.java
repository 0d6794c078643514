package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.mockserver.openapi.ApiOperation;
import com.openapi.mockserver.openapi.OpenApiRequest;
import com.openapi.mockserver.store.DataStore;
import com.openapi.mockserver.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a resolved request to the matching mock behaviour.
 *
 * <p>Collection paths ({@code /pets}) are queried, appended to and deleted as a whole;
 * resource paths ({@code /pets/{petId}}) are queried, merged, overwritten and deleted
 * one resource at a time. The final response is shaped by the operation's success
 * response: empty responses drop the body, array responses wrap a single value.</p>
 */
public class MockHandler {
    private static final Logger log = LoggerFactory.getLogger(MockHandler.class);

    private final ResourceEditor resourceEditor;
    private final ResourceQuery resourceQuery;
    private final CollectionEditor collectionEditor;

    public MockHandler(DataStore dataStore, MetricsService metrics) {
        this(new ResourceEditor(dataStore, metrics), new ResourceQuery(dataStore, metrics),
                new CollectionEditor(dataStore, metrics));
    }

    public MockHandler(ResourceEditor resourceEditor, ResourceQuery resourceQuery,
                       CollectionEditor collectionEditor) {
        this.resourceEditor = resourceEditor;
        this.resourceQuery = resourceQuery;
        this.collectionEditor = collectionEditor;
    }

    /**
     * Handles a request whose path is defined by the OpenAPI document.
     *
     * @throws MockException 405 if the path does not define the method, 404 for missing resources
     */
    public MockResponse handle(OpenApiRequest openApiRequest, MockRequest request) {
        if (!openApiRequest.hasOperation()) {
            throw MockException.methodNotAllowed(request.method(), request.path(),
                    openApiRequest.getAllowedMethods());
        }

        ApiOperation operation = openApiRequest.getOperation();
        MockResponse response = MockResponse.forOperation(operation);
        MockOperation mock = select(openApiRequest, request.method());

        log.debug("mock.dispatch operation={} collectionPath={} collectionResponse={}",
                operation, openApiRequest.isCollectionPath(), response.isCollection());
        if (mock != null) {
            mock.handle(request, response);
        }

        return finish(response);
    }

    private MockOperation select(OpenApiRequest openApiRequest, String method) {
        boolean collectionPath = openApiRequest.isCollectionPath();
        return switch (method) {
            case "GET" -> collectionPath ? resourceQuery::queryCollection : resourceQuery::queryResource;
            case "POST", "PUT", "PATCH" -> collectionPath
                    ? collectionEditor::addToCollection
                    : resourceEditor.operationFor(method).orElse(null);
            case "DELETE" -> collectionPath ? collectionEditor::deleteCollection : resourceEditor::deleteResource;
            default -> null;
        };
    }

    private static MockResponse finish(MockResponse response) {
        if (response.isEmpty()) {
            response.setBody(null);
        } else if (response.isCollection() && response.hasBody() && !response.getBody().isArray()) {
            JsonNode single = response.getBody();
            ArrayNode wrapped = JsonNodeFactory.instance.arrayNode();
            wrapped.add(single);
            response.setBody(wrapped);
        }
        return response;
    }
}
