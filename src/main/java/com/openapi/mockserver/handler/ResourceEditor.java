package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.metrics.NoOpMetricsService;
import com.openapi.mockserver.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Locale;
import java.util.Optional;

/**
 * Creates, updates and deletes the single REST resource at the request URL.
 *
 * <ul>
 *   <li>{@code POST}, {@code PATCH}: merge the request body into the existing resource, or create it</li>
 *   <li>{@code PUT}: overwrite the existing resource, or create it</li>
 *   <li>{@code DELETE}: delete the resource</li>
 * </ul>
 *
 * <p>The response body is the resource's data, or the data of its whole collection when
 * the operation responds with an array. A missing resource yields {@code 404}.</p>
 */
public class ResourceEditor {
    private static final Logger log = LoggerFactory.getLogger(ResourceEditor.class);

    private final DataStore dataStore;
    private final MetricsService metrics;
    private final Map<String, MockOperation> operations;

    public ResourceEditor(DataStore dataStore) {
        this(dataStore, new NoOpMetricsService());
    }

    public ResourceEditor(DataStore dataStore, MetricsService metrics) {
        this.dataStore = dataStore;
        this.metrics = metrics;
        this.operations = Map.of(
                "POST", this::mergeResource,
                "PATCH", this::mergeResource,
                "PUT", this::overwriteResource,
                "DELETE", this::deleteResource);
    }

    /**
     * Returns the edit operation for an HTTP method, if there is one.
     */
    public Optional<MockOperation> operationFor(String method) {
        return Optional.ofNullable(operations.get(method.toUpperCase(Locale.ROOT)));
    }

    /**
     * Creates the resource, or merges the request body into the existing one.
     * Use {@link #overwriteResource} to replace existing data instead.
     */
    public void mergeResource(MockRequest request, MockResponse response) {
        Resource resource = createResource(request);

        log.debug("Saving data at {}", resource);
        Resource saved = dataStore.save(resource);
        metrics.incrementResourceSaved();
        sendResponse(request, response, Optional.of(saved));
    }

    /**
     * Creates the resource, replacing any existing data.
     * Use {@link #mergeResource} to merge with existing data instead.
     */
    public void overwriteResource(MockRequest request, MockResponse response) {
        Resource resource = createResource(request);

        dataStore.delete(resource);

        log.debug("Saving data at {}", resource);
        Resource saved = dataStore.save(resource);
        metrics.incrementResourceSaved();
        sendResponse(request, response, Optional.of(saved));
    }

    /**
     * Deletes the resource. Responds {@code 404} if it does not exist.
     */
    public void deleteResource(MockRequest request, MockResponse response) {
        Resource resource = createResource(request);

        Optional<Resource> deleted = dataStore.delete(resource);
        deleted.ifPresent(r -> metrics.incrementResourceDeleted());
        sendResponse(request, response, deleted);
    }

    private static Resource createResource(MockRequest request) {
        return new Resource(request.path(), request.body());
    }

    private void sendResponse(MockRequest request, MockResponse response, Optional<Resource> result) {
        if (result.isEmpty()) {
            log.debug("ERROR! 404 - resource on {} does not exist", request.path());
            metrics.incrementResourceNotFound();
            throw MockException.notFound(request.path());
        }

        Resource resource = result.get();
        log.debug("{} successfully created/edited/deleted", resource);
        response.setLastModified(resource.getModifiedOn());

        // Leave a body set by earlier processing alone
        if (response.hasBody()) {
            return;
        }

        if (response.isCollection()) {
            ArrayNode body = JsonNodeFactory.instance.arrayNode();
            for (Resource member : dataStore.getCollection(resource.getCollection())) {
                if (member.hasData()) {
                    body.add(member.getData());
                }
            }
            response.setBody(body);
        } else {
            response.setBody(resource.getData());
        }
    }
}
