package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.metrics.NoOpMetricsService;
import com.openapi.mockserver.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers {@code GET} requests from the data store. Jakarta RS serves {@code HEAD} through the same method.
 */
public class ResourceQuery {
    private static final Logger log = LoggerFactory.getLogger(ResourceQuery.class);

    private final DataStore dataStore;
    private final MetricsService metrics;

    public ResourceQuery(DataStore dataStore) {
        this(dataStore, new NoOpMetricsService());
    }

    public ResourceQuery(DataStore dataStore, MetricsService metrics) {
        this.dataStore = dataStore;
        this.metrics = metrics;
    }

    /**
     * Returns the resource at the request URL, or its whole collection when the operation
     * responds with an array. Responds {@code 404} if the resource does not exist.
     */
    public void queryResource(MockRequest request, MockResponse response) {
        Resource lookup = new Resource(request.path());

        if (response.isCollection()) {
            sendCollection(response, dataStore.getCollection(lookup.getCollection()));
            return;
        }

        Optional<Resource> resource = dataStore.get(lookup);
        if (resource.isEmpty()) {
            log.debug("ERROR! 404 - resource on {} does not exist", request.path());
            metrics.incrementResourceNotFound();
            throw MockException.notFound(request.path());
        }

        log.debug("Returning data from {}", resource.get());
        response.setLastModified(resource.get().getModifiedOn());
        if (!response.hasBody()) {
            response.setBody(resource.get().getData());
        }
    }

    /**
     * Returns every resource in the collection at the request URL. If the operation does not
     * respond with an array, only the first resource is returned ({@code 404} if there is none).
     */
    public void queryCollection(MockRequest request, MockResponse response) {
        List<Resource> resources = dataStore.getCollection(request.path());
        log.debug("Returning {} resources from collection {}", resources.size(), request.path());

        if (response.isCollection()) {
            sendCollection(response, resources);
            return;
        }

        if (resources.isEmpty()) {
            log.debug("ERROR! 404 - collection {} is empty", request.path());
            metrics.incrementResourceNotFound();
            throw MockException.notFound(request.path());
        }

        Resource first = resources.get(0);
        response.setLastModified(first.getModifiedOn());
        if (!response.hasBody()) {
            response.setBody(first.getData());
        }
    }

    private static void sendCollection(MockResponse response, List<Resource> resources) {
        response.setLastModified(latestModification(resources));
        if (response.hasBody()) {
            return;
        }
        ArrayNode body = JsonNodeFactory.instance.arrayNode();
        for (Resource resource : resources) {
            if (resource.hasData()) {
                body.add(resource.getData());
            }
        }
        response.setBody(body);
    }

    static Instant latestModification(List<Resource> resources) {
        return resources.stream()
                .map(Resource::getModifiedOn)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);
    }
}
