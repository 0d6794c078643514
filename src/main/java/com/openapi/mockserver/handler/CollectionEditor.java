package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.metrics.NoOpMetricsService;
import com.openapi.mockserver.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Adds resources to, and deletes, the collection at the request URL.
 *
 * <p>A new member is named after the body's {@code id} (or {@code name}) property when
 * it is a string or number; otherwise a unique name is generated. An array body adds
 * one member per element.</p>
 */
public class CollectionEditor {
    private static final Logger log = LoggerFactory.getLogger(CollectionEditor.class);

    static final List<String> NAME_PROPERTIES = List.of("id", "name");

    private final DataStore dataStore;
    private final MetricsService metrics;

    public CollectionEditor(DataStore dataStore) {
        this(dataStore, new NoOpMetricsService());
    }

    public CollectionEditor(DataStore dataStore, MetricsService metrics) {
        this.dataStore = dataStore;
        this.metrics = metrics;
    }

    /**
     * Adds the request body to the collection. For {@code 201} responses the
     * {@code Location} header points at the new resource.
     */
    public void addToCollection(MockRequest request, MockResponse response) {
        String collection = Resource.normalizeCollection(request.path());
        List<JsonNode> items = new ArrayList<>();
        if (request.body().isArray()) {
            request.body().forEach(items::add);
        } else {
            items.add(request.body());
        }

        List<Resource> saved = new ArrayList<>();
        for (JsonNode item : items) {
            Resource resource = new Resource(collection, resourceName(collection, item), item);
            log.debug("Saving data at {}", resource);
            saved.add(dataStore.save(resource));
            metrics.incrementResourceSaved();
        }

        if (saved.isEmpty()) {
            return;
        }
        Resource last = saved.get(saved.size() - 1);
        response.setLastModified(last.getModifiedOn());
        if (response.getStatus() == 201) {
            response.setHeader("Location", last.toString());
        }

        if (response.hasBody()) {
            return;
        }
        if (response.isCollection()) {
            response.setBody(dataOf(dataStore.getCollection(collection)));
        } else if (request.body().isArray()) {
            response.setBody(dataOf(saved));
        } else {
            response.setBody(last.getData());
        }
    }

    /**
     * Deletes every resource in the collection. Deleting an empty collection is not an error.
     */
    public void deleteCollection(MockRequest request, MockResponse response) {
        List<Resource> deleted = dataStore.deleteCollection(request.path());
        deleted.forEach(r -> metrics.incrementResourceDeleted());
        log.debug("Deleted {} resources from collection {}", deleted.size(), request.path());

        response.setLastModified(ResourceQuery.latestModification(deleted));
        if (response.hasBody()) {
            return;
        }
        if (response.isCollection()) {
            response.setBody(dataOf(deleted));
        } else if (!deleted.isEmpty()) {
            response.setBody(deleted.get(0).getData());
        }
    }

    private String resourceName(String collection, JsonNode item) {
        for (String property : NAME_PROPERTIES) {
            JsonNode value = item.get(property);
            if (value != null && (value.isTextual() || value.isNumber()) && !value.asText().isBlank()
                    && !value.asText().contains("/")) {
                return "/" + value.asText();
            }
        }

        String name;
        do {
            name = "/" + UUID.randomUUID();
        } while (dataStore.get(new Resource(collection, name, null)).isPresent());
        return name;
    }

    private static ArrayNode dataOf(List<Resource> resources) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (Resource resource : resources) {
            if (resource.hasData()) {
                array.add(resource.getData());
            }
        }
        return array;
    }
}
