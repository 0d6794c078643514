package com.openapi.mockserver.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * A single REST resource held by a {@link com.openapi.mockserver.store.DataStore}.
 *
 * <p>A resource is addressed by its collection and its name. For the URL
 * {@code /pets/fido} the collection is {@code /pets} and the name is {@code /fido}.
 * Root-level resources have an empty collection.</p>
 */
public class Resource {
    private String collection;
    private String name;
    private JsonNode data;
    private Instant createdOn;
    private Instant modifiedOn;

    /**
     * Creates a resource from a full URL path.
     */
    public Resource(String path) {
        this(path, MissingNode.getInstance());
    }

    public Resource(String path, JsonNode data) {
        String normalized = normalizePath(path);
        String trailing = "";
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            trailing = "/";
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int lastSlash = normalized.lastIndexOf('/');
        this.collection = normalized.substring(0, lastSlash);
        this.name = normalized.substring(lastSlash) + trailing;
        this.data = data != null ? data : MissingNode.getInstance();
    }

    /**
     * Creates a resource from a collection path and a resource name.
     */
    public Resource(String collection, String name, JsonNode data) {
        this.collection = normalizeCollection(collection);
        this.name = name == null || name.isEmpty() ? "/" : (name.startsWith("/") ? name : "/" + name);
        this.data = data != null ? data : MissingNode.getInstance();
    }

    /**
     * Normalizes a collection path: leading slash, no trailing slash, and {@code ""} for the root.
     */
    public static String normalizeCollection(String collection) {
        String value = collection == null ? "" : collection.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty()) {
            return "";
        }
        return value.startsWith("/") ? value : "/" + value;
    }

    private static String normalizePath(String path) {
        String value = path == null ? "" : path.trim();
        return value.startsWith("/") ? value : "/" + value;
    }

    public String getCollection() {
        return collection;
    }

    public String getName() {
        return name;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data != null ? data : MissingNode.getInstance();
    }

    public boolean hasData() {
        return !data.isMissingNode();
    }

    public Instant getCreatedOn() {
        return createdOn;
    }

    public void setCreatedOn(Instant createdOn) {
        this.createdOn = createdOn;
    }

    public Instant getModifiedOn() {
        return modifiedOn;
    }

    public void setModifiedOn(Instant modifiedOn) {
        this.modifiedOn = modifiedOn;
    }

    /**
     * Lookup key for this resource under the given routing rules.
     */
    public String key(RoutingOptions routing) {
        return routing.normalize(toString());
    }

    /**
     * Merges another resource's data into this one and bumps {@code modifiedOn}.
     *
     * <p>Two JSON objects are merged recursively; anything else replaces the current data.</p>
     */
    public void merge(Resource other) {
        this.modifiedOn = Instant.now();
        JsonNode otherData = other.getData();
        if (data.isObject() && otherData.isObject()) {
            mergeObjects((ObjectNode) data, (ObjectNode) otherData);
        } else {
            this.data = otherData.deepCopy();
        }
    }

    private static void mergeObjects(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                mergeObjects((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    /**
     * Returns an independent copy, so callers cannot mutate stored state.
     */
    public Resource copy() {
        Resource copy = new Resource(collection, name, data.deepCopy());
        copy.createdOn = createdOn;
        copy.modifiedOn = modifiedOn;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Resource resource = (Resource) o;
        return collection.equals(resource.collection) && name.equals(resource.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, name);
    }

    @Override
    public String toString() {
        return collection + name;
    }
}
