package com.openapi.mockserver.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.core.model.RoutingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed implementation of {@link DataStore}.
 *
 * <p>Each collection is persisted as a JSON array in its own file beneath the root
 * directory: collection {@code /pets/dogs} lives in {@code <root>/pets/dogs.json},
 * root-level resources in {@code <root>/.json}.</p>
 */
public class FileDataStore extends AbstractDataStore {
    private static final Logger log = LoggerFactory.getLogger(FileDataStore.class);

    private final Path rootDirectory;
    private final ObjectMapper objectMapper;

    public FileDataStore(Path rootDirectory) {
        this(rootDirectory, RoutingOptions.defaults());
    }

    public FileDataStore(Path rootDirectory, RoutingOptions routing) {
        super(routing);
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper();
        log.info("FileDataStore initialized: directory={}", this.rootDirectory);
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    protected List<Resource> readCollection(String collectionKey) {
        Path file = fileFor(collectionKey);
        List<Resource> resources = new ArrayList<>();
        if (!Files.exists(file)) {
            return resources;
        }

        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isArray()) {
                throw new DataStoreException("Collection file is not a JSON array: " + file);
            }
            for (JsonNode node : root) {
                resources.add(fromJson(node));
            }
            return resources;
        } catch (IOException e) {
            throw new DataStoreException("Failed to read collection " + describe(collectionKey) + " from " + file, e);
        }
    }

    @Override
    protected void writeCollection(String collectionKey, List<Resource> resources) {
        Path file = fileFor(collectionKey);
        try {
            if (resources.isEmpty()) {
                Files.deleteIfExists(file);
                return;
            }

            ArrayNode array = objectMapper.createArrayNode();
            for (Resource resource : resources) {
                array.add(toJson(resource));
            }
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), array);
        } catch (IOException e) {
            throw new DataStoreException("Failed to write collection " + describe(collectionKey) + " to " + file, e);
        }
    }

    private Path fileFor(String collectionKey) {
        Path file = rootDirectory.resolve(collectionKey.replaceFirst("^/", "") + ".json").normalize();
        if (!file.startsWith(rootDirectory)) {
            throw new DataStoreException("Collection path escapes the data directory: " + collectionKey);
        }
        return file;
    }

    private ObjectNode toJson(Resource resource) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("collection", resource.getCollection());
        node.put("name", resource.getName());
        if (resource.hasData()) {
            node.set("data", resource.getData());
        }
        if (resource.getCreatedOn() != null) {
            node.put("createdOn", resource.getCreatedOn().toString());
        }
        if (resource.getModifiedOn() != null) {
            node.put("modifiedOn", resource.getModifiedOn().toString());
        }
        return node;
    }

    private Resource fromJson(JsonNode node) {
        Resource resource = new Resource(node.path("collection").asText(""),
                node.path("name").asText("/"), node.get("data"));
        if (node.hasNonNull("createdOn")) {
            resource.setCreatedOn(Instant.parse(node.get("createdOn").asText()));
        }
        if (node.hasNonNull("modifiedOn")) {
            resource.setModifiedOn(Instant.parse(node.get("modifiedOn").asText()));
        }
        return resource;
    }

    private static String describe(String collectionKey) {
        return collectionKey.isEmpty() ? "/" : collectionKey;
    }
}
