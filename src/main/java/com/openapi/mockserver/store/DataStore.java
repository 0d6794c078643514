package com.openapi.mockserver.store;

import com.openapi.mockserver.core.model.Resource;

import java.util.List;
import java.util.Optional;

/**
 * Storage for mock REST resources, grouped into collections.
 * Implementations must be safe for concurrent use.
 */
public interface DataStore {

    /**
     * Gets the stored resource at the same URL as the given resource.
     *
     * @param resource the resource to look up (only its collection and name are used)
     * @return the stored resource, or empty if it does not exist
     */
    Optional<Resource> get(Resource resource);

    /**
     * Saves a resource. If a resource already exists at the same URL, the new data
     * is merged into it; otherwise the resource is created.
     *
     * @param resource the resource to save
     * @return the stored resource after the save
     */
    Resource save(Resource resource);

    /**
     * Deletes the resource at the same URL as the given resource.
     * Deleting a resource that does not exist is not an error.
     *
     * @param resource the resource to delete
     * @return the deleted resource, or empty if nothing was deleted
     */
    Optional<Resource> delete(Resource resource);

    /**
     * Gets all resources in a collection, in insertion order.
     *
     * @param collection the collection path, e.g. {@code /pets}
     * @return the resources, or an empty list
     */
    List<Resource> getCollection(String collection);

    /**
     * Deletes every resource in a collection.
     *
     * @param collection the collection path
     * @return the deleted resources
     */
    List<Resource> deleteCollection(String collection);
}
