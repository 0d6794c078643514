package com.openapi.mockserver.store;

import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.core.model.RoutingOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link DataStore}.
 * Suitable for testing and single-JVM deployments; data is lost on restart.
 */
public class InMemoryDataStore extends AbstractDataStore {

    private final ConcurrentMap<String, List<Resource>> collections = new ConcurrentHashMap<>();

    public InMemoryDataStore() {
        this(RoutingOptions.defaults());
    }

    public InMemoryDataStore(RoutingOptions routing) {
        super(routing);
    }

    @Override
    protected List<Resource> readCollection(String collectionKey) {
        List<Resource> resources = collections.get(collectionKey);
        return resources != null ? new ArrayList<>(resources) : new ArrayList<>();
    }

    @Override
    protected void writeCollection(String collectionKey, List<Resource> resources) {
        if (resources.isEmpty()) {
            collections.remove(collectionKey);
        } else {
            collections.put(collectionKey, new ArrayList<>(resources));
        }
    }

    /**
     * Returns the number of non-empty collections.
     */
    public int collectionCount() {
        return collections.size();
    }
}
