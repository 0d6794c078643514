package com.openapi.mockserver.store;

import com.openapi.mockserver.core.model.Resource;
import com.openapi.mockserver.core.model.RoutingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base class for {@link DataStore} implementations.
 *
 * <p>Handles lookup, merge and timestamp semantics once; subclasses only read and
 * write whole collections. Collections are addressed by their normalized key, so
 * routing rules (case sensitivity, strict trailing slashes) apply uniformly.</p>
 *
 * <p>All operations are serialized by a single lock.</p>
 */
public abstract class AbstractDataStore implements DataStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractDataStore.class);

    private final RoutingOptions routing;
    private final ReentrantLock lock = new ReentrantLock();

    protected AbstractDataStore(RoutingOptions routing) {
        this.routing = routing != null ? routing : RoutingOptions.defaults();
    }

    public RoutingOptions getRouting() {
        return routing;
    }

    /**
     * Reads a collection. The returned list is owned by the caller.
     *
     * @param collectionKey the normalized collection key
     * @return the resources in the collection, or an empty list
     */
    protected abstract List<Resource> readCollection(String collectionKey);

    /**
     * Replaces the contents of a collection.
     *
     * @param collectionKey the normalized collection key
     * @param resources     the new contents; an empty list removes the collection
     */
    protected abstract void writeCollection(String collectionKey, List<Resource> resources);

    @Override
    public Optional<Resource> get(Resource resource) {
        lock.lock();
        try {
            List<Resource> resources = readCollection(collectionKey(resource.getCollection()));
            return find(resources, resource).map(Resource::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Resource save(Resource resource) {
        lock.lock();
        try {
            String collectionKey = collectionKey(resource.getCollection());
            List<Resource> resources = readCollection(collectionKey);
            Optional<Resource> existing = find(resources, resource);

            Resource saved;
            if (existing.isPresent()) {
                saved = existing.get();
                saved.merge(resource);
                log.debug("store.merged resource={}", saved);
            } else {
                saved = resource.copy();
                Instant now = Instant.now();
                saved.setCreatedOn(now);
                saved.setModifiedOn(now);
                resources.add(saved);
                log.debug("store.created resource={}", saved);
            }

            writeCollection(collectionKey, resources);
            return saved.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Resource> delete(Resource resource) {
        lock.lock();
        try {
            String collectionKey = collectionKey(resource.getCollection());
            List<Resource> resources = readCollection(collectionKey);
            String key = resource.key(routing);

            Iterator<Resource> it = resources.iterator();
            while (it.hasNext()) {
                Resource candidate = it.next();
                if (candidate.key(routing).equals(key)) {
                    it.remove();
                    writeCollection(collectionKey, resources);
                    log.debug("store.deleted resource={}", candidate);
                    return Optional.of(candidate.copy());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Resource> getCollection(String collection) {
        lock.lock();
        try {
            List<Resource> resources = readCollection(collectionKey(collection));
            List<Resource> copies = new ArrayList<>(resources.size());
            for (Resource resource : resources) {
                copies.add(resource.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Resource> deleteCollection(String collection) {
        lock.lock();
        try {
            String collectionKey = collectionKey(collection);
            List<Resource> resources = readCollection(collectionKey);
            if (!resources.isEmpty()) {
                writeCollection(collectionKey, new ArrayList<>());
                log.debug("store.collectionDeleted collection={} count={}", collectionKey, resources.size());
            }
            return resources;
        } finally {
            lock.unlock();
        }
    }

    protected String collectionKey(String collection) {
        String normalized = Resource.normalizeCollection(collection);
        return normalized.isEmpty() ? "" : routing.normalize(normalized);
    }

    private Optional<Resource> find(List<Resource> resources, Resource resource) {
        String key = resource.key(routing);
        return resources.stream()
                .filter(candidate -> candidate.key(routing).equals(key))
                .findFirst();
    }
}
