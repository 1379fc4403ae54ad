package com.llmfactory.common.store;

import com.llmfactory.common.errors.StoreAccessError;

import java.util.List;
import java.util.Set;

/**
 * Dispatches each call to the first delegate that supports the location.
 */
public class ObjectStoreRouter implements ObjectStore {

    private final List<ObjectStore> delegates;

    public ObjectStoreRouter(List<ObjectStore> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(String location) {
        return delegates.stream().anyMatch(d -> d.supports(location));
    }

    @Override
    public boolean isDirectory(String location) {
        return storeFor(location).isDirectory(location);
    }

    @Override
    public List<String> list(String location, Set<String> extensions) {
        return storeFor(location).list(location, extensions);
    }

    @Override
    public byte[] read(String location) {
        return storeFor(location).read(location);
    }

    private ObjectStore storeFor(String location) {
        for (ObjectStore delegate : delegates) {
            if (delegate.supports(location)) {
                return delegate;
            }
        }
        throw new StoreAccessError("No object store configured for location: " + location);
    }
}
