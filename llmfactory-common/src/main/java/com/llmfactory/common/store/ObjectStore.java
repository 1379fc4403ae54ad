package com.llmfactory.common.store;

import java.util.List;
import java.util.Set;

/**
 * Read-only access to a flat directory of objects, either on the local
 * filesystem or in a remote object store.
 * <p>
 * Locations are plain strings: a filesystem path, or a URI such as
 * {@code s3://bucket/prefix}. Implementations throw
 * {@link com.llmfactory.common.errors.StoreAccessError} when the backing
 * store cannot be reached.
 */
public interface ObjectStore {

    /** Whether this store handles the given location. */
    boolean supports(String location);

    /** Whether the location names an existing directory (or a non-empty prefix). */
    boolean isDirectory(String location);

    /**
     * List the objects directly inside {@code location} whose names end with
     * one of {@code extensions}, sorted by location.
     *
     * @return full locations of the matching objects
     */
    List<String> list(String location, Set<String> extensions);

    /** Read an object fully. */
    byte[] read(String location);
}
