package com.phillippitts.genesis.service.storage;

import java.util.Optional;
import java.util.Set;

/**
 * Small persistent string store shared with plugins.
 *
 * <p>Implementations serialize writes and allow concurrent reads.
 */
public interface KeyValueStore {

    /**
     * Stores or replaces a value.
     *
     * @throws com.phillippitts.genesis.exception.StorageException if the change cannot be persisted
     */
    void put(String key, String value);

    Optional<String> get(String key);

    /**
     * @return {@code true} if the key existed
     */
    boolean remove(String key);

    Set<String> keys();
}
