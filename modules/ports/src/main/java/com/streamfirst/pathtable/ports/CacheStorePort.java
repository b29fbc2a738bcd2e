package com.streamfirst.pathtable.ports;

import com.streamfirst.pathtable.domain.CacheEntry;

import java.util.Optional;

/**
 * Port for memoizing decoded file content keyed by path.
 * Validity against the live stamp is checked by the caller; stores only keep entries.
 * Stores are per process and do not serialize concurrent read-modify-write cycles.
 */
public interface CacheStorePort {

    /**
     * Gets the entry for a path.
     *
     * @param path the storage path of the cached file
     * @return the entry if one was stored
     */
    Optional<CacheEntry> load(String path);

    /**
     * Stores or replaces the entry for its path.
     *
     * @param entry the entry to store
     */
    void save(CacheEntry entry);

    /**
     * Drops the entry for a path, if any.
     *
     * @param path the storage path of the cached file
     */
    void invalidate(String path);

    /**
     * Persists pending changes. Stores without a backing location do nothing.
     */
    default void flush() {
    }

    /**
     * A store that keeps nothing, so that every read decodes the file afresh.
     */
    static CacheStorePort disabled() {
        return new CacheStorePort() {
            @Override
            public Optional<CacheEntry> load(String path) {
                return Optional.empty();
            }

            @Override
            public void save(CacheEntry entry) {
            }

            @Override
            public void invalidate(String path) {
            }
        };
    }
}
