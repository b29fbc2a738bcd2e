package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.CacheEntry;
import com.streamfirst.pathtable.ports.CacheStorePort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache store. Entries live as long as the adapter.
 */
public class InMemoryCacheStoreAdapter implements CacheStorePort {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> load(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    @Override
    public void save(CacheEntry entry) {
        entries.put(entry.path(), entry);
    }

    @Override
    public void invalidate(String path) {
        entries.remove(path);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
