package com.streamfirst.pathtable.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.pathtable.domain.CacheEntry;
import com.streamfirst.pathtable.domain.CodecException;
import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.domain.KeyBinding;
import com.streamfirst.pathtable.domain.PathTemplate;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.ports.CacheStorePort;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache store persisted as JSON shard files next to the data. The shard of a data path is
 * given by the cache location template, whose placeholders must be a subset of the data
 * template's: {@code /data/{year:d}/.cache.json} keeps one shard per year.
 *
 * <p>Shards are loaded on first use and written back by {@link #flush()}. A shard that
 * cannot be decoded is discarded and rebuilt; a shard that cannot be read fails the lookup
 * with the storage error and stays unloaded.
 *
 * <p>Shard layout: {@code {"entries":[{"path":..,"stamp":..,"records":[{..}]}]}}.
 */
@Slf4j
public class StorageCacheStoreAdapter implements CacheStorePort {

    private final StoragePort storagePort;
    private final PathTemplate cacheTemplate;
    private final PathTemplate dataTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    private final Map<String, Map<String, CacheEntry>> shards = new ConcurrentHashMap<>();
    private final Set<String> dirtyShards = ConcurrentHashMap.newKeySet();

    public StorageCacheStoreAdapter(@NonNull StoragePort storagePort,
                                    @NonNull PathTemplate cacheTemplate,
                                    @NonNull PathTemplate dataTemplate) {
        if (!dataTemplate.placeholderNames().containsAll(cacheTemplate.placeholderNames())) {
            throw new IllegalArgumentException("Cache location '" + cacheTemplate.source()
                + "' uses placeholders missing from data template '" + dataTemplate.source() + "'");
        }
        this.storagePort = storagePort;
        this.cacheTemplate = cacheTemplate;
        this.dataTemplate = dataTemplate;
    }

    @Override
    public Optional<CacheEntry> load(String path) {
        return Optional.ofNullable(shard(shardPath(path)).get(path));
    }

    @Override
    public void save(CacheEntry entry) {
        String shardPath = shardPath(entry.path());
        shard(shardPath).put(entry.path(), entry);
        dirtyShards.add(shardPath);
    }

    @Override
    public void invalidate(String path) {
        String shardPath = shardPath(path);
        if (shard(shardPath).remove(path) != null) {
            dirtyShards.add(shardPath);
        }
    }

    @Override
    public void flush() {
        for (String shardPath : List.copyOf(dirtyShards)) {
            dirtyShards.remove(shardPath);
            Map<String, CacheEntry> shard = shards.get(shardPath);
            if (shard == null) {
                continue;
            }
            storagePort.write(shardPath, encode(shardPath, shard));
            log.debug("Persisted {} cache entries to {}", shard.size(), shardPath);
        }
    }

    String shardPath(String dataPath) {
        if (cacheTemplate.placeholderNames().isEmpty()) {
            return cacheTemplate.build(KeyBinding.empty());
        }
        KeyBinding binding = dataTemplate.match(dataPath)
            .orElseThrow(() -> new IllegalArgumentException(
                "Path '" + dataPath + "' does not match template '" + dataTemplate.source() + "'"));
        return cacheTemplate.build(binding);
    }

    private Map<String, CacheEntry> shard(String shardPath) {
        return shards.computeIfAbsent(shardPath, this::loadShard);
    }

    private Map<String, CacheEntry> loadShard(String shardPath) {
        Map<String, CacheEntry> shard = new ConcurrentHashMap<>();
        if (!storagePort.exists(shardPath)) {
            return shard;
        }
        try {
            JsonNode root = mapper.readTree(storagePort.read(shardPath));
            for (JsonNode node : root.path("entries")) {
                List<DataRecord> records = new ArrayList<>();
                for (JsonNode record : node.path("records")) {
                    records.add(JsonRecords.toRecord(shardPath, record));
                }
                String path = node.path("path").asText();
                shard.put(path, new CacheEntry(path, Stamp.of(node.path("stamp").asText()), records));
            }
            log.debug("Loaded {} cache entries from {}", shard.size(), shardPath);
        } catch (IOException | CodecException e) {
            log.warn("Discarding unreadable cache shard {}: {}", shardPath, e.getMessage());
            shard.clear();
            dirtyShards.add(shardPath);
        }
        return shard;
    }

    private byte[] encode(String shardPath, Map<String, CacheEntry> shard) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode entries = root.putArray("entries");
        shard.values().stream()
            .sorted(Comparator.comparing(CacheEntry::path))
            .forEach(entry -> {
                ObjectNode node = entries.addObject();
                node.put("path", entry.path());
                node.put("stamp", entry.stamp().value());
                ArrayNode records = node.putArray("records");
                entry.records().forEach(record -> {
                    JsonNode fields = mapper.valueToTree(record.asMap());
                    records.add(fields);
                });
            });
        try {
            return mapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new CodecException(shardPath, "Failed to encode cache shard", e);
        }
    }
}
