package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.CacheEntry;
import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.domain.PathTemplate;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.domain.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageCacheStoreAdapterTest {

    private static final PathTemplate DATA = PathTemplate.compile("/data/{country}/{company}/info.json");
    private static final PathTemplate SHARDS = PathTemplate.compile("/cache/{country}.cache.json");

    private InMemoryStorageAdapter storage;
    private StorageCacheStoreAdapter cacheStore;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageAdapter();
        cacheStore = new StorageCacheStoreAdapter(storage, SHARDS, DATA);
    }

    @Test
    void testEntriesSurviveRestart() {
        CacheEntry entry = entry("/data/France/OVH/info.json", "s1", DataRecord.of("email", "info@ovh.fr", "note", null));
        cacheStore.save(entry);
        assertFalse(storage.exists("/cache/France.cache.json"), "Nothing is persisted before flush");

        cacheStore.flush();

        StorageCacheStoreAdapter restarted = new StorageCacheStoreAdapter(storage, SHARDS, DATA);
        assertEquals(Optional.of(entry), restarted.load("/data/France/OVH/info.json"));
    }

    @Test
    void testEntriesAreShardedByTemplate() {
        cacheStore.save(entry("/data/France/OVH/info.json", "s1", DataRecord.of("a", 1)));
        cacheStore.save(entry("/data/France/Free/info.json", "s2", DataRecord.of("a", 2)));
        cacheStore.save(entry("/data/Germany/DF/info.json", "s3", DataRecord.of("a", 3)));
        cacheStore.flush();

        assertTrue(storage.exists("/cache/France.cache.json"));
        assertTrue(storage.exists("/cache/Germany.cache.json"));
        assertEquals("/cache/Germany.cache.json", cacheStore.shardPath("/data/Germany/DF/info.json"));
        String france = new String(storage.read("/cache/France.cache.json"), StandardCharsets.UTF_8);
        assertThat(france).contains("/data/France/OVH/info.json", "/data/France/Free/info.json").doesNotContain("Germany");
    }

    @Test
    void testInvalidationIsPersisted() {
        cacheStore.save(entry("/data/France/OVH/info.json", "s1", DataRecord.of("a", 1)));
        cacheStore.flush();

        cacheStore.invalidate("/data/France/OVH/info.json");
        cacheStore.flush();

        assertThat(new StorageCacheStoreAdapter(storage, SHARDS, DATA).load("/data/France/OVH/info.json")).isEmpty();
    }

    @Test
    void testUnreadableShardIsDiscarded() {
        storage.write("/cache/France.cache.json", "not json at all".getBytes(StandardCharsets.UTF_8));

        assertThat(cacheStore.load("/data/France/OVH/info.json")).isEmpty();
    }

    @Test
    void testShardReadFailurePropagatesAndKeepsPersistedEntries() {
        CacheEntry entry = entry("/data/France/OVH/info.json", "s1", DataRecord.of("a", 1));
        cacheStore.save(entry);
        cacheStore.flush();
        byte[] persisted = storage.read("/cache/France.cache.json");

        AtomicBoolean failing = new AtomicBoolean(true);
        InMemoryStorageAdapter flaky = new InMemoryStorageAdapter() {
            @Override
            public byte[] read(String path) {
                if (failing.get()) {
                    throw new StorageException(path, "Storage temporarily unavailable");
                }
                return super.read(path);
            }
        };
        flaky.write("/cache/France.cache.json", persisted);
        StorageCacheStoreAdapter restarted = new StorageCacheStoreAdapter(flaky, SHARDS, DATA);

        assertThrows(StorageException.class, () -> restarted.load("/data/France/OVH/info.json"));
        restarted.flush();

        failing.set(false);
        assertThat(flaky.read("/cache/France.cache.json")).isEqualTo(persisted);
        assertEquals(Optional.of(entry), restarted.load("/data/France/OVH/info.json"));
    }

    @Test
    void testSingleFileCache() {
        StorageCacheStoreAdapter single = new StorageCacheStoreAdapter(storage, PathTemplate.compile("/cache.json"), DATA);
        single.save(entry("/data/France/OVH/info.json", "s1", DataRecord.of("a", 1)));
        single.flush();

        assertTrue(storage.exists("/cache.json"));
    }

    @Test
    void testShardPlaceholdersMustComeFromDataTemplate() {
        assertThrows(IllegalArgumentException.class,
            () -> new StorageCacheStoreAdapter(storage, PathTemplate.compile("/cache/{region}.json"), DATA));
    }

    private static CacheEntry entry(String path, String stamp, DataRecord record) {
        return new CacheEntry(path, Stamp.of(stamp), List.of(record));
    }
}
