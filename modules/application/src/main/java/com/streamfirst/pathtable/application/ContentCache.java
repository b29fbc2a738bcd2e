package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.domain.CacheEntry;
import com.streamfirst.pathtable.domain.DataEvent;
import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.domain.SingletonExpectedException;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.ports.CacheStorePort;
import com.streamfirst.pathtable.ports.CodecPort;
import com.streamfirst.pathtable.ports.EventSinkPort;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Reads and writes decoded file content, reusing memoized records while the stamp of a
 * path is unchanged. Staleness is detected lazily on the next access to a path.
 */
@Slf4j
@RequiredArgsConstructor
public class ContentCache {

    @NonNull
    private final StoragePort storagePort;
    @NonNull
    private final CodecPort codec;
    @NonNull
    private final CacheStorePort cacheStore;
    @NonNull
    private final EventSinkPort eventSink;

    /**
     * Creates a cache that decodes every read afresh and publishes no events.
     */
    public ContentCache(StoragePort storagePort, CodecPort codec) {
        this(storagePort, codec, CacheStorePort.disabled(), EventSinkPort.discarding());
    }

    public CodecPort codec() {
        return codec;
    }

    /**
     * Gets the records of a file, decoding it only if its stamp changed since it was cached.
     *
     * @throws com.streamfirst.pathtable.domain.NotFoundException if the file does not exist
     */
    public List<DataRecord> readRecords(String path) {
        Stamp stamp = storagePort.stat(path);

        Optional<CacheEntry> cached = cacheStore.load(path);
        if (cached.isPresent()) {
            if (cached.get().isValidFor(stamp)) {
                log.debug("Serving cached content of {}", path);
                eventSink.publish(DataEvent.of(DataEvent.Type.CACHE_HIT, path, cached.get().records().size()));
                return cached.get().records();
            }
            log.debug("Cache out of date for {} (cached {}, live {})", path, cached.get().stamp(), stamp);
        }

        eventSink.publish(DataEvent.of(DataEvent.Type.PRE_READ, path, 0));
        byte[] content = storagePort.read(path);
        List<DataRecord> records = List.copyOf(codec.decode(path, content));
        if (codec.mode() == CodecPort.Mode.SINGLETON && records.size() != 1) {
            throw new SingletonExpectedException(path, records.size());
        }

        // stamped before reading: a concurrent change makes the entry stale, never wrongly fresh
        cacheStore.save(new CacheEntry(path, stamp, records));
        eventSink.publish(DataEvent.of(DataEvent.Type.POST_READ, path, records.size()));
        log.debug("Read {} record(s) from {}", records.size(), path);
        return records;
    }

    /**
     * Gets the single record of a file.
     *
     * @throws SingletonExpectedException if the file does not hold exactly one record
     */
    public DataRecord readRecord(String path) {
        List<DataRecord> records = readRecords(path);
        if (records.size() != 1) {
            throw new SingletonExpectedException(path, records.size());
        }
        return records.get(0);
    }

    /**
     * Encodes and writes records, then drops the cached entry of the path so that the
     * next read observes the stamp of this write.
     */
    public void writeRecords(String path, List<DataRecord> records) {
        if (codec.mode() == CodecPort.Mode.SINGLETON && records.size() != 1) {
            throw new SingletonExpectedException(path, records.size());
        }
        eventSink.publish(DataEvent.of(DataEvent.Type.PRE_WRITE, path, records.size()));
        byte[] content = codec.encode(path, records);
        storagePort.write(path, content);
        cacheStore.invalidate(path);
        eventSink.publish(DataEvent.of(DataEvent.Type.POST_WRITE, path, records.size()));
        log.debug("Wrote {} record(s) to {} ({} bytes)", records.size(), path, content.length);
    }

    public void writeRecord(String path, DataRecord record) {
        writeRecords(path, List.of(record));
    }

    /**
     * Deletes a file and its cached entry.
     */
    public void delete(String path) {
        storagePort.delete(path);
        cacheStore.invalidate(path);
        eventSink.publish(DataEvent.of(DataEvent.Type.DELETE, path, 0));
    }

    public void invalidate(String path) {
        cacheStore.invalidate(path);
    }

    /**
     * Persists pending cache changes, if the cache store has a backing location.
     */
    public void flush() {
        cacheStore.flush();
    }
}
