package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.NotFoundException;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.domain.StorageException;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * In-memory implementation of StoragePort for testing and development.
 * Simulates a file tree using a map from path to byte array.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryStorageAdapter implements StoragePort {

    // Map from file path to stored content
    private final Map<String, StoredFile> files = new ConcurrentHashMap<>();

    // Every write gets a new version, so stamps differ even within one clock tick
    private final AtomicLong versions = new AtomicLong();

    private volatile boolean available = true;

    @Override
    public Stream<String> list(String prefix) {
        checkAvailable(prefix);
        List<String> matchingFiles = files.keySet().stream()
                .filter(path -> path.startsWith(prefix))
                .sorted()
                .toList();

        log.debug("Found {} files with prefix '{}'", matchingFiles.size(), prefix);
        return matchingFiles.stream();
    }

    @Override
    public Stamp stat(String path) {
        StoredFile file = require(path);
        return Stamp.of(file.modifiedAt() + "#" + file.version());
    }

    @Override
    public byte[] read(String path) {
        log.debug("Reading file {}", path);
        byte[] content = require(path).content();
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public void write(String path, byte[] data) {
        checkAvailable(path);
        log.debug("Writing file {} ({} bytes)", path, data.length);
        files.put(path, newFile(data));
    }

    @Override
    public void delete(String path) {
        checkAvailable(path);
        if (files.remove(path) == null) {
            throw new NotFoundException(path);
        }
        log.debug("Deleted file {}", path);
    }

    @Override
    public boolean createIfAbsent(String path) {
        checkAvailable(path);
        return files.putIfAbsent(path, newFile(new byte[0])) == null;
    }

    @Override
    public boolean exists(String path) {
        checkAvailable(path);
        return files.containsKey(path);
    }

    /**
     * Simulates an unreachable storage: every operation fails while unavailable.
     */
    public void setAvailable(boolean available) {
        log.info("Storage is now {}", available ? "available" : "unavailable");
        this.available = available;
    }

    /**
     * Clears all storage data. Useful for testing.
     */
    public void clear() {
        log.info("Clearing all storage data");
        files.clear();
    }

    /**
     * Gets the total number of files.
     */
    public int getTotalFileCount() {
        return files.size();
    }

    /**
     * Gets the size of every file, for debugging.
     */
    public Map<String, Integer> getStorageInfo() {
        Map<String, Integer> info = new HashMap<>();
        files.forEach((path, file) -> info.put(path, file.content().length));
        return info;
    }

    private StoredFile newFile(byte[] data) {
        return new StoredFile(Arrays.copyOf(data, data.length), versions.incrementAndGet(), Instant.now());
    }

    private StoredFile require(String path) {
        checkAvailable(path);
        StoredFile file = files.get(path);
        if (file == null) {
            throw new NotFoundException(path);
        }
        return file;
    }

    private void checkAvailable(String path) {
        if (!available) {
            throw new StorageException(path, "Storage is unreachable while accessing " + path);
        }
    }

    private record StoredFile(byte[] content, long version, Instant modifiedAt) {
    }
}
