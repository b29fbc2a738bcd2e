package com.streamfirst.pathtable.domain;

import java.util.List;
import java.util.Objects;

/**
 * Memoized decoded content of one path, valid while the live stamp of the path equals
 * {@link #stamp()}.
 *
 * @param path the storage path
 * @param stamp the stamp observed when the content was decoded or written
 * @param records the decoded records
 */
public record CacheEntry(String path, Stamp stamp, List<DataRecord> records) {
    public CacheEntry {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(stamp, "Stamp cannot be null");
        records = List.copyOf(records);
    }

    public boolean isValidFor(Stamp liveStamp) {
        return stamp.equals(liveStamp);
    }
}
