package com.streamfirst.pathtable.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Notification of a read or write of one file, delivered synchronously to an event sink.
 */
@Value
public class DataEvent {

    public enum Type {
        /** A file is about to be read and decoded */
        PRE_READ,
        /** A file was read and decoded */
        POST_READ,
        /** Content was served from the cache without decoding */
        CACHE_HIT,
        /** Records are about to be encoded and written */
        PRE_WRITE,
        /** Records were written */
        POST_WRITE,
        /** A file was deleted */
        DELETE
    }

    @NonNull Type type;
    @NonNull String path;
    int recordCount;
    @NonNull Instant occurredAt;

    public static DataEvent of(Type type, String path, int recordCount) {
        return new DataEvent(type, path, recordCount, Instant.now());
    }
}
