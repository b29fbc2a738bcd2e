package com.streamfirst.pathtable.domain;

import java.util.Objects;

/**
 * Opaque last-modification marker reported by a storage provider. Two stamps of the
 * same path are equal only if the file did not change in between.
 */
public record Stamp(String value) {
    public Stamp {
        Objects.requireNonNull(value, "Stamp value cannot be null");
    }

    public static Stamp of(String value) {
        return new Stamp(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
