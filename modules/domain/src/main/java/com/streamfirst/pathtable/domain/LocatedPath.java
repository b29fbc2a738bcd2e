package com.streamfirst.pathtable.domain;

import java.util.Objects;

/**
 * A storage path matched by a template, together with the binding extracted from it.
 */
public record LocatedPath(String path, KeyBinding binding) {
    public LocatedPath {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(binding, "Binding cannot be null");
    }
}
