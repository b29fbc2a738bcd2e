package com.streamfirst.pathtable.domain;

import java.util.Objects;

/**
 * A named, typed slot of a path template.
 *
 * @param name the placeholder name, unique within its template
 * @param type the declared value type
 */
public record Placeholder(String name, PlaceholderType type) {
    public Placeholder {
        Objects.requireNonNull(name, "Placeholder name cannot be null");
        Objects.requireNonNull(type, "Placeholder type cannot be null");
    }

    @Override
    public String toString() {
        return "{" + name + ":" + type.label() + "}";
    }
}
