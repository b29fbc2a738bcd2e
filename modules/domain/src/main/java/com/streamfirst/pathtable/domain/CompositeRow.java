package com.streamfirst.pathtable.domain;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row of a composite read: a flat mapping of {@code shared.<key>} entries for the
 * placeholder values and {@code <source>.<field>} entries for the content each source
 * contributed. A source without a matching file contributes no entries.
 */
@EqualsAndHashCode
public final class CompositeRow {

    public static final String SHARED = "shared";
    public static final char SEPARATOR = '.';

    private final Map<String, Object> values;

    private CompositeRow(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CompositeRow of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String sharedKey(String name) {
        return SHARED + SEPARATOR + name;
    }

    public static String sourceKey(String source, String field) {
        return source + SEPARATOR + field;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object shared(String name) {
        return values.get(sharedKey(name));
    }

    public Object field(String source, String field) {
        return values.get(sourceKey(source, field));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Prefixes present in this row, in order of first appearance, {@code shared} included.
     */
    public Set<String> prefixes() {
        Set<String> prefixes = new LinkedHashSet<>();
        for (String key : values.keySet()) {
            int dot = key.indexOf(SEPARATOR);
            prefixes.add(dot < 0 ? key : key.substring(0, dot));
        }
        return prefixes;
    }

    /**
     * Entries under {@code prefix}, with the prefix and separator stripped.
     */
    public Map<String, Object> block(String prefix) {
        String start = prefix + SEPARATOR;
        Map<String, Object> block = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k.startsWith(start)) {
                block.put(k.substring(start.length()), v);
            }
        });
        return block;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "Row key cannot be null");
            values.put(key, Scalars.normalize(key, value));
            return this;
        }

        public Builder putShared(String name, Object value) {
            return put(sharedKey(name), value);
        }

        public Builder putField(String source, String field, Object value) {
            return put(sourceKey(source, field), value);
        }

        public CompositeRow build() {
            return new CompositeRow(new LinkedHashMap<>(values));
        }
    }
}
