package com.streamfirst.pathtable.domain;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One decoded entry of a file: an ordered mapping from field name to a scalar out of
 * {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}.
 */
@EqualsAndHashCode
public final class DataRecord {

    private final Map<String, Object> fields;

    private DataRecord(LinkedHashMap<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static DataRecord empty() {
        return new DataRecord(new LinkedHashMap<>());
    }

    public static DataRecord of(Map<String, ?> fields) {
        Builder builder = builder();
        fields.forEach(builder::put);
        return builder.build();
    }

    public static DataRecord of(String field, Object value) {
        return builder().put(field, value).build();
    }

    public static DataRecord of(String field1, Object value1, String field2, Object value2) {
        return builder().put(field1, value1).put(field2, value2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns a record holding the binding's entries first, followed by this record's
     * fields that the binding does not name. The path is the source of truth for keys.
     */
    public DataRecord withKeys(KeyBinding binding) {
        Builder builder = builder();
        binding.asMap().forEach(builder::put);
        fields.forEach((k, v) -> {
            if (!binding.contains(k)) {
                builder.put(k, v);
            }
        });
        return builder.build();
    }

    public DataRecord without(Collection<String> names) {
        Builder builder = builder();
        fields.forEach((k, v) -> {
            if (!names.contains(k)) {
                builder.put(k, v);
            }
        });
        return builder.build();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, Object value) {
            Objects.requireNonNull(field, "Field name cannot be null");
            fields.put(field, Scalars.normalize(field, value));
            return this;
        }

        public DataRecord build() {
            return new DataRecord(new LinkedHashMap<>(fields));
        }
    }
}
