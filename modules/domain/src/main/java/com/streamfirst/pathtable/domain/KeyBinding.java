package com.streamfirst.pathtable.domain;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered mapping from placeholder name to scalar value. A partial binding is used as a
 * query constraint; a full binding builds a concrete path.
 *
 * <p>Values are never null. Integral numbers are held as {@link Long} and floating numbers
 * as {@link Double}, so bindings extracted from paths compare equal to bindings built by
 * callers with {@code int} literals.
 */
@EqualsAndHashCode
public final class KeyBinding {

    private static final KeyBinding EMPTY = new KeyBinding(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private KeyBinding(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static KeyBinding empty() {
        return EMPTY;
    }

    public static KeyBinding of(String name, Object value) {
        return builder().put(name, value).build();
    }

    public static KeyBinding of(String name1, Object value1, String name2, Object value2) {
        return builder().put(name1, value1).put(name2, value2).build();
    }

    public static KeyBinding of(String name1, Object value1, String name2, Object value2,
                                String name3, Object value3) {
        return builder().put(name1, value1).put(name2, value2).put(name3, value3).build();
    }

    public static KeyBinding of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Keeps only the entries whose name is in {@code names}, in this binding's order.
     */
    public KeyBinding restrictTo(Collection<String> names) {
        LinkedHashMap<String, Object> kept = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (names.contains(k)) {
                kept.put(k, v);
            }
        });
        return new KeyBinding(kept);
    }

    /**
     * Drops the entries whose name is in {@code names}.
     */
    public KeyBinding without(Collection<String> names) {
        LinkedHashMap<String, Object> kept = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (!names.contains(k)) {
                kept.put(k, v);
            }
        });
        return new KeyBinding(kept);
    }

    public KeyBinding with(String name, Object value) {
        return builder().putAll(this).put(name, value).build();
    }

    /**
     * True if every entry of {@code constraints} whose name is bound here has an equal value.
     * Constraint names not bound here do not disqualify.
     */
    public boolean agreesWith(KeyBinding constraints) {
        for (Map.Entry<String, Object> constraint : constraints.values.entrySet()) {
            if (values.containsKey(constraint.getKey())
                    && !values.get(constraint.getKey()).equals(constraint.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Accumulates entries in insertion order; a repeated name replaces the earlier value.
     */
    public static final class Builder {
        private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, Object value) {
            Objects.requireNonNull(name, "Binding name cannot be null");
            if (value == null) {
                throw new IllegalArgumentException("Binding value for '" + name + "' cannot be null");
            }
            values.put(name, Scalars.normalize(name, value));
            return this;
        }

        public Builder putAll(KeyBinding other) {
            values.putAll(other.values);
            return this;
        }

        public KeyBinding build() {
            return new KeyBinding(new LinkedHashMap<>(values));
        }
    }
}
