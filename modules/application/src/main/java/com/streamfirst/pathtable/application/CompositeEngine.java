package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.domain.CompositeRow;
import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.domain.IncompleteKeyException;
import com.streamfirst.pathtable.domain.JoinKeyException;
import com.streamfirst.pathtable.domain.KeyBinding;
import com.streamfirst.pathtable.domain.NotWritableException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Joins several file sources into one row-oriented result keyed on the placeholders
 * they all share, and splits such rows back into per-source writes.
 *
 * <p>The join is a full outer join: every shared-key tuple seen in any source yields rows,
 * one per combination of the matching rows of the sources that have some. Placeholder
 * values are reported under {@code shared.}, content fields under {@code <source>.}.
 * The shared keys are computed once, at construction.
 */
@Slf4j
public class CompositeEngine {

    private final Map<String, FileSource> sources;
    private final Set<String> sharedKeys;
    private final Set<String> allKeys;
    private final Executor executor;

    /**
     * Creates an engine reading its sources one after the other.
     */
    public CompositeEngine(Map<String, FileSource> sources) {
        this(sources, null);
    }

    /**
     * Creates an engine.
     *
     * @param sources source name to source, in the order sources appear in results
     * @param executor if not null, per-source reads of {@link #readAll(KeyBinding)} run on it
     * @throws JoinKeyException if the sources share no placeholder, a source name is
     *                          reserved, or an unshared placeholder name appears in two sources
     */
    public CompositeEngine(Map<String, FileSource> sources, Executor executor) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("A composite needs at least one source");
        }
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.executor = executor;

        for (String name : this.sources.keySet()) {
            if (name.isEmpty() || name.equals(CompositeRow.SHARED) || name.indexOf(CompositeRow.SEPARATOR) >= 0) {
                throw new JoinKeyException("Invalid source name '" + name + "': it must be non-empty, not '"
                    + CompositeRow.SHARED + "' and without '" + CompositeRow.SEPARATOR + "'");
            }
        }

        Set<String> shared = null;
        for (FileSource source : this.sources.values()) {
            if (shared == null) {
                shared = new LinkedHashSet<>(source.placeholderNames());
            } else {
                shared.retainAll(source.placeholderNames());
            }
        }
        if (this.sources.size() > 1 && shared.isEmpty()) {
            throw new JoinKeyException("Sources " + this.sources.keySet() + " share no placeholder to join on");
        }
        this.sharedKeys = Collections.unmodifiableSet(shared);

        Map<String, String> ownerByKey = new HashMap<>();
        Set<String> all = new LinkedHashSet<>(shared);
        for (Map.Entry<String, FileSource> entry : this.sources.entrySet()) {
            for (String key : entry.getValue().placeholderNames()) {
                if (sharedKeys.contains(key)) {
                    continue;
                }
                String owner = ownerByKey.putIfAbsent(key, entry.getKey());
                if (owner != null) {
                    throw new JoinKeyException("Placeholder '" + key + "' appears in sources '" + owner + "' and '"
                        + entry.getKey() + "' but is not shared by all sources");
                }
                all.add(key);
            }
        }
        this.allKeys = Collections.unmodifiableSet(all);

        log.info("Composite of sources {} joins on {}", this.sources.keySet(), sharedKeys);
    }

    public Set<String> sharedKeys() {
        return sharedKeys;
    }

    public Map<String, FileSource> sources() {
        return sources;
    }

    public FileSource source(String name) {
        FileSource source = sources.get(name);
        if (source == null) {
            throw new IllegalArgumentException("Unknown source '" + name + "'");
        }
        return source;
    }

    public List<CompositeRow> readAll() {
        return readAll(KeyBinding.empty());
    }

    /**
     * Reads every source and joins their rows.
     *
     * @param constraints placeholder constraints, each applied to the sources having that
     *                    placeholder; names that are no placeholder of any source filter
     *                    content in every source
     */
    public List<CompositeRow> readAll(KeyBinding constraints) {
        Map<String, List<DataRecord>> rowsBySource = readSources(constraints);

        Map<List<Object>, Map<String, List<DataRecord>>> rowsByTuple = new LinkedHashMap<>();
        for (Map.Entry<String, List<DataRecord>> entry : rowsBySource.entrySet()) {
            for (DataRecord row : entry.getValue()) {
                List<Object> tuple = new ArrayList<>(sharedKeys.size());
                for (String key : sharedKeys) {
                    tuple.add(row.get(key));
                }
                rowsByTuple.computeIfAbsent(tuple, t -> new LinkedHashMap<>())
                    .computeIfAbsent(entry.getKey(), s -> new ArrayList<>())
                    .add(row);
            }
        }

        List<CompositeRow> result = new ArrayList<>();
        for (Map.Entry<List<Object>, Map<String, List<DataRecord>>> entry : rowsByTuple.entrySet()) {
            for (Map<String, DataRecord> combination : combinations(entry.getValue())) {
                result.add(toCompositeRow(entry.getKey(), combination));
            }
        }
        log.info("Joined {} shared key tuples of sources {} into {} rows", rowsByTuple.size(), sources.keySet(), result.size());
        return result;
    }

    public void writeAll(List<CompositeRow> rows) {
        writeAll(rows, false);
    }

    /**
     * Splits rows by source prefix and writes each source's share. A source whose block
     * is absent from a row, or holds only nulls, is not written for that row. Every row is
     * validated before the first file is written.
     *
     * @throws NotWritableException     if a row targets a read-only source
     * @throws IncompleteKeyException   if a row lacks a shared value a target source needs
     * @throws IllegalArgumentException if a row holds a prefix naming no source
     */
    public void writeAll(List<CompositeRow> rows, boolean dryRun) {
        Map<String, List<DataRecord>> recordsBySource = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            CompositeRow row = rows.get(i);
            for (String prefix : row.prefixes()) {
                if (!prefix.equals(CompositeRow.SHARED) && !sources.containsKey(prefix)) {
                    throw new IllegalArgumentException("Row #" + i + " holds prefix '" + prefix + "' naming no source");
                }
            }
            Map<String, Object> shared = row.block(CompositeRow.SHARED);

            for (Map.Entry<String, FileSource> entry : sources.entrySet()) {
                Map<String, Object> block = row.block(entry.getKey());
                if (block.values().stream().allMatch(Objects::isNull)) {
                    continue;
                }
                FileSource source = entry.getValue();
                if (!source.isWritable()) {
                    throw new NotWritableException(entry.getKey());
                }
                DataRecord.Builder record = DataRecord.builder();
                for (String key : source.placeholderNames()) {
                    Object value = shared.get(key);
                    if (value == null) {
                        throw new IncompleteKeyException(entry.getKey(), CompositeRow.sharedKey(key), i);
                    }
                    record.put(key, value);
                }
                block.forEach((field, value) -> {
                    if (!source.placeholderNames().contains(field)) {
                        record.put(field, value);
                    }
                });
                recordsBySource.computeIfAbsent(entry.getKey(), s -> new ArrayList<>()).add(record.build());
            }
        }

        for (Map.Entry<String, List<DataRecord>> entry : recordsBySource.entrySet()) {
            log.debug("Writing {} rows to source '{}'", entry.getValue().size(), entry.getKey());
            sources.get(entry.getKey()).writeRows(entry.getValue(), dryRun);
        }
    }

    /**
     * Drops the cached content of every source file matching the constraints.
     */
    public void invalidateCache(KeyBinding constraints) {
        for (FileSource source : sources.values()) {
            source.invalidateCache(constraints.restrictTo(source.placeholderNames()));
        }
    }

    private Map<String, List<DataRecord>> readSources(KeyBinding constraints) {
        KeyBinding contentConstraints = constraints.without(allKeys);
        Map<String, KeyBinding> constraintsBySource = new LinkedHashMap<>();
        sources.forEach((name, source) -> constraintsBySource.put(name, KeyBinding.builder()
            .putAll(constraints.restrictTo(source.placeholderNames()))
            .putAll(contentConstraints)
            .build()));

        Map<String, List<DataRecord>> rowsBySource = new LinkedHashMap<>();
        if (executor == null) {
            sources.forEach((name, source) -> rowsBySource.put(name, source.readRows(constraintsBySource.get(name))));
            return rowsBySource;
        }

        Map<String, CompletableFuture<List<DataRecord>>> futures = new LinkedHashMap<>();
        sources.forEach((name, source) -> futures.put(name,
            CompletableFuture.supplyAsync(() -> source.readRows(constraintsBySource.get(name)), executor)));
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        futures.forEach((name, future) -> rowsBySource.put(name, future.join()));
        return rowsBySource;
    }

    private List<Map<String, DataRecord>> combinations(Map<String, List<DataRecord>> rowsBySource) {
        List<Map<String, DataRecord>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (String name : sources.keySet()) {
            List<DataRecord> rows = rowsBySource.get(name);
            if (rows == null) {
                continue;
            }
            List<Map<String, DataRecord>> extended = new ArrayList<>(combinations.size() * rows.size());
            for (Map<String, DataRecord> combination : combinations) {
                for (DataRecord row : rows) {
                    Map<String, DataRecord> next = new LinkedHashMap<>(combination);
                    next.put(name, row);
                    extended.add(next);
                }
            }
            combinations = extended;
        }
        return combinations;
    }

    private CompositeRow toCompositeRow(List<Object> tuple, Map<String, DataRecord> combination) {
        CompositeRow.Builder row = CompositeRow.builder();
        int i = 0;
        for (String key : sharedKeys) {
            row.putShared(key, tuple.get(i++));
        }
        Set<String> written = new HashSet<>(sharedKeys);
        combination.forEach((name, record) -> {
            Set<String> placeholders = sources.get(name).placeholderNames();
            for (String field : record.fieldNames()) {
                if (placeholders.contains(field)) {
                    if (written.add(field)) {
                        row.putShared(field, record.get(field));
                    }
                } else {
                    row.putField(name, field, record.get(field));
                }
            }
        });
        return row.build();
    }
}
