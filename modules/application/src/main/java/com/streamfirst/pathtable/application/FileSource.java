package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.domain.IncompleteKeyException;
import com.streamfirst.pathtable.domain.KeyBinding;
import com.streamfirst.pathtable.domain.LocatedPath;
import com.streamfirst.pathtable.domain.NotFoundException;
import com.streamfirst.pathtable.domain.NotWritableException;
import com.streamfirst.pathtable.domain.SingletonExpectedException;
import com.streamfirst.pathtable.ports.CodecPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * One named, templated file set read and written as rows. A row is the content of a
 * file record merged with the placeholder values of the file's path; on a name conflict
 * the placeholder value wins.
 */
@Slf4j
public class FileSource {

    private final String name;
    private final Locator locator;
    private final ContentCache cache;
    private final boolean writable;

    public FileSource(String name, Locator locator, ContentCache cache, boolean writable) {
        this.name = Objects.requireNonNull(name, "Source name cannot be null");
        this.locator = Objects.requireNonNull(locator, "Locator cannot be null");
        this.cache = Objects.requireNonNull(cache, "Content cache cannot be null");
        this.writable = writable;
    }

    public String name() {
        return name;
    }

    public Locator locator() {
        return locator;
    }

    public boolean isWritable() {
        return writable;
    }

    public Set<String> placeholderNames() {
        return locator.template().placeholderNames();
    }

    /**
     * Gets the existing paths whose placeholder values agree with the constraints.
     */
    public List<String> listPaths(KeyBinding constraints) {
        try (Stream<String> paths = locator.findPaths(constraints)) {
            return paths.toList();
        }
    }

    public boolean exists(KeyBinding binding) {
        return locator.exists(binding);
    }

    /**
     * Reads the rows of every file matching the constraints. Constraints on placeholders
     * select files; other constraints drop rows holding a different value for that field.
     * A file that vanishes between listing and reading is skipped.
     */
    public List<DataRecord> readRows(KeyBinding constraints) {
        KeyBinding contentConstraints = constraints.without(placeholderNames());
        List<LocatedPath> located;
        try (Stream<LocatedPath> stream = locator.findPathsAndBindings(constraints)) {
            located = stream.toList();
        }
        log.info("Found {} files to read for source '{}' fulfilling {}", located.size(), name, constraints);

        List<DataRecord> rows = new ArrayList<>();
        for (LocatedPath file : located) {
            List<DataRecord> records;
            try {
                records = cache.readRecords(file.path());
            } catch (NotFoundException e) {
                log.warn("File {} of source '{}' vanished before it could be read, dropping it", file.path(), name);
                continue;
            }
            for (DataRecord record : records) {
                if (matchesContent(record, contentConstraints)) {
                    rows.add(record.withKeys(file.binding()));
                }
            }
        }
        cache.flush();
        return rows;
    }

    /**
     * Reads the single row matching the constraints.
     *
     * @throws SingletonExpectedException if zero or several rows match
     */
    public DataRecord readRow(KeyBinding constraints) {
        List<DataRecord> rows = readRows(constraints);
        if (rows.size() != 1) {
            throw new SingletonExpectedException(locator.template().source(), rows.size());
        }
        return rows.get(0);
    }

    /**
     * Writes rows back to their files. Rows are grouped by placeholder values; each group
     * becomes one file. All paths are resolved before the first file is written.
     *
     * @param rows rows carrying every placeholder of the template plus content fields
     * @param dryRun if true, only log what would be written
     * @throws NotWritableException       if the source is read-only
     * @throws IncompleteKeyException     if a row lacks a placeholder value
     * @throws SingletonExpectedException if distinct rows target one file of a singleton codec
     */
    public void writeRows(List<DataRecord> rows, boolean dryRun) {
        requireWritable();
        Set<String> keys = placeholderNames();

        Map<KeyBinding, List<DataRecord>> recordsByKey = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            DataRecord row = rows.get(i);
            KeyBinding.Builder key = KeyBinding.builder();
            for (String placeholder : keys) {
                if (row.get(placeholder) == null) {
                    throw new IncompleteKeyException(name, placeholder, i);
                }
                key.put(placeholder, row.get(placeholder));
            }
            recordsByKey.computeIfAbsent(key.build(), k -> new ArrayList<>()).add(row.without(keys));
        }

        Map<String, List<DataRecord>> recordsByPath = new LinkedHashMap<>();
        for (Map.Entry<KeyBinding, List<DataRecord>> group : recordsByKey.entrySet()) {
            String path = locator.buildPath(group.getKey());
            List<DataRecord> records = group.getValue();
            if (cache.codec().mode() == CodecPort.Mode.SINGLETON) {
                records = new ArrayList<>(new LinkedHashSet<>(records));
                if (records.size() != 1) {
                    throw new SingletonExpectedException(path, records.size());
                }
            }
            recordsByPath.put(path, records);
        }

        String dryRunPrefix = dryRun ? "(dry_run) " : "";
        for (Map.Entry<String, List<DataRecord>> file : recordsByPath.entrySet()) {
            log.info("{}Saving {} record(s) of source '{}' to {}", dryRunPrefix, file.getValue().size(), name, file.getKey());
            if (!dryRun) {
                cache.writeRecords(file.getKey(), file.getValue());
            }
        }
        cache.flush();
    }

    public void writeRows(List<DataRecord> rows) {
        writeRows(rows, false);
    }

    public void writeRow(DataRecord row) {
        writeRows(List.of(row), false);
    }

    /**
     * Deletes every file matching the constraints.
     *
     * @return the paths deleted, or that would be deleted on a dry run
     */
    public List<String> delete(KeyBinding constraints, boolean dryRun) {
        requireWritable();
        List<String> paths = listPaths(constraints);
        String dryRunPrefix = dryRun ? "(dry_run) " : "";
        log.info("{}Deleting {} files of source '{}' fulfilling {}", dryRunPrefix, paths.size(), name, constraints);
        for (String path : paths) {
            log.debug("{}Deleting {}", dryRunPrefix, path);
            if (!dryRun) {
                cache.delete(path);
            }
        }
        cache.flush();
        return paths;
    }

    /**
     * Drops the cached content of every file matching the constraints.
     */
    public void invalidateCache(KeyBinding constraints) {
        for (String path : listPaths(constraints)) {
            cache.invalidate(path);
        }
        cache.flush();
    }

    private void requireWritable() {
        if (!writable) {
            throw new NotWritableException(name);
        }
    }

    private static boolean matchesContent(DataRecord record, KeyBinding contentConstraints) {
        for (String field : contentConstraints.names()) {
            if (record.contains(field) && !Objects.equals(record.get(field), contentConstraints.get(field))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "FileSource{" + name + ", " + locator.template() + (writable ? ", writable" : "") + "}";
    }
}
