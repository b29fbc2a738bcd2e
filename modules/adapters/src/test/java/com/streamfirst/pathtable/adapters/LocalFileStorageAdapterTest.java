package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.NotFoundException;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.domain.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFileStorageAdapterTest {

    @TempDir
    Path root;

    private LocalFileStorageAdapter storage;

    @BeforeEach
    void setUp() {
        storage = new LocalFileStorageAdapter(root);
    }

    @Test
    void testWriteCreatesParentDirectories() throws Exception {
        storage.write("/data/France/OVH/info.json", bytes("{}"));

        assertTrue(Files.isRegularFile(root.resolve("data/France/OVH/info.json")));
        assertEquals("{}", new String(storage.read("/data/France/OVH/info.json"), StandardCharsets.UTF_8));
    }

    @Test
    void testListKeepsPrefixStyle() {
        storage.write("/data/France/OVH/info.json", bytes("{}"));
        storage.write("/data/Germany/DF/info.json", bytes("{}"));
        storage.write("/datasets/x.json", bytes("{}"));

        try (Stream<String> paths = storage.list("/data/")) {
            assertThat(paths).containsExactlyInAnyOrder("/data/France/OVH/info.json", "/data/Germany/DF/info.json");
        }
        try (Stream<String> paths = storage.list("/data/Fr")) {
            assertThat(paths).containsExactly("/data/France/OVH/info.json");
        }
        try (Stream<String> paths = storage.list("data")) {
            assertThat(paths).hasSize(3).allMatch(path -> path.startsWith("data"));
        }
    }

    @Test
    void testListOfMissingDirectoryIsEmpty() {
        try (Stream<String> paths = storage.list("/nothing/here/")) {
            assertThat(paths).isEmpty();
        }
    }

    @Test
    void testStampFollowsContent() {
        storage.write("/a.json", bytes("{}"));
        Stamp before = storage.stat("/a.json");

        assertEquals(before, storage.stat("/a.json"));
        storage.write("/a.json", bytes("{\"changed\":true}"));
        assertNotEquals(before, storage.stat("/a.json"));
    }

    @Test
    void testMissingFilesRaiseNotFound() {
        assertThrows(NotFoundException.class, () -> storage.read("/missing.json"));
        assertThrows(NotFoundException.class, () -> storage.stat("/missing.json"));
        assertThrows(NotFoundException.class, () -> storage.delete("/missing.json"));
        assertFalse(storage.exists("/missing.json"));
    }

    @Test
    void testCreateIfAbsentIsExclusive() {
        assertTrue(storage.createIfAbsent("/locks/.lock_orders"));
        assertFalse(storage.createIfAbsent("/locks/.lock_orders"));

        storage.delete("/locks/.lock_orders");
        assertTrue(storage.createIfAbsent("/locks/.lock_orders"));
    }

    @Test
    void testPathsCannotEscapeRoot() {
        assertThrows(StorageException.class, () -> storage.write("/../outside.json", bytes("{}")));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
