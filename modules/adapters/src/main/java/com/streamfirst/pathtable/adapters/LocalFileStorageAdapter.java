package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.NotFoundException;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.domain.StorageException;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.stream.Stream;

/**
 * StoragePort over a directory of the local file system. Storage paths are resolved
 * against the root directory; a leading '/' is relative to the root as well, and listed
 * paths keep the leading '/' when the listing prefix has one.
 */
@Slf4j
public class LocalFileStorageAdapter implements StoragePort {

    private final Path root;

    public LocalFileStorageAdapter(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("Local storage rooted at {}", this.root);
    }

    public Path root() {
        return root;
    }

    @Override
    public Stream<String> list(String prefix) {
        boolean absolute = prefix.startsWith("/");
        int slash = prefix.lastIndexOf('/');
        Path directory = resolve(slash < 0 ? "" : prefix.substring(0, slash));
        if (!Files.isDirectory(directory)) {
            log.debug("Directory {} does not exist, nothing to list for prefix '{}'", directory, prefix);
            return Stream.empty();
        }
        try {
            return Files.walk(directory)
                    .filter(Files::isRegularFile)
                    .map(file -> toStoragePath(file, absolute))
                    .filter(path -> path.startsWith(prefix));
        } catch (IOException e) {
            log.error("Failed to list files with prefix '{}'", prefix, e);
            throw new StorageException(prefix, "Failed to list files with prefix: " + prefix, e);
        }
    }

    @Override
    public Stamp stat(String path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(resolve(path), BasicFileAttributes.class);
            return Stamp.of(attributes.lastModifiedTime().toInstant() + "/" + attributes.size());
        } catch (NoSuchFileException e) {
            throw new NotFoundException(path, e);
        } catch (IOException e) {
            log.error("Failed to stat file {}", path, e);
            throw new StorageException(path, "Failed to stat file: " + path, e);
        }
    }

    @Override
    public byte[] read(String path) {
        log.debug("Reading file {}", path);
        try {
            return Files.readAllBytes(resolve(path));
        } catch (NoSuchFileException e) {
            throw new NotFoundException(path, e);
        } catch (IOException e) {
            log.error("Failed to read file {}", path, e);
            throw new StorageException(path, "Failed to read file: " + path, e);
        }
    }

    @Override
    public void write(String path, byte[] data) {
        log.debug("Writing file {} ({} bytes)", path, data.length);
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, data);
        } catch (IOException e) {
            log.error("Failed to write file {}", path, e);
            throw new StorageException(path, "Failed to write file: " + path, e);
        }
    }

    @Override
    public void delete(String path) {
        try {
            Files.delete(resolve(path));
            log.debug("Deleted file {}", path);
        } catch (NoSuchFileException e) {
            throw new NotFoundException(path, e);
        } catch (IOException e) {
            log.error("Failed to delete file {}", path, e);
            throw new StorageException(path, "Failed to delete file: " + path, e);
        }
    }

    @Override
    public boolean createIfAbsent(String path) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.createFile(file);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            log.error("Failed to create file {}", path, e);
            throw new StorageException(path, "Failed to create file: " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    private Path resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new StorageException(path, "Path escapes the storage root: " + path);
        }
        return resolved;
    }

    private String toStoragePath(Path file, boolean absolute) {
        String relative = root.relativize(file).toString().replace(File.separatorChar, '/');
        return absolute ? "/" + relative : relative;
    }
}
