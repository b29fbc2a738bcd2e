package com.streamfirst.pathtable.ports;

import com.streamfirst.pathtable.domain.Stamp;

import java.util.stream.Stream;

/**
 * Port for byte-level file operations on a storage tree.
 * Abstracts different transports (local disk, object stores, FTP, etc.) behind a uniform
 * interface. All paths are strings using '/' separators regardless of the transport.
 *
 * <p>Every operation may block on I/O. Failures are reported as
 * {@link com.streamfirst.pathtable.domain.StorageException}; a missing path as
 * {@link com.streamfirst.pathtable.domain.NotFoundException}.
 */
public interface StoragePort {

    /**
     * Lists every file whose path starts with the given prefix, recursively.
     * The stream is lazy and may hold open directory handles: close it when done.
     *
     * @param prefix the raw path prefix, not necessarily ending at a separator
     * @return the matching file paths in the provider's natural listing order
     */
    Stream<String> list(String prefix);

    /**
     * Gets the last-modification stamp of a file.
     *
     * @param path the file path
     * @return the current stamp
     * @throws com.streamfirst.pathtable.domain.NotFoundException if the file does not exist
     */
    Stamp stat(String path);

    /**
     * Reads entire file content into memory.
     *
     * @param path the file path to read
     * @return the file content
     * @throws com.streamfirst.pathtable.domain.NotFoundException if the file does not exist
     */
    byte[] read(String path);

    /**
     * Writes a file, creating parent directories as needed and replacing any previous content.
     *
     * @param path the file path
     * @param data the content to write
     */
    void write(String path, byte[] data);

    /**
     * Deletes a file.
     *
     * @param path the file path to delete
     * @throws com.streamfirst.pathtable.domain.NotFoundException if the file does not exist
     */
    void delete(String path);

    /**
     * Atomically creates an empty file if no file exists at the path.
     *
     * @param path the file path
     * @return true if this call created the file, false if it already existed
     */
    boolean createIfAbsent(String path);

    /**
     * Checks if a file exists.
     *
     * @param path the file path
     * @return true if the file exists
     */
    boolean exists(String path);
}
