package com.streamfirst.pathtable.domain;

/**
 * Raised when a path does not exist, typically because it vanished between listing and
 * reading. Readers treat it as a dropped row rather than a failed read.
 */
public class NotFoundException extends StorageException {

    public NotFoundException(String path) {
        super(path, "File not found: " + path);
    }

    public NotFoundException(String path, Throwable cause) {
        super(path, "File not found: " + path, cause);
    }
}
