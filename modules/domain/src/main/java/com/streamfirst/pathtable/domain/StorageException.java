package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when the storage provider fails to list, stat, read, write or delete a path.
 */
@Getter
public class StorageException extends PathTableException {

    private final String path;

    public StorageException(String path, String message) {
        super(message);
        this.path = path;
    }

    public StorageException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
