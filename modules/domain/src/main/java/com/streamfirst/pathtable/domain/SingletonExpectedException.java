package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when a single record is expected for a path but none or several distinct
 * records were found or supplied.
 */
@Getter
public class SingletonExpectedException extends PathTableException {

    private final String path;
    private final int count;

    public SingletonExpectedException(String path, int count) {
        super("Expected exactly one record for '" + path + "', got " + count);
        this.path = path;
        this.count = count;
    }
}
