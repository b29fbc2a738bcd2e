package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when a row handed to a write lacks a key field needed to build the path of
 * the file it belongs to.
 */
@Getter
public class IncompleteKeyException extends PathTableException {

    private final String source;
    private final String key;

    public IncompleteKeyException(String source, String key, int rowIndex) {
        super("Row #" + rowIndex + " lacks key '" + key + "' required by source '" + source + "'");
        this.source = source;
        this.key = key;
    }
}
