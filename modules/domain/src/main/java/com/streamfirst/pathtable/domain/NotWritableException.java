package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised on a write or delete against a source configured read-only.
 */
@Getter
public class NotWritableException extends PathTableException {

    private final String source;

    public NotWritableException(String source) {
        super("Source '" + source + "' is read-only");
        this.source = source;
    }
}
