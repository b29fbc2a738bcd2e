package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when file content cannot be decoded into records, or records cannot be encoded.
 */
@Getter
public class CodecException extends PathTableException {

    private final String path;

    public CodecException(String path, String message) {
        super(message);
        this.path = path;
    }

    public CodecException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
