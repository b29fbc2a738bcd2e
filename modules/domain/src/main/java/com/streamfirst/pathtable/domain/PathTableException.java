package com.streamfirst.pathtable.domain;

/**
 * Base class of every failure raised by the path table core and its adapters.
 * Unchecked, like the storage and catalog failures of the ports it sits behind.
 */
public class PathTableException extends RuntimeException {

    public PathTableException(String message) {
        super(message);
    }

    public PathTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
