package com.streamfirst.pathtable.domain;

/**
 * Raised when composed sources cannot be joined: no shared placeholder, or a
 * placeholder name that collides between sources without being shared by all of them.
 */
public class JoinKeyException extends PathTableException {

    public JoinKeyException(String message) {
        super(message);
    }
}
