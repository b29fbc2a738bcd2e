package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when a path is built from a binding that lacks one of the template placeholders.
 */
@Getter
public class MissingKeyException extends PathTableException {

    private final String template;
    private final String placeholder;

    public MissingKeyException(String template, String placeholder) {
        super("No value bound for placeholder '" + placeholder + "' of template '" + template + "'");
        this.template = template;
        this.placeholder = placeholder;
    }
}
