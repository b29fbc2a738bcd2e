package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when a path template cannot be compiled: unbalanced braces, a repeated or
 * invalid placeholder name, or an unknown type annotation.
 */
@Getter
public class TemplateException extends PathTableException {

    private final String template;

    public TemplateException(String template, String reason) {
        super("Invalid path template '" + template + "': " + reason);
        this.template = template;
    }
}
