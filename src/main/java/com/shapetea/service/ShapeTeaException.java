package com.shapetea.service;

import com.shapetea.ir.CodeSource;

/**
 * Host misuse: malformed IR, bad configuration, invalid arguments. Analysis findings are never
 * reported through this type; they end up as failed or stopped paths.
 */
public class ShapeTeaException extends RuntimeException {

    private final CodeSource source;

    public ShapeTeaException(String message) {
        this(message, null, null);
    }

    public ShapeTeaException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ShapeTeaException(String message, CodeSource source) {
        this(message, source, null);
    }

    public ShapeTeaException(String message, CodeSource source, Throwable cause) {
        super(source == null ? message : message + " - " + source, cause);
        this.source = source;
    }

    /** Offending node, if known. */
    public CodeSource getSource() {
        return source;
    }
}
