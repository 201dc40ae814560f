package com.apidoc.generator.exception;

/**
 * An overwrite document has a malformed header.
 */
public class OverwriteFormatException extends StructuralException {

    private static final long serialVersionUID = 1L;

    public OverwriteFormatException(String message) {
        super(message);
    }

    public OverwriteFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
