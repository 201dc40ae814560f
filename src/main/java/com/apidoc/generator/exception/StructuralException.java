package com.apidoc.generator.exception;

/**
 * The input metadata is missing or shaped in a way the output tree cannot
 * represent.
 */
public class StructuralException extends ApiDocException {

    private static final long serialVersionUID = 1L;

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
