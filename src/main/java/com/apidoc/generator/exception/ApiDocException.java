package com.apidoc.generator.exception;

/**
 * Base class for failures that abort a generation run.
 */
public class ApiDocException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ApiDocException(String message) {
        super(message);
    }

    public ApiDocException(String message, Throwable cause) {
        super(message, cause);
    }
}
