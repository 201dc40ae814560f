package com.apidoc.generator.exception;

/**
 * An overwrite document parsed cleanly but does not name the item it
 * supplements.
 */
public class OverwriteValidationException extends ApiDocException {

    private static final long serialVersionUID = 1L;

    public OverwriteValidationException(String message) {
        super(message);
    }
}
