package com.apidoc.generator.exception;

/**
 * A document template failed to render.
 */
public class RenderException extends ApiDocException {

    private static final long serialVersionUID = 1L;

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
