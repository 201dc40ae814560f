package com.apidoc.generator.exception;

/**
 * Two documents resolved to the same output path, compared case-insensitively.
 */
public class PathCollisionException extends StructuralException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public PathCollisionException(String path) {
        super(path + " has already been written to");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
