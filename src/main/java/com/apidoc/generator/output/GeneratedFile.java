package com.apidoc.generator.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Represents a generated document (output path + contents).
 *
 * Pure structure only. The path is relative to the output directory and has
 * no file extension.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    public static final String EXTENSION = ".md";

    @NonNull
    String path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;
}
