package com.apidoc.generator.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedInputDir;
    Path normalizedOutputDir;
    Path normalizedOverwriteDir;
    Path normalizedAuthoritiesFile;
    String linkPrefix;
}
