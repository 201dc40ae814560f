package com.apidoc.generator.docgen;

import java.nio.file.Path;

import com.apidoc.generator.core.context.ResolutionContext;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the documentation generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Directory containing toc.yml and the per-UID metadata files.
     */
    private Path inputDir;

    /**
     * Directory the Markdown tree is written to.
     */
    private Path outputDir;

    /**
     * Optional directory of overwrite files.
     */
    private Path overwriteDir;

    /**
     * Optional authority table; the bundled one is used when absent.
     */
    private Path authoritiesFile;

    /**
     * Prefix of links between generated documents.
     */
    @Builder.Default
    private String linkPrefix = ResolutionContext.DEFAULT_LINK_PREFIX;

    /**
     * Whether to clear a non-empty output directory first.
     */
    private boolean force;
}
