package com.apidoc.generator.docgen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a documentation generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int itemsLoaded;
    private int referencesLoaded;
    private int caseCollisions;
    private int overwritesApplied;
    private int overwritesSkipped;
    private int documentsWritten;

    @Builder.Default
    private List<String> warnings = List.of();

    @Builder.Default
    private List<String> infos = List.of();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
