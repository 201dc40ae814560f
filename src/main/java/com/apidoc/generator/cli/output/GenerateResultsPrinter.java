package com.apidoc.generator.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.cli.model.GenerateOptions;
import com.apidoc.generator.cli.model.ValidatedGenerateOptions;
import com.apidoc.generator.docgen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("API Reference Markdown Generator");
        log.info("=================================================");
        log.info("Input Directory: {}", v.getNormalizedInputDir());
        log.info("Overwrite Directory: {}", v.getNormalizedOverwriteDir() != null ? v.getNormalizedOverwriteDir() : "None");
        log.info("Authorities: {}", v.getNormalizedAuthoritiesFile() != null ? v.getNormalizedAuthoritiesFile() : "Bundled");
        log.info("Link Prefix: {}", v.getLinkPrefix());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        if (o.isForce()) {
            log.info("Force: existing output will be cleared");
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Items Loaded: {}", result.getItemsLoaded());
        log.info("References Loaded: {}", result.getReferencesLoaded());
        log.info("Case-Colliding Items: {}", result.getCaseCollisions());
        log.info("Overwrites Applied: {}", result.getOverwritesApplied());
        if (result.getOverwritesSkipped() > 0) {
            log.info("Overwrites Skipped: {}", result.getOverwritesSkipped());
        }
        log.info("Documents Written: {}", result.getDocumentsWritten());

        result.getInfos().forEach(i -> log.info("Note: {}", i));

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.warn("{} warning(s):", result.getWarnings().size());
            result.getWarnings().forEach(w -> log.warn("  {}", w));
        }

        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  {}", e));
    }
}
