package com.apidoc.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.cli.exception.OptionsValidationException;
import com.apidoc.generator.cli.model.GenerateOptions;
import com.apidoc.generator.cli.model.ValidatedGenerateOptions;
import com.apidoc.generator.cli.output.GenerateResultsPrinter;
import com.apidoc.generator.cli.validation.GenerateOptionsValidator;
import com.apidoc.generator.docgen.DocumentationGenerator;
import com.apidoc.generator.docgen.GeneratorConfig;
import com.apidoc.generator.docgen.GeneratorResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that converts API metadata YAML into Markdown reference documents.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "apidoc-markdown-generator 1.0.0",
        description = "Generates cross-linked Markdown API reference documents from API metadata YAML."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .inputDir(validated.getNormalizedInputDir())
                .outputDir(validated.getNormalizedOutputDir())
                .overwriteDir(validated.getNormalizedOverwriteDir())
                .authoritiesFile(validated.getNormalizedAuthoritiesFile())
                .linkPrefix(validated.getLinkPrefix())
                .force(options.isForce())
                .build();

        try {
            GeneratorResult result = new DocumentationGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(validated, result);
            return 0;
        } catch (RuntimeException e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
