package com.apidoc.generator;

import com.apidoc.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the API reference Markdown generator.
 * Reads API metadata YAML and writes a cross-linked tree of Markdown documents.
 */
public class ApiDocGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
