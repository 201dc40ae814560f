package com.apidoc.generator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

/**
 * Unit tests for GenerateCommand exit codes.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return new CommandLine(new GenerateCommand()).execute(args);
    }

    @Test
    void testSuccessfulRunReturnsZero() throws IOException {
        Path input = Files.createDirectories(tempDir.resolve("yaml"));
        Files.writeString(input.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");
        Files.writeString(input.resolve("Ns.yml"), "items:\n- uid: Ns\n  type: Namespace\n  name: Ns\n");
        Path output = tempDir.resolve("out");

        int exitCode = run("-i", input.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("Ns/_index.md")).exists();
        assertThat(output.resolve("_index.md")).exists();
    }

    @Test
    void testInvalidOptionsReturnOne() {
        int exitCode = run("-i", tempDir.resolve("missing").toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testGenerationFailureReturnsOne() throws IOException {
        Path input = Files.createDirectories(tempDir.resolve("yaml"));
        Files.writeString(input.resolve("toc.yml"), "- uid: Ns\n  name: Ns\n");

        int exitCode = run("-i", input.toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
