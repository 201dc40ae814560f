package com.apidoc.generator.cli.model;

import java.nio.file.Path;

import com.apidoc.generator.core.context.ResolutionContext;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input-dir", "-i" }, required = true, description = "Directory containing toc.yml and the per-item metadata files")
	private Path inputDir;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--overwrite-dir", "-w" }, description = "Directory of overwrite files to merge into the metadata")
	private Path overwriteDir;

	@Option(names = { "--authorities" }, description = "YAML file of external documentation authorities (defaults to the bundled table)")
	private Path authoritiesFile;

	@Option(names = { "--link-prefix" }, defaultValue = ResolutionContext.DEFAULT_LINK_PREFIX, description = "Prefix for links between generated documents (default: ${DEFAULT-VALUE})")
	private String linkPrefix;

	@Option(names = { "--force", "-f" }, description = "Clear a non-empty output directory before writing")
	private boolean force;

}
