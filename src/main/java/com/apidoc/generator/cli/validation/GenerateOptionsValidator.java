package com.apidoc.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.apidoc.generator.cli.exception.OptionsValidationException;
import com.apidoc.generator.cli.model.GenerateOptions;
import com.apidoc.generator.cli.model.ValidatedGenerateOptions;
import com.apidoc.generator.store.MetadataLoader;
import com.apidoc.generator.util.FileWriteUtil;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputDir = normalize(o.getInputDir());
		if (inputDir == null) {
			errors.add("Input directory is required (--input-dir / -i).");
		} else if (!existsDirectory(inputDir)) {
			errors.add("Input directory does not exist or is not a directory: " + inputDir);
		} else if (!Files.isRegularFile(inputDir.resolve(MetadataLoader.TOC_FILE_NAME))) {
			errors.add("Input directory has no " + MetadataLoader.TOC_FILE_NAME + ": " + inputDir);
		}

		Path overwriteDir = normalize(o.getOverwriteDir());
		if (overwriteDir != null && !existsDirectory(overwriteDir)) {
			errors.add("Overwrite directory does not exist or is not a directory: " + overwriteDir);
		}

		Path authoritiesFile = normalize(o.getAuthoritiesFile());
		if (authoritiesFile != null && !Files.isRegularFile(authoritiesFile)) {
			errors.add("Authorities file does not exist: " + authoritiesFile);
		}

		String linkPrefix = o.getLinkPrefix() == null ? "" : o.getLinkPrefix().trim();
		if (linkPrefix.contains(" ")) {
			errors.add("Link prefix must not contain spaces. Got: '" + linkPrefix + "'");
		}

		Path outputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath().normalize();
		if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists and is not a directory: " + outputDir);
		} else if (!o.isForce() && !isEmpty(outputDir, errors)) {
			errors.add("Output directory is not empty: " + outputDir + ". Use --force to clear it.");
		}

		if (inputDir != null && inputDir.equals(outputDir)) {
			errors.add("Output directory must differ from the input directory: " + outputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(inputDir, outputDir, overwriteDir, authoritiesFile, linkPrefix);
	}

	private static Path normalize(Path p) {
		return p == null ? null : p.toAbsolutePath().normalize();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isEmpty(Path directory, List<String> errors) {
		try {
			return FileWriteUtil.isEmptyDirectory(directory);
		} catch (IOException e) {
			errors.add("Cannot list output directory " + directory + ": " + e.getMessage());
			return true;
		}
	}
}
