package com.scaffold.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.scaffold.generator.cli.exception.OptionsValidationException;
import com.scaffold.generator.cli.model.GenerateOptions;
import com.scaffold.generator.cli.model.TemplateRootOptions;
import com.scaffold.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getConfigFile() == null) {
			errors.add("Project file is required (--config / -c).");
		} else if (!Files.isRegularFile(o.getConfigFile())) {
			errors.add("Project file does not exist or is not a file: " + o.getConfigFile());
		}

		if (o.getStack() != null && o.getStack().isBlank()) {
			errors.add("Stack must not be blank when --stack is given.");
		}

		validateTemplateRoots(o.getTemplateRoots(), errors);

		if (o.getParallelism() < 1) {
			errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
		}

		Path outputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath().normalize();
		if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
			errors.add("Output path exists and is not a directory: " + outputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(o.getConfigFile(), outputDir,
				o.getStack() == null ? null : o.getStack().trim(), o.getTemplateRoots().getOverrideRoot(),
				o.getTemplateRoots().getCoreRoot(), !o.isNoProtect(), o.getParallelism());
	}

	/**
	 * Adds an error for each given template root that is not a directory.
	 */
	public void validateTemplateRoots(TemplateRootOptions roots, List<String> errors) {
		if (roots.getOverrideRoot() != null && !existsDirectory(roots.getOverrideRoot())) {
			errors.add("Template directory does not exist or is not a directory: " + roots.getOverrideRoot());
		}
		if (roots.getCoreRoot() != null && !existsDirectory(roots.getCoreRoot())) {
			errors.add("Core template directory does not exist or is not a directory: " + roots.getCoreRoot());
		}
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
