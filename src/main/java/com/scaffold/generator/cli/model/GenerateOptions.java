package com.scaffold.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--config", "-c" }, required = true, description = "Project file (YAML)")
	private Path configFile;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--stack", "-s" }, description = "Stack to generate, overriding the project file")
	private String stack;

	@Mixin
	private TemplateRootOptions templateRoots = new TemplateRootOptions();

	@Option(names = { "--no-protect" }, description = "Overwrite files without keeping their protected regions")
	private boolean noProtect;

	@Option(names = { "--parallelism",
			"-j" }, defaultValue = "1", description = "Number of files rendered concurrently (default: 1)")
	private int parallelism;
}
