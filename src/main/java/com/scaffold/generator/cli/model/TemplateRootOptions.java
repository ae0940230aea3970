package com.scaffold.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Template root options shared by every command that reads templates.
 */
@Getter
public class TemplateRootOptions {

	@Option(names = { "--templates",
			"-t" }, description = "Override template root; templates here win over the built-in ones")
	private Path overrideRoot;

	@Option(names = { "--core-templates" }, description = "Core template root (defaults to the bundled templates)")
	private Path coreRoot;
}
