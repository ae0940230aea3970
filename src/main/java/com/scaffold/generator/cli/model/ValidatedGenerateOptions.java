package com.scaffold.generator.cli.model;

import java.nio.file.Path;

import lombok.Value;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Value
public class ValidatedGenerateOptions {
	Path configFile;
	Path outputDir;
	String stackOverride;
	Path overrideRoot;
	Path coreRoot;
	boolean preserveProtectedRegions;
	int parallelism;
}
