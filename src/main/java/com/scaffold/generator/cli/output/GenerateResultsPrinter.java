package com.scaffold.generator.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.model.ValidatedGenerateOptions;
import com.scaffold.generator.codegen.GenerationResult;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ProjectConfig config, ValidatedGenerateOptions v, int entityCount) {
        log.info("=================================================");
        log.info("Entity Scaffold Generator");
        log.info("=================================================");
        log.info("Project Name: {}", config.getProjectName());
        log.info("Project File: {}", v.getConfigFile().toAbsolutePath());
        log.info("Stack: {}/{}", config.getCategory(), config.getStack());
        log.info("Entities: {}", entityCount);
        log.info("Override Templates: {}", v.getOverrideRoot() != null ? v.getOverrideRoot().toAbsolutePath() : "None");
        log.info("Core Templates: {}", v.getCoreRoot() != null ? v.getCoreRoot().toAbsolutePath() : "Bundled");
        log.info("Protected Regions: {}", config.isPreserveProtectedRegions() ? "preserved" : "overwritten");
        log.info("Parallelism: {}", config.getParallelism());
        log.info("Output Directory: {}", config.getOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(GenerationResult result) {
        Path outputPath = result.getOutputPath();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", outputPath.toAbsolutePath());
        log.info("Files Written: {}", result.getFileCount());
        log.info("Time: {} ms", result.getGenerationTimeMillis());

        log.info("");
        log.info("Components:");
        for (Map.Entry<String, List<Path>> entry : result.getWrittenFiles().entrySet()) {
            log.info("  {} ({} file(s))", entry.getKey(), entry.getValue().size());
            for (Path file : entry.getValue()) {
                log.info("    {}", outputPath.relativize(file));
            }
        }

        if (!result.getSkippedComponents().isEmpty()) {
            log.info("");
            log.info("Skipped Components: {}", String.join(", ", result.getSkippedComponents()));
        }
        printWarnings(result.getWarnings());
        log.info("=================================================");
    }

    public void printFailure(String message) {
        log.error("Generation failed: {}", message);
    }

    public void printErrors(String heading, List<String> errors) {
        log.error(heading);
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    private void printWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        log.info("");
        log.warn("Warnings:");
        for (String warning : warnings) {
            log.warn("  - {}", warning);
        }
    }
}
