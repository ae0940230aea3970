package com.scaffold.generator.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.exception.OptionsValidationException;
import com.scaffold.generator.cli.model.GenerateOptions;
import com.scaffold.generator.cli.model.ValidatedGenerateOptions;
import com.scaffold.generator.cli.output.GenerateResultsPrinter;
import com.scaffold.generator.cli.validation.GenerateOptionsValidator;
import com.scaffold.generator.codegen.GenerationResult;
import com.scaffold.generator.codegen.ProjectGenerator;
import com.scaffold.generator.codegen.exception.GenerationException;
import com.scaffold.generator.codegen.exception.ValidationException;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.template.BundledTemplates;
import com.scaffold.generator.codegen.template.TemplateResolver;
import com.scaffold.generator.config.ProjectDefinition;
import com.scaffold.generator.config.ProjectFileLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating a backend project from a project file.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Generates backend source files for the entities in a project file."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            ProjectDefinition project = new ProjectFileLoader().load(validated.getConfigFile());

            ProjectConfig.ProjectConfigBuilder config = project.toProjectConfig(validated.getOutputDir())
                    .preserveProtectedRegions(validated.isPreserveProtectedRegions())
                    .parallelism(validated.getParallelism());
            if (validated.getStackOverride() != null) {
                config.stack(validated.getStackOverride());
            }
            ProjectConfig projectConfig = config.build();
            printer.printBanner(projectConfig, validated, project.getEntityRecords().size());

            TemplateResolver resolver = new TemplateResolver(validated.getOverrideRoot(), coreRoot(validated.getCoreRoot()));
            GenerationResult result = new ProjectGenerator(resolver).generate(project.entityInput(), projectConfig);

            if (!result.isSuccess()) {
                printer.printFailure("no files were written for stack '" + result.getStack() + "'");
                return 1;
            }
            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printErrors("Invalid options:", e.getErrors());
            return 1;
        } catch (ValidationException e) {
            printer.printErrors("Invalid entity definitions:", e.getErrors());
            return 1;
        } catch (GenerationException e) {
            printer.printFailure(e.getMessage());
            log.debug("Generation failure", e);
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    static Path coreRoot(Path configured) {
        return configured != null ? configured : BundledTemplates.coreRoot();
    }
}
