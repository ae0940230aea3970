package com.scaffold.generator.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.model.TemplateRootOptions;
import com.scaffold.generator.cli.output.GenerateResultsPrinter;
import com.scaffold.generator.cli.validation.GenerateOptionsValidator;
import com.scaffold.generator.codegen.ProjectGenerator;
import com.scaffold.generator.codegen.exception.GenerationException;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.template.TemplateResolver;
import com.scaffold.generator.config.ProjectDefinition;
import com.scaffold.generator.config.ProjectFileLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Checks a project file and the template roots without writing anything.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Validates a project file's entities and checks that templates exist for its stack."
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"--config", "-c"}, required = true, description = "Project file (YAML)")
    private Path configFile;

    @Option(names = {"--stack", "-s"}, description = "Stack to check, overriding the project file")
    private String stack;

    @Mixin
    private TemplateRootOptions templateRoots = new TemplateRootOptions();

    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        List<String> optionErrors = new ArrayList<>();
        new GenerateOptionsValidator().validateTemplateRoots(templateRoots, optionErrors);
        if (!optionErrors.isEmpty()) {
            printer.printErrors("Invalid options:", optionErrors);
            return 1;
        }

        try {
            ProjectDefinition project = new ProjectFileLoader().load(configFile);
            ProjectConfig.ProjectConfigBuilder builder = project.toProjectConfig(Path.of("."));
            if (stack != null && !stack.isBlank()) {
                builder.stack(stack.trim());
            }
            ProjectConfig config = builder.build();

            TemplateResolver resolver = new TemplateResolver(templateRoots.getOverrideRoot(),
                    GenerateCommand.coreRoot(templateRoots.getCoreRoot()));
            List<String> errors = new ProjectGenerator(resolver).validate(project.entityInput(), config);
            if (!errors.isEmpty()) {
                printer.printErrors("Project file " + configFile + " is invalid:", errors);
                return 1;
            }

            log.info("Project '{}' is valid: {} entities, stack {}/{}", config.getProjectName(),
                    project.getEntityRecords().size(), config.getCategory(), config.getStack());
            return 0;
        } catch (GenerationException e) {
            printer.printFailure(e.getMessage());
            return 1;
        }
    }
}
