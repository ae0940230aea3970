package com.scaffold.generator.cli;

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.model.TemplateRootOptions;
import com.scaffold.generator.codegen.exception.GenerationException;
import com.scaffold.generator.codegen.template.TemplateInfo;
import com.scaffold.generator.codegen.template.TemplateResolver;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Prints the templates discovered across the override and core roots.
 */
@Command(
        name = "list-templates",
        mixinStandardHelpOptions = true,
        description = "Lists the available templates and where each one comes from."
)
public class ListTemplatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListTemplatesCommand.class);

    @Mixin
    private TemplateRootOptions templateRoots = new TemplateRootOptions();

    @Option(names = {"--category"}, description = "Only list this category")
    private String category;

    @Option(names = {"--stack", "-s"}, description = "Only list this stack")
    private String stack;

    @Override
    public Integer call() {
        try {
            TemplateResolver resolver = new TemplateResolver(templateRoots.getOverrideRoot(),
                    GenerateCommand.coreRoot(templateRoots.getCoreRoot()));
            SortedMap<String, SortedMap<String, SortedSet<String>>> templates =
                    resolver.listAvailableTemplates(category, stack);

            if (templates.isEmpty()) {
                log.warn("No templates found");
                return 0;
            }
            for (Map.Entry<String, SortedMap<String, SortedSet<String>>> byCategory : templates.entrySet()) {
                for (Map.Entry<String, SortedSet<String>> byStack : byCategory.getValue().entrySet()) {
                    log.info("{}/{}:", byCategory.getKey(), byStack.getKey());
                    for (String component : byStack.getValue()) {
                        String source = resolver.describe(byCategory.getKey(), byStack.getKey(), component)
                                .map(TemplateInfo::getSource)
                                .map(s -> s.name().toLowerCase())
                                .orElse("?");
                        log.info("  {} ({})", component, source);
                    }
                }
            }
            return 0;
        } catch (GenerationException e) {
            log.error("Cannot list templates: {}", e.getMessage());
            return 1;
        }
    }
}
