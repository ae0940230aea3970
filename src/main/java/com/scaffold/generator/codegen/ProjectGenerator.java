package com.scaffold.generator.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.context.ContextBuilder;
import com.scaffold.generator.codegen.model.context.RenderContext;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.model.input.EntityInput;
import com.scaffold.generator.codegen.region.ProtectedRegionMerger;
import com.scaffold.generator.codegen.stack.StackDescriptor;
import com.scaffold.generator.codegen.stack.StackDescriptors;
import com.scaffold.generator.codegen.template.TemplateResolver;

/**
 * Entry point tying the pipeline together: entity input in, generated project out.
 */
public class ProjectGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProjectGenerator.class);

    private final TemplateResolver resolver;
    private final GenerationOrchestrator orchestrator;

    public ProjectGenerator(TemplateResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.orchestrator = new GenerationOrchestrator(resolver, new ProtectedRegionMerger());
    }

    /**
     * Builds the render context for the stack, including the stack's own template variables.
     */
    public RenderContext buildContext(EntityInput input, String stack) {
        StackDescriptor descriptor = StackDescriptors.forStack(stack);
        return new ContextBuilder(descriptor.getContextExtension()).buildContext(input);
    }

    public GenerationResult generate(EntityInput input, ProjectConfig config) {
        log.info("Building render context...");
        RenderContext context = buildContext(input, config.getStack());
        return orchestrator.generate(context, config);
    }

    /**
     * Checks everything a generation run would check before writing, without writing.
     *
     * @return every problem found; empty when generation can proceed
     */
    public List<String> validate(EntityInput input, ProjectConfig config) {
        StackDescriptor descriptor = StackDescriptors.forStack(config.getStack());
        List<String> errors = new ArrayList<>(new ContextBuilder(descriptor.getContextExtension()).validateAll(input));
        if (errors.isEmpty() && input.normalize().isEmpty()) {
            errors.add("No entities defined.");
        }

        boolean discovered = !resolver.listComponents(config.getCategory(), config.getStack()).isEmpty();
        if (!discovered) {
            boolean anyFallback = descriptor.getFallbackComponents().stream()
                    .anyMatch(component -> resolver.describe(config.getCategory(), config.getStack(), component)
                            .isPresent());
            if (!anyFallback) {
                errors.add("No templates found for stack '" + config.getCategory() + "/" + config.getStack() + "'.");
            }
        }
        return errors;
    }
}
