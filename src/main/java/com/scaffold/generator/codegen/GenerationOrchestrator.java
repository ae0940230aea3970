package com.scaffold.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.exception.ConfigurationException;
import com.scaffold.generator.codegen.exception.GenerationException;
import com.scaffold.generator.codegen.exception.GenerationIoException;
import com.scaffold.generator.codegen.exception.TemplateNotFoundException;
import com.scaffold.generator.codegen.model.context.EntityContext;
import com.scaffold.generator.codegen.model.context.RenderContext;
import com.scaffold.generator.codegen.model.core.context.GenerationDiagnostics;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.model.output.PlannedOutput;
import com.scaffold.generator.codegen.region.ProtectedRegionMerger;
import com.scaffold.generator.codegen.stack.ComponentLayout;
import com.scaffold.generator.codegen.stack.OutputScope;
import com.scaffold.generator.codegen.stack.StackDescriptor;
import com.scaffold.generator.codegen.stack.StackDescriptors;
import com.scaffold.generator.codegen.template.TemplateResolver;
import com.scaffold.generator.codegen.util.FileWriteUtil;

/**
 * Drives one generation run for the configured stack: picks the components, plans one
 * output per single-file component and one per entity for per-entity components, then
 * renders, merges protected regions and writes each file.
 *
 * <p>Fatal errors stop the run where they happen. Files written before the failure are
 * left in place.
 */
public class GenerationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final TemplateResolver resolver;
    private final ProtectedRegionMerger merger;

    public GenerationOrchestrator(TemplateResolver resolver) {
        this(resolver, new ProtectedRegionMerger());
    }

    public GenerationOrchestrator(TemplateResolver resolver, ProtectedRegionMerger merger) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.merger = Objects.requireNonNull(merger, "merger");
    }

    /**
     * Generate every output of the configured stack.
     *
     * @throws ConfigurationException when there are no entities or no components to generate
     * @throws TemplateNotFoundException when a single-file component has no template
     * @throws GenerationException for syntax, render and write failures
     */
    public GenerationResult generate(RenderContext context, ProjectConfig config) {
        long startedAt = System.currentTimeMillis();
        if (context.getEntityCount() == 0) {
            throw new ConfigurationException("No entities defined. Add entities to the configuration before generating code.");
        }

        StackDescriptor descriptor = StackDescriptors.forStack(config.getStack());
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();
        log.info("Starting generation of stack '{}' into {}", config.getStack(), config.getOutputDir());

        log.info("Step 1: Selecting components...");
        List<String> components = selectComponents(config, descriptor, diagnostics);

        log.info("Step 2: Planning outputs...");
        List<String> skipped = new ArrayList<>();
        List<PlannedOutput> plan = planOutputs(context, config, descriptor, components, skipped, diagnostics);

        log.info("Step 3: Preparing output directory...");
        prepareOutputDirectory(config, descriptor, plan);

        log.info("Step 4: Rendering {} file(s)...", plan.size());
        Map<String, Object> baseModel = baseModel(context, config);
        List<Path> written = execute(plan, baseModel, config, diagnostics);

        Map<String, List<Path>> byComponent = new LinkedHashMap<>();
        for (int i = 0; i < plan.size(); i++) {
            byComponent.computeIfAbsent(plan.get(i).getComponent(), c -> new ArrayList<>()).add(written.get(i));
        }

        GenerationResult.GenerationResultBuilder result = GenerationResult.builder()
                .stack(config.getStack())
                .outputPath(config.getOutputDir())
                .skippedComponents(skipped)
                .warnings(diagnostics.getWarnings());
        byComponent.forEach((component, paths) -> result.writtenFile(component, List.copyOf(paths)));
        result.generationTimeMillis(System.currentTimeMillis() - startedAt);

        GenerationResult built = result.build();
        if (built.getFileCount() == 0) {
            log.warn("Generation of stack '{}' wrote no files", config.getStack());
        } else {
            log.info("Generation complete: {} file(s) written, {} component(s) skipped",
                    built.getFileCount(), skipped.size());
        }
        return built;
    }

    private List<String> selectComponents(ProjectConfig config, StackDescriptor descriptor,
                                          GenerationDiagnostics diagnostics) {
        SortedSet<String> discovered = resolver.listComponents(config.getCategory(), config.getStack());
        if (!discovered.isEmpty()) {
            log.debug("Discovered components for {}/{}: {}", config.getCategory(), config.getStack(), discovered);
            return List.copyOf(discovered);
        }

        List<String> fallback = descriptor.getFallbackComponents();
        if (fallback.isEmpty()) {
            throw new ConfigurationException("No templates found for stack '" + config.getStack()
                    + "' and no default components are known for it.");
        }
        String message = "No templates discovered for " + config.getCategory() + "/" + config.getStack()
                + "; falling back to default components " + fallback;
        log.warn(message);
        diagnostics.warn(message);
        return fallback;
    }

    private List<PlannedOutput> planOutputs(RenderContext context, ProjectConfig config, StackDescriptor descriptor,
                                            List<String> components, List<String> skipped,
                                            GenerationDiagnostics diagnostics) {
        List<PlannedOutput> plan = new ArrayList<>();
        for (String component : components) {
            Optional<ComponentLayout> layout = descriptor.layoutFor(component);
            if (layout.isEmpty()) {
                skip(component, "no output layout is defined for it in stack '" + descriptor.getName() + "'",
                        skipped, diagnostics);
                continue;
            }

            if (layout.get().getScope() == OutputScope.SINGLE_FILE) {
                Path template = resolveRequired(config, component);
                plan.add(PlannedOutput.builder()
                        .component(component)
                        .templatePath(template)
                        .destination(config.getOutputDir().resolve(layout.get().relativePath(null)))
                        .build());
                continue;
            }

            Optional<Path> template = resolver.describe(config.getCategory(), config.getStack(), component)
                    .map(info -> info.getPath());
            if (template.isEmpty()) {
                skip(component, "template not found", skipped, diagnostics);
                continue;
            }
            for (EntityContext entity : context.getEntities()) {
                plan.add(PlannedOutput.builder()
                        .component(component)
                        .entity(entity)
                        .templatePath(template.get())
                        .destination(config.getOutputDir()
                                .resolve(layout.get().relativePath(entity.getNames().getSnake())))
                        .build());
            }
        }
        return plan;
    }

    private Path resolveRequired(ProjectConfig config, String component) {
        try {
            return resolver.resolve(config.getCategory(), config.getStack(), component);
        } catch (TemplateNotFoundException e) {
            log.error("Required component '{}' has no template: {}", component, e.getMessage());
            throw e;
        }
    }

    private static void skip(String component, String reason, List<String> skipped, GenerationDiagnostics diagnostics) {
        String message = "Skipping " + component + " (" + reason + ")";
        log.warn(message);
        diagnostics.warn(message);
        skipped.add(component);
    }

    private static void prepareOutputDirectory(ProjectConfig config, StackDescriptor descriptor,
                                               List<PlannedOutput> plan) {
        Path outputDir = config.getOutputDir();
        try {
            FileWriteUtil.createDirectories(outputDir);
        } catch (IOException e) {
            throw new GenerationIoException(outputDir, e);
        }

        for (String marker : descriptor.getPackageMarkers()) {
            Path markerPath = outputDir.resolve(marker);
            Path markerDir = markerPath.getParent();
            boolean used = plan.stream().anyMatch(out -> out.getDestination().startsWith(markerDir));
            if (!used) {
                continue;
            }
            try {
                if (FileWriteUtil.createIfAbsent(markerPath)) {
                    log.debug("Created package marker {}", markerPath);
                }
            } catch (IOException e) {
                throw new GenerationIoException(markerPath, e);
            }
        }
    }

    private static Map<String, Object> baseModel(RenderContext context, ProjectConfig config) {
        Map<String, Object> model = context.toTemplateModel();
        model.put("project", Collections.unmodifiableMap(config.projectModel()));

        Map<String, Object> stack = new LinkedHashMap<>();
        stack.put("name", config.getStack());
        stack.put("category", config.getCategory());
        model.put("stack", Collections.unmodifiableMap(stack));

        model.put("settings", config.getSettings());
        Object databaseUrl = config.getSettings().get("database_url");
        if (databaseUrl != null) {
            model.put("database_url", databaseUrl);
        }
        return Collections.unmodifiableMap(model);
    }

    private List<Path> execute(List<PlannedOutput> plan, Map<String, Object> baseModel, ProjectConfig config,
                               GenerationDiagnostics diagnostics) {
        int workers = Math.min(config.getParallelism(), plan.size());
        if (workers <= 1) {
            List<Path> written = new ArrayList<>(plan.size());
            for (PlannedOutput output : plan) {
                written.add(produce(output, baseModel, config, diagnostics));
            }
            return written;
        }

        log.debug("Rendering with {} workers", workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        AtomicBoolean aborted = new AtomicBoolean(false);
        try {
            List<Future<Path>> futures = new ArrayList<>(plan.size());
            for (PlannedOutput output : plan) {
                futures.add(executor.submit(() -> {
                    if (aborted.get()) {
                        return null;
                    }
                    try {
                        return produce(output, baseModel, config, diagnostics);
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                }));
            }
            return collect(futures, aborted);
        } finally {
            executor.shutdown();
        }
    }

    private static List<Path> collect(Collection<Future<Path>> futures, AtomicBoolean aborted) {
        List<Path> written = new ArrayList<>(futures.size());
        GenerationException failure = null;
        for (Future<Path> future : futures) {
            try {
                Path path = future.get();
                if (path != null) {
                    written.add(path);
                }
            } catch (ExecutionException e) {
                if (failure == null) {
                    Throwable cause = e.getCause();
                    failure = cause instanceof GenerationException
                            ? (GenerationException) cause
                            : new GenerationException("Generation failed: " + cause.getMessage(), cause);
                }
            } catch (InterruptedException e) {
                aborted.set(true);
                Thread.currentThread().interrupt();
                throw new GenerationException("Generation interrupted", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return written;
    }

    private Path produce(PlannedOutput output, Map<String, Object> baseModel, ProjectConfig config,
                         GenerationDiagnostics diagnostics) {
        Map<String, Object> model = baseModel;
        if (output.getEntity().isPresent()) {
            Map<String, Object> entityModel = new HashMap<>(baseModel);
            entityModel.put("entity", output.getEntity().get().toTemplateModel());
            model = entityModel;
        }

        String rendered = resolver.render(output.getTemplatePath(), model);
        Path destination = output.getDestination();
        String content = config.isPreserveProtectedRegions()
                ? merger.preserveAcrossRegeneration(destination, rendered, diagnostics)
                : rendered;

        try {
            FileWriteUtil.safeWriteString(destination, content);
        } catch (IOException e) {
            throw new GenerationIoException(destination, e);
        }
        log.debug("Wrote {} ({})", destination, output.getComponent());
        return destination;
    }
}
