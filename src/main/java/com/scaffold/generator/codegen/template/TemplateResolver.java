package com.scaffold.generator.codegen.template;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.exception.GenerationIoException;
import com.scaffold.generator.codegen.exception.TemplateNotFoundException;
import com.scaffold.generator.codegen.exception.TemplateRenderException;
import com.scaffold.generator.codegen.exception.TemplateSyntaxException;

import freemarker.core.ParseException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Finds and renders templates across two roots: an override root whose files always
 * win, and a core root holding the built-in templates.
 *
 * <p>The {@link TemplateIndex} is built once in the constructor and never changes
 * afterwards. Rendering only reads the model it is given, so one resolver can serve
 * many threads at once.
 */
public class TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    private final Path overrideRoot;
    private final Path coreRoot;
    private final TemplateIndex index;
    private final Configuration freemarkerConfig;

    public TemplateResolver(Path overrideRoot, Path coreRoot) {
        this(overrideRoot, coreRoot, new TemplateDiscoveryService());
    }

    public TemplateResolver(Path overrideRoot, Path coreRoot, TemplateDiscoveryService discoveryService) {
        this.overrideRoot = overrideRoot;
        this.coreRoot = coreRoot;
        this.index = TemplateIndex.merge(
                discoveryService.discover(coreRoot, TemplateSource.CORE),
                discoveryService.discover(overrideRoot, TemplateSource.OVERRIDE));
        this.freemarkerConfig = createFreemarkerConfig();
        log.debug("Template index holds {} triplets (override root: {}, core root: {})",
                index.size(), overrideRoot, coreRoot);
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setFallbackOnNullLoopVariable(false);
        cfg.setBooleanFormat("c");
        cfg.setNumberFormat("computer");
        return cfg;
    }

    public TemplateIndex getIndex() {
        return index;
    }

    /**
     * Returns the template file for the triplet, checking the override root before the core root.
     *
     * @throws TemplateNotFoundException when neither root has the file
     */
    public Path resolve(String category, String stack, String component) {
        return describe(category, stack, component)
                .map(TemplateInfo::getPath)
                .orElseThrow(() -> new TemplateNotFoundException(
                        TemplateKey.of(category, stack, component), candidatePaths(category, stack, component)));
    }

    /**
     * Location and source of the template that {@link #resolve} would return, if any.
     * Files are looked up directly, so an override template is honoured even when its
     * stack directory has no manifest.
     */
    public Optional<TemplateInfo> describe(String category, String stack, String component) {
        TemplateKey key = TemplateKey.of(category, stack, component);
        Path override = templatePath(overrideRoot, key);
        if (override != null && Files.isRegularFile(override)) {
            return Optional.of(new TemplateInfo(key, override, TemplateSource.OVERRIDE));
        }
        Path core = templatePath(coreRoot, key);
        if (core != null && Files.isRegularFile(core)) {
            return Optional.of(new TemplateInfo(key, core, TemplateSource.CORE));
        }
        return Optional.empty();
    }

    public boolean hasOverride(String category, String stack, String component) {
        return describe(category, stack, component)
                .map(info -> info.getSource() == TemplateSource.OVERRIDE)
                .orElse(false);
    }

    /**
     * Components discovered for a stack across both roots, sorted. Empty when the stack
     * is unknown or its directories lack a manifest.
     */
    public SortedSet<String> listComponents(String category, String stack) {
        return index.components(category, stack);
    }

    /**
     * Discovered templates grouped as category, then stack, then component names.
     * Either filter may be null to include everything.
     */
    public SortedMap<String, SortedMap<String, SortedSet<String>>> listAvailableTemplates(String category, String stack) {
        SortedMap<String, SortedMap<String, SortedSet<String>>> result = new TreeMap<>();
        for (TemplateKey key : index.entries().keySet()) {
            if (category != null && !category.equals(key.getCategory())) {
                continue;
            }
            if (stack != null && !stack.equals(key.getStack())) {
                continue;
            }
            result.computeIfAbsent(key.getCategory(), c -> new TreeMap<>())
                    .computeIfAbsent(key.getStack(), s -> new TreeSet<>())
                    .add(key.getComponent());
        }
        return result;
    }

    /**
     * Renders the template at the given path against the model.
     *
     * @throws TemplateSyntaxException when the template cannot be parsed
     * @throws TemplateRenderException when evaluation fails
     * @throws GenerationIoException when the file cannot be read
     */
    public String render(Path templatePath, Map<String, ?> model) {
        Template template;
        try (Reader reader = Files.newBufferedReader(templatePath, StandardCharsets.UTF_8)) {
            template = new Template(templatePath.toString(), reader, freemarkerConfig);
        } catch (ParseException e) {
            throw new TemplateSyntaxException(templatePath, e);
        } catch (IOException e) {
            throw new GenerationIoException(templatePath, e);
        }

        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new TemplateRenderException(templatePath, e);
        } catch (IOException e) {
            throw new GenerationIoException(templatePath, e);
        }
        return out.toString();
    }

    /**
     * Resolves the triplet and renders it.
     */
    public String renderComponent(String category, String stack, String component, Map<String, ?> model) {
        return render(resolve(category, stack, component), model);
    }

    private List<Path> candidatePaths(String category, String stack, String component) {
        TemplateKey key = TemplateKey.of(category, stack, component);
        List<Path> paths = new ArrayList<>(2);
        Path override = templatePath(overrideRoot, key);
        if (override != null) {
            paths.add(override);
        }
        Path core = templatePath(coreRoot, key);
        if (core != null) {
            paths.add(core);
        }
        return paths;
    }

    private static Path templatePath(Path root, TemplateKey key) {
        if (root == null) {
            return null;
        }
        return root.resolve(key.getCategory())
                .resolve(key.getStack())
                .resolve(key.getComponent() + TemplateDiscoveryService.TEMPLATE_SUFFIX);
    }
}
