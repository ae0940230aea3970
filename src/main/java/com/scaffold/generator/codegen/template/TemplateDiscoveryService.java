package com.scaffold.generator.codegen.template;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.exception.GenerationIoException;

/**
 * Scans one template root laid out as {@code <category>/<stack>/<component>_template.ftl}.
 *
 * A stack directory is only registered when it holds the {@value #MANIFEST_FILE}
 * marker, so half-populated stack folders are never offered. Hidden entries are skipped.
 */
public class TemplateDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(TemplateDiscoveryService.class);

    public static final String MANIFEST_FILE = "meta.yaml";
    public static final String TEMPLATE_SUFFIX = "_template.ftl";

    public Map<TemplateKey, TemplateInfo> discover(Path root, TemplateSource source) {
        Map<TemplateKey, TemplateInfo> found = new TreeMap<>();
        if (root == null || !Files.isDirectory(root)) {
            log.debug("Template root {} ({}) does not exist, nothing to index", root, source);
            return found;
        }

        try {
            for (Path categoryDir : subdirectories(root)) {
                String category = categoryDir.getFileName().toString();
                for (Path stackDir : subdirectories(categoryDir)) {
                    String stack = stackDir.getFileName().toString();
                    if (!Files.isRegularFile(stackDir.resolve(MANIFEST_FILE))) {
                        log.debug("Skipping {}/{} in {}: no {}", category, stack, root, MANIFEST_FILE);
                        continue;
                    }
                    for (Path template : templates(stackDir)) {
                        String fileName = template.getFileName().toString();
                        String component = fileName.substring(0, fileName.length() - TEMPLATE_SUFFIX.length());
                        TemplateKey key = TemplateKey.of(category, stack, component);
                        found.put(key, new TemplateInfo(key, template, source));
                    }
                }
            }
        } catch (IOException e) {
            throw new GenerationIoException(root, e);
        }

        log.debug("Indexed {} templates under {} ({})", found.size(), root, source);
        return found;
    }

    private static List<Path> subdirectories(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isDirectory)
                    .filter(p -> !isHidden(p))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static List<Path> templates(Path stackDir) throws IOException {
        try (Stream<Path> stream = Files.list(stackDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !isHidden(p))
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(TEMPLATE_SUFFIX) && name.length() > TEMPLATE_SUFFIX.length();
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
