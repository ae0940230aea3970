package com.scaffold.generator.codegen.exception;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import com.scaffold.generator.codegen.template.TemplateKey;

/**
 * Raised when a template triplet exists in neither the override root nor the core root.
 */
public class TemplateNotFoundException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final transient TemplateKey key;
    private final transient List<Path> searchedPaths;

    public TemplateNotFoundException(TemplateKey key, List<Path> searchedPaths) {
        super("Template not found: " + key + searchedDescription(searchedPaths));
        this.key = key;
        this.searchedPaths = List.copyOf(searchedPaths);
    }

    public TemplateKey getKey() {
        return key;
    }

    public String getComponent() {
        return key.getComponent();
    }

    public List<Path> getSearchedPaths() {
        return searchedPaths;
    }

    private static String searchedDescription(List<Path> paths) {
        if (paths.isEmpty()) {
            return "";
        }
        return paths.stream()
                .map(p -> "  - " + p)
                .collect(Collectors.joining(System.lineSeparator(),
                        System.lineSeparator() + "Searched in:" + System.lineSeparator(), ""));
    }
}
