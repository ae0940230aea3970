package com.scaffold.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Settings for one generation run.
 */
@Value
@Builder(toBuilder = true)
public class ProjectConfig {

    public static final String DEFAULT_CATEGORY = "back";
    public static final String DEFAULT_STACK = "fastapi";

    /**
     * Project metadata exposed to templates as {@code project.name} etc.
     */
    @NonNull
    String projectName;

    String description;

    @NonNull
    @Builder.Default
    String version = "1.0.0";

    @NonNull
    @Builder.Default
    String stack = DEFAULT_STACK;

    @NonNull
    @Builder.Default
    String category = DEFAULT_CATEGORY;

    /**
     * Root of the generated tree.
     */
    @NonNull
    Path outputDir;

    /**
     * Free-form settings exposed to templates as {@code settings}.
     */
    @NonNull
    @Singular
    Map<String, Object> settings;

    @Builder.Default
    boolean preserveProtectedRegions = true;

    /**
     * Number of render/write workers. 1 renders sequentially on the calling thread.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Stack name as used for template directories and descriptor lookup, always lower case.
     */
    public String getStack() {
        return stack.toLowerCase(Locale.ROOT);
    }

    /**
     * The {@code project} template variable.
     */
    public Map<String, Object> projectModel() {
        Map<String, Object> project = new LinkedHashMap<>();
        project.put("name", projectName);
        project.put("description", description);
        project.put("version", version);
        return project;
    }
}
