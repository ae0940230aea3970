package com.scaffold.generator.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.model.input.EntityInput;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Contents of a project file as read, before any entity validation.
 */
@Value
@Builder
public class ProjectDefinition {

    /**
     * The file this definition was read from.
     */
    Path source;

    @NonNull
    String projectName;

    String description;

    @NonNull
    @Builder.Default
    String version = "1.0.0";

    @NonNull
    @Builder.Default
    String category = ProjectConfig.DEFAULT_CATEGORY;

    @NonNull
    @Builder.Default
    String stack = ProjectConfig.DEFAULT_STACK;

    @NonNull
    @Singular
    Map<String, Object> settings;

    /**
     * Raw entity records; shape and semantics are checked by the context builder.
     */
    @NonNull
    @Singular
    List<Map<String, Object>> entityRecords;

    public EntityInput entityInput() {
        return EntityInput.raw(entityRecords);
    }

    /**
     * Run configuration for this project, writing into {@code outputDir}.
     */
    public ProjectConfig.ProjectConfigBuilder toProjectConfig(Path outputDir) {
        return ProjectConfig.builder()
                .projectName(projectName)
                .description(description)
                .version(version)
                .category(category)
                .stack(stack)
                .settings(settings)
                .outputDir(outputDir);
    }
}
