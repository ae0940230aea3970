package com.scaffold.generator.codegen.stack;

import lombok.NonNull;
import lombok.Value;

/**
 * Where one component's output goes.
 *
 * <p>The path pattern is relative to the output directory. For per-entity components the
 * placeholder {@value #ENTITY_PLACEHOLDER} is replaced by the entity's snake-case name.
 */
@Value
public class ComponentLayout {

    public static final String ENTITY_PLACEHOLDER = "{entity}";

    @NonNull
    String component;

    @NonNull
    OutputScope scope;

    @NonNull
    String pathPattern;

    public static ComponentLayout single(String component, String path) {
        return new ComponentLayout(component, OutputScope.SINGLE_FILE, path);
    }

    public static ComponentLayout perEntity(String component, String pathPattern) {
        if (!pathPattern.contains(ENTITY_PLACEHOLDER)) {
            throw new IllegalArgumentException("Per-entity path must contain " + ENTITY_PLACEHOLDER + ": " + pathPattern);
        }
        return new ComponentLayout(component, OutputScope.PER_ENTITY, pathPattern);
    }

    public String relativePath(String entitySnakeName) {
        if (scope == OutputScope.SINGLE_FILE) {
            return pathPattern;
        }
        return pathPattern.replace(ENTITY_PLACEHOLDER, entitySnakeName);
    }
}
