package com.scaffold.generator.codegen.stack;

/**
 * How often a component is rendered during one run.
 */
public enum OutputScope {
    /** Once against the whole context; the template must exist. */
    SINGLE_FILE,
    /** Once per entity; skipped with a warning when the template is missing. */
    PER_ENTITY
}
