package com.scaffold.generator.codegen.template;

/**
 * Which search root a template was found in. Lower priority value wins.
 */
public enum TemplateSource {
    OVERRIDE(1),
    CORE(2);

    private final int priority;

    TemplateSource(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
