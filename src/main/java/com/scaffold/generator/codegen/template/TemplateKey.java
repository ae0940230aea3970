package com.scaffold.generator.codegen.template;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a template's role by (category, stack, component), e.g. back/fastapi/models.
 */
@Value(staticConstructor = "of")
public class TemplateKey implements Comparable<TemplateKey> {

    @NonNull
    String category;

    @NonNull
    String stack;

    @NonNull
    String component;

    @Override
    public int compareTo(TemplateKey other) {
        int result = category.compareTo(other.category);
        if (result == 0) {
            result = stack.compareTo(other.stack);
        }
        if (result == 0) {
            result = component.compareTo(other.component);
        }
        return result;
    }

    @Override
    public String toString() {
        return category + "/" + stack + "/" + component;
    }
}
