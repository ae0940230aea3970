package com.scaffold.generator.codegen.stack;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.scaffold.generator.codegen.context.ContextExtension;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the orchestrator needs to know about a target stack: output layout per
 * component, the components to try when template discovery finds none, package marker
 * files, and the context extension feeding its templates.
 */
@Value
@Builder(toBuilder = true)
public class StackDescriptor {

    @NonNull
    String name;

    @NonNull
    @Singular
    Map<String, ComponentLayout> layouts;

    @NonNull
    @Singular
    List<String> fallbackComponents;

    /**
     * Empty files created when absent, e.g. Python package {@code __init__.py} files.
     */
    @NonNull
    @Singular
    List<String> packageMarkers;

    @NonNull
    @Builder.Default
    ContextExtension contextExtension = ContextExtension.NONE;

    public Optional<ComponentLayout> layoutFor(String component) {
        return Optional.ofNullable(layouts.get(component));
    }

    public static class StackDescriptorBuilder {

        public StackDescriptorBuilder single(String component, String path) {
            return layout(component, ComponentLayout.single(component, path));
        }

        public StackDescriptorBuilder perEntity(String component, String pathPattern) {
            return layout(component, ComponentLayout.perEntity(component, pathPattern));
        }
    }
}
