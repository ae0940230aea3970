package com.scaffold.generator.codegen.template;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping from every discovered triplet to its winning template.
 */
public final class TemplateIndex {

    private final SortedMap<TemplateKey, TemplateInfo> entries;

    TemplateIndex(Map<TemplateKey, TemplateInfo> entries) {
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    /**
     * Core entries first, then override entries on top, so an override replaces
     * a core template registered under the same triplet.
     */
    static TemplateIndex merge(Map<TemplateKey, TemplateInfo> core, Map<TemplateKey, TemplateInfo> override) {
        Map<TemplateKey, TemplateInfo> merged = new TreeMap<>(core);
        merged.putAll(override);
        return new TemplateIndex(merged);
    }

    public Optional<TemplateInfo> find(TemplateKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public SortedMap<TemplateKey, TemplateInfo> entries() {
        return entries;
    }

    public SortedSet<String> components(String category, String stack) {
        SortedSet<String> components = new TreeSet<>();
        for (TemplateKey key : entries.keySet()) {
            if (key.getCategory().equals(category) && key.getStack().equals(stack)) {
                components.add(key.getComponent());
            }
        }
        return Collections.unmodifiableSortedSet(components);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
