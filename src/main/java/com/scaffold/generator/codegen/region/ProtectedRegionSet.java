package com.scaffold.generator.codegen.region;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Regions extracted from one file, keyed by name and iterated in lexical name order.
 * Lives only for the duration of a single merge.
 */
public final class ProtectedRegionSet {

    private static final ProtectedRegionSet EMPTY = new ProtectedRegionSet(Map.of());

    private final SortedMap<String, ProtectedRegion> regions;

    ProtectedRegionSet(Map<String, ProtectedRegion> regions) {
        this.regions = Collections.unmodifiableSortedMap(new TreeMap<>(regions));
    }

    public static ProtectedRegionSet empty() {
        return EMPTY;
    }

    public Optional<ProtectedRegion> get(String name) {
        return Optional.ofNullable(regions.get(name));
    }

    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(regions.keySet()));
    }

    public Collection<ProtectedRegion> regions() {
        return regions.values();
    }

    public int size() {
        return regions.size();
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }
}
