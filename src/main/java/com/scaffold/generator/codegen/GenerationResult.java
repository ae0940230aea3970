package com.scaffold.generator.codegen;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a generation run.
 *
 * A run that raised no exception but wrote no file is reported as unsuccessful.
 */
@Value
@Builder
public class GenerationResult {

    String stack;

    Path outputPath;

    /**
     * Written files per component, in generation order. Single-file components map to one path.
     */
    @NonNull
    @Singular("writtenFile")
    Map<String, List<Path>> writtenFiles;

    @NonNull
    @Singular
    List<String> skippedComponents;

    @NonNull
    @Singular
    List<String> warnings;

    long generationTimeMillis;

    public int getFileCount() {
        return writtenFiles.values().stream().mapToInt(List::size).sum();
    }

    public boolean isSuccess() {
        return getFileCount() > 0;
    }

    public List<Path> filesFor(String component) {
        return writtenFiles.getOrDefault(component, List.of());
    }
}
