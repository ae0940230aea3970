package com.scaffold.generator.codegen.model.core.context;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.Getter;

/**
 * Non-fatal warnings and infos accumulated during a generation run.
 *
 * Pure structure only: no logging, no formatting, no IO. Safe to append to from
 * several render threads.
 */
@Getter
public class GenerationDiagnostics {
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<String> infos = new CopyOnWriteArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
