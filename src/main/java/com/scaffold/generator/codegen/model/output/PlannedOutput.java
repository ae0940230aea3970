package com.scaffold.generator.codegen.model.output;

import java.nio.file.Path;
import java.util.Optional;

import com.scaffold.generator.codegen.model.context.EntityContext;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One file the run will produce: which template, for which entity (if any), written where.
 *
 * Pure structure only.
 */
@Value
@Builder
public class PlannedOutput {

    @NonNull
    String component;

    EntityContext entity;

    @NonNull
    Path templatePath;

    @NonNull
    Path destination;

    public Optional<EntityContext> getEntity() {
        return Optional.ofNullable(entity);
    }
}
