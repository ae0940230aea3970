package com.scaffold.generator.codegen.model.input;

import java.util.List;
import java.util.Objects;

/**
 * Entity definitions that are already typed objects.
 */
public final class TypedEntityList implements EntityInput {

    private final List<EntityDefinition> entities;

    public TypedEntityList(List<EntityDefinition> entities) {
        this.entities = List.copyOf(Objects.requireNonNull(entities, "entities"));
    }

    @Override
    public List<EntityDefinition> normalize() {
        return entities;
    }
}
