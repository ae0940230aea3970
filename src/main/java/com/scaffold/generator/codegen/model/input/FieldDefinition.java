package com.scaffold.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A single field as declared in an entity definition.
 *
 * The type is kept as its declared name so that definitions coming from raw
 * records can carry an unknown type up to validation.
 */
@Value
@Builder(toBuilder = true)
public class FieldDefinition {

    String name;

    String type;

    boolean primaryKey;

    boolean unique;

    @Builder.Default
    boolean nullable = true;

    String defaultValue;

    /**
     * "Entity.field" reference, carried as-is.
     */
    String foreignKey;

    @NonNull
    @Singular
    List<String> constraints;

    /**
     * Shortcut for builder callers holding a typed value.
     */
    public static FieldDefinitionBuilder of(String name, FieldType type) {
        return builder().name(name).type(type.getId());
    }
}
