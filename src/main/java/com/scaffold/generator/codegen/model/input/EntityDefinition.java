package com.scaffold.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An entity as declared by the user: a name and its ordered fields.
 */
@Value
@Builder(toBuilder = true)
public class EntityDefinition {

    String name;

    @NonNull
    @Singular
    List<FieldDefinition> fields;
}
