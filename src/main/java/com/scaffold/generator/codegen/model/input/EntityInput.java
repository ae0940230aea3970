package com.scaffold.generator.codegen.model.input;

import java.util.List;
import java.util.Map;

/**
 * The shapes in which entity definitions can reach the context builder.
 * Every shape normalizes to the same ordered list of {@link EntityDefinition}
 * before any validation runs.
 */
public interface EntityInput {

    List<EntityDefinition> normalize();

    static EntityInput typed(List<EntityDefinition> entities) {
        return new TypedEntityList(entities);
    }

    static EntityInput raw(List<? extends Map<String, ?>> records) {
        return new RawRecordList(records);
    }
}
