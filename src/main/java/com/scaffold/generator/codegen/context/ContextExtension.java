package com.scaffold.generator.codegen.context;

import java.util.List;
import java.util.Map;

import com.scaffold.generator.codegen.model.context.EntityContext;

/**
 * Contributes stack-specific top-level template variables derived from the entities.
 */
@FunctionalInterface
public interface ContextExtension {

    ContextExtension NONE = entities -> Map.of();

    Map<String, Object> extras(List<EntityContext> entities);
}
