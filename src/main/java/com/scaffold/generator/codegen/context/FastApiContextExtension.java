package com.scaffold.generator.codegen.context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.scaffold.generator.codegen.model.context.EntityContext;

/**
 * Router, schema and CRUD class names used by the FastAPI templates.
 */
public class FastApiContextExtension implements ContextExtension {

    @Override
    public Map<String, Object> extras(List<EntityContext> entities) {
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("router_tags", collect(entities, e -> e.getNames().getKebab()));
        extras.put("api_routes", collect(entities, e -> "/" + e.getNames().getKebab()));
        extras.put("create_schemas", collect(entities, e -> e.getNames().getPascal() + "Create"));
        extras.put("update_schemas", collect(entities, e -> e.getNames().getPascal() + "Update"));
        extras.put("response_schemas", collect(entities, e -> e.getNames().getPascal() + "Response"));
        extras.put("crud_classes", collect(entities, e -> e.getNames().getPascal() + "CRUD"));
        return extras;
    }

    private static List<String> collect(List<EntityContext> entities, Function<EntityContext, String> mapper) {
        return entities.stream().map(mapper).collect(Collectors.toUnmodifiableList());
    }
}
