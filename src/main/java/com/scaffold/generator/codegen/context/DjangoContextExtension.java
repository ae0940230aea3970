package com.scaffold.generator.codegen.context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.scaffold.generator.codegen.model.context.EntityContext;

/**
 * Model, admin, serializer and viewset class names used by the Django templates.
 */
public class DjangoContextExtension implements ContextExtension {

    static final String DEFAULT_APP_NAME = "core";

    @Override
    public Map<String, Object> extras(List<EntityContext> entities) {
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("model_classes", collect(entities, e -> e.getNames().getPascal()));
        extras.put("app_name", DEFAULT_APP_NAME);
        extras.put("admin_classes", collect(entities, e -> e.getNames().getPascal() + "Admin"));
        extras.put("serializer_classes", collect(entities, e -> e.getNames().getPascal() + "Serializer"));
        extras.put("viewset_classes", collect(entities, e -> e.getNames().getPascal() + "ViewSet"));
        extras.put("url_patterns", collect(entities, e -> e.getNames().getKebab()));
        return extras;
    }

    private static List<String> collect(List<EntityContext> entities, Function<EntityContext, String> mapper) {
        return entities.stream().map(mapper).collect(Collectors.toUnmodifiableList());
    }
}
