package com.scaffold.generator.codegen.model.context;

import java.util.LinkedHashMap;
import java.util.Map;

import com.scaffold.generator.codegen.util.NamingUtil;

import lombok.NonNull;
import lombok.Value;

/**
 * The three case variants of a declared name.
 */
@Value
public class NameVariants {

    @NonNull
    String snake;

    @NonNull
    String pascal;

    @NonNull
    String kebab;

    public static NameVariants of(String name) {
        return new NameVariants(
                NamingUtil.toSnakeCase(name),
                NamingUtil.toPascalCase(name),
                NamingUtil.toKebabCase(name));
    }

    Map<String, Object> toTemplateModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("snake", snake);
        model.put("pascal", pascal);
        model.put("kebab", kebab);
        return model;
    }
}
