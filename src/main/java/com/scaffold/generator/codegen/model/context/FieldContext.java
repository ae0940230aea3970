package com.scaffold.generator.codegen.model.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.scaffold.generator.codegen.model.input.FieldType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Render-ready view of one field.
 */
@Value
@Builder
public class FieldContext {

    @NonNull
    String originalName;

    @NonNull
    NameVariants names;

    @NonNull
    FieldType type;

    boolean primaryKey;

    boolean unique;

    /**
     * Always false for primary keys.
     */
    boolean nullable;

    String defaultValue;

    String foreignKey;

    @NonNull
    List<String> constraints;

    public String getSqlType() {
        return type.getSqlType();
    }

    /**
     * Not nullable and not a primary key.
     */
    public boolean isRequired() {
        return !nullable && !primaryKey;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean isRelationship() {
        return foreignKey != null;
    }

    public String getPythonType() {
        return nullable ? "Optional[" + type.getPythonType() + "]" : type.getPythonType();
    }

    public String getTypescriptType() {
        return nullable ? type.getTypescriptType() + " | null" : type.getTypescriptType();
    }

    /**
     * The field as template variables, keyed the way templates address it
     * (for instance {@code field.names.snake} or {@code field.is_nullable}).
     */
    public Map<String, Object> toTemplateModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("original_name", originalName);
        model.put("names", Collections.unmodifiableMap(names.toTemplateModel()));
        model.put("type", type.getId());
        model.put("sql_type", getSqlType());
        model.put("is_primary_key", primaryKey);
        model.put("is_unique", unique);
        model.put("is_nullable", nullable);
        model.put("default", defaultValue);
        model.put("foreign_key", foreignKey);
        model.put("constraints", constraints);
        model.put("is_required", isRequired());
        model.put("has_default", hasDefault());
        model.put("is_relationship", isRelationship());
        model.put("python_type", getPythonType());
        model.put("typescript_type", getTypescriptType());
        return Collections.unmodifiableMap(model);
    }
}
