package com.scaffold.generator.codegen.model.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.scaffold.generator.codegen.model.input.FieldType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Render-ready view of one entity.
 */
@Value
@Builder
public class EntityContext {

    @NonNull
    String originalName;

    @NonNull
    NameVariants names;

    @NonNull
    List<FieldContext> fields;

    /**
     * Snake-case names of the primary key fields in declaration order.
     */
    @NonNull
    List<String> primaryKeyFields;

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * The single primary key name, or the ordered list of names when the key is composite.
     */
    public Object getPrimaryKeyField() {
        return primaryKeyFields.size() == 1 ? primaryKeyFields.get(0) : primaryKeyFields;
    }

    public boolean isCompositeKey() {
        return primaryKeyFields.size() > 1;
    }

    public String getTableName() {
        return names.getSnake();
    }

    public String getClassName() {
        return names.getPascal();
    }

    public boolean hasRelationships() {
        return fields.stream().anyMatch(FieldContext::isRelationship);
    }

    public boolean usesType(FieldType type) {
        return fields.stream().anyMatch(f -> f.getType() == type);
    }

    public List<FieldContext> getRequiredFields() {
        return select(FieldContext::isRequired);
    }

    public List<FieldContext> getOptionalFields() {
        return select(f -> f.isNullable() && !f.isPrimaryKey());
    }

    public List<FieldContext> getUniqueFields() {
        return select(FieldContext::isUnique);
    }

    private List<FieldContext> select(Predicate<FieldContext> filter) {
        return fields.stream().filter(filter).collect(Collectors.toUnmodifiableList());
    }

    public Map<String, Object> toTemplateModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("original_name", originalName);
        model.put("names", Collections.unmodifiableMap(names.toTemplateModel()));
        model.put("fields", toModels(fields));
        model.put("primary_key_field", getPrimaryKeyField());
        model.put("primary_key_fields", primaryKeyFields);
        model.put("field_count", getFieldCount());
        model.put("table_name", getTableName());
        model.put("class_name", getClassName());
        model.put("has_relationships", hasRelationships());
        model.put("required_fields", toModels(getRequiredFields()));
        model.put("optional_fields", toModels(getOptionalFields()));
        model.put("unique_fields", toModels(getUniqueFields()));
        return Collections.unmodifiableMap(model);
    }

    private static List<Map<String, Object>> toModels(List<FieldContext> fields) {
        return fields.stream().map(FieldContext::toTemplateModel).collect(Collectors.toUnmodifiableList());
    }
}
