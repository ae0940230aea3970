package com.scaffold.generator.codegen.model.context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.scaffold.generator.codegen.model.input.FieldType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything templates are rendered against during one generation run.
 *
 * Built once by the context builder and shared read-only by every render call
 * of the run, including concurrent ones.
 */
@Value
@Builder
public class RenderContext {

    @NonNull
    @Singular
    List<EntityContext> entities;

    /**
     * Stack-specific values added by a context extension, keyed by template variable name.
     */
    @NonNull
    @Singular("extra")
    Map<String, Object> extras;

    public int getEntityCount() {
        return entities.size();
    }

    public int getTotalFields() {
        return entities.stream().mapToInt(EntityContext::getFieldCount).sum();
    }

    public Optional<EntityContext> findEntity(String originalName) {
        return entities.stream().filter(e -> e.getOriginalName().equals(originalName)).findFirst();
    }

    /**
     * Snake-case names of entities that carry at least one foreign key.
     */
    public List<String> getEntitiesWithRelationships() {
        return entities.stream()
                .filter(EntityContext::hasRelationships)
                .map(e -> e.getNames().getSnake())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Snake-case names of entities with at least one field of the given type.
     * Templates use these to decide which imports a file needs.
     */
    public List<String> getEntitiesUsing(FieldType type) {
        return entities.stream()
                .filter(e -> e.usesType(type))
                .map(e -> e.getNames().getSnake())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Top-level template variables. A fresh map is returned on each call so
     * callers may layer run-specific values over it without touching this context.
     */
    public Map<String, Object> toTemplateModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("entities", entities.stream()
                .map(EntityContext::toTemplateModel)
                .collect(Collectors.toUnmodifiableList()));
        model.put("entity_count", getEntityCount());
        model.put("has_entities", !entities.isEmpty());
        model.put("total_fields", getTotalFields());
        model.put("entities_with_relationships", getEntitiesWithRelationships());
        model.put("entities_needing_uuid", getEntitiesUsing(FieldType.UUID));
        model.put("entities_needing_datetime", getEntitiesUsing(FieldType.DATETIME));
        model.put("needs_uuid_import", !getEntitiesUsing(FieldType.UUID).isEmpty());
        model.put("needs_datetime_import", !getEntitiesUsing(FieldType.DATETIME).isEmpty());
        model.put("entity_names", names(NameVariants::getSnake));
        model.put("entity_classes", names(NameVariants::getPascal));
        model.put("table_names", entities.stream()
                .map(EntityContext::getTableName)
                .collect(Collectors.toUnmodifiableList()));
        model.putAll(extras);
        return model;
    }

    private List<String> names(Function<NameVariants, String> variant) {
        return entities.stream()
                .map(e -> variant.apply(e.getNames()))
                .collect(Collectors.toUnmodifiableList());
    }
}
