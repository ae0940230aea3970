package com.scaffold.generator.codegen.model.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.scaffold.generator.codegen.exception.ValidationException;

/**
 * Entity definitions as uniform key/value records, the shape a YAML or JSON
 * reader produces. Keys follow the definition file: {@code name},
 * {@code fields}, and per field {@code name}, {@code type},
 * {@code primary_key}, {@code unique}, {@code nullable}, {@code default},
 * {@code foreign_key}, {@code constraints}.
 *
 * Normalization only fails when a record does not have the expected shape;
 * semantic rules are left to the context builder.
 */
public final class RawRecordList implements EntityInput {

    private final List<? extends Map<String, ?>> records;

    public RawRecordList(List<? extends Map<String, ?>> records) {
        this.records = Objects.requireNonNull(records, "records");
    }

    @Override
    public List<EntityDefinition> normalize() {
        List<EntityDefinition> entities = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            entities.add(toEntity(record));
        }
        return entities;
    }

    private static EntityDefinition toEntity(Map<String, ?> record) {
        if (record == null) {
            throw new ValidationException("Entity record must not be null.");
        }
        String name = asString(record.get("name"));
        Object rawFields = record.get("fields");
        if (rawFields == null) {
            rawFields = List.of();
        }
        if (!(rawFields instanceof List<?> fieldList)) {
            throw new ValidationException("Expected 'fields' for entity '" + name + "' to be a list.");
        }

        EntityDefinition.EntityDefinitionBuilder builder = EntityDefinition.builder().name(name);
        for (Object rawField : fieldList) {
            if (!(rawField instanceof Map<?, ?> fieldRecord)) {
                throw new ValidationException("Expected each field of entity '" + name + "' to be a mapping.");
            }
            builder.field(toField(fieldRecord, name));
        }
        return builder.build();
    }

    private static FieldDefinition toField(Map<?, ?> record, String entityName) {
        FieldDefinition.FieldDefinitionBuilder builder = FieldDefinition.builder()
                .name(asString(record.get("name")))
                .type(asString(record.get("type")))
                .primaryKey(asBoolean(record.get("primary_key"), false))
                .unique(asBoolean(record.get("unique"), false))
                .nullable(asBoolean(record.get("nullable"), true))
                .defaultValue(asString(record.get("default")))
                .foreignKey(asString(record.get("foreign_key")));

        Object constraints = record.get("constraints");
        if (constraints instanceof List<?> list) {
            for (Object c : list) {
                if (c != null) {
                    builder.constraint(c.toString());
                }
            }
        } else if (constraints != null) {
            throw new ValidationException("Expected 'constraints' of field '" + record.get("name")
                    + "' in entity '" + entityName + "' to be a list.");
        }
        return builder.build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean asBoolean(Object value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
