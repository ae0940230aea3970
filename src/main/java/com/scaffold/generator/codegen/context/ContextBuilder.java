package com.scaffold.generator.codegen.context;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.exception.ValidationException;
import com.scaffold.generator.codegen.model.context.EntityContext;
import com.scaffold.generator.codegen.model.context.FieldContext;
import com.scaffold.generator.codegen.model.context.NameVariants;
import com.scaffold.generator.codegen.model.context.RenderContext;
import com.scaffold.generator.codegen.model.input.EntityDefinition;
import com.scaffold.generator.codegen.model.input.EntityInput;
import com.scaffold.generator.codegen.model.input.FieldDefinition;
import com.scaffold.generator.codegen.model.input.FieldType;
import com.scaffold.generator.codegen.util.NamingUtil;

/**
 * Turns entity definitions into the {@link RenderContext} templates are rendered against.
 *
 * <p>All structural rules are checked before anything is derived. Checks run in this order
 * and the first violation is reported:
 * <ol>
 *   <li>entity names unique across the list, also after conversion to snake case</li>
 *   <li>per entity: name is a valid identifier</li>
 *   <li>per entity: field names unique</li>
 *   <li>per field: name is a valid identifier, type is known</li>
 *   <li>per entity: at least one primary key field</li>
 * </ol>
 */
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    private static final String IDENTIFIER_RULE =
            "Must start with a letter and contain only letters, digits, or underscores.";

    private final ContextExtension extension;

    public ContextBuilder() {
        this(ContextExtension.NONE);
    }

    public ContextBuilder(ContextExtension extension) {
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    public RenderContext buildContext(List<EntityDefinition> entities) {
        return buildContext(EntityInput.typed(entities));
    }

    /**
     * Validates and derives the render context.
     *
     * @throws ValidationException on the first rule violation; nothing is returned in that case
     */
    public RenderContext buildContext(EntityInput input) {
        List<EntityDefinition> entities = input.normalize();
        validate(entities, message -> {
            throw new ValidationException(message);
        });

        List<EntityContext> entityContexts = new ArrayList<>(entities.size());
        for (EntityDefinition entity : entities) {
            entityContexts.add(buildEntityContext(entity));
        }

        RenderContext context = RenderContext.builder()
                .entities(entityContexts)
                .extras(extension.extras(List.copyOf(entityContexts)))
                .build();
        log.debug("Built render context with {} entities and {} fields",
                context.getEntityCount(), context.getTotalFields());
        return context;
    }

    /**
     * Runs every check and returns all violations instead of stopping at the first one.
     * An empty list means {@link #buildContext(EntityInput)} would succeed.
     */
    public List<String> validateAll(EntityInput input) {
        List<String> errors = new ArrayList<>();
        validate(input.normalize(), errors::add);
        return errors;
    }

    private void validate(List<EntityDefinition> entities, ViolationSink sink) {
        Set<String> seenEntityNames = new HashSet<>();
        Map<String, String> entityBySnakeName = new HashMap<>();
        for (EntityDefinition entity : entities) {
            if (!seenEntityNames.add(entity.getName())) {
                sink.report("Duplicate entity name detected: '" + entity.getName() + "'");
                continue;
            }
            if (entity.getName() == null) {
                continue;
            }
            // entities sharing a snake form would be written to the same per-entity files
            String snake = NamingUtil.toSnakeCase(entity.getName());
            String clash = entityBySnakeName.putIfAbsent(snake, entity.getName());
            if (clash != null) {
                sink.report("Entities '" + clash + "' and '" + entity.getName()
                        + "' both map to the file name '" + snake + "'");
            }
        }

        for (EntityDefinition entity : entities) {
            String entityName = entity.getName();
            if (!NamingUtil.validateIdentifier(entityName)) {
                sink.report("Invalid entity name '" + entityName + "'. " + IDENTIFIER_RULE);
            }

            Set<String> seenFieldNames = new HashSet<>();
            for (FieldDefinition field : entity.getFields()) {
                if (!seenFieldNames.add(field.getName())) {
                    sink.report("Duplicate field name '" + field.getName() + "' in entity '" + entityName + "'");
                }
            }

            for (FieldDefinition field : entity.getFields()) {
                if (!NamingUtil.validateIdentifier(field.getName())) {
                    sink.report("Invalid field name '" + field.getName() + "' in entity '" + entityName + "'. "
                            + IDENTIFIER_RULE);
                }
                if (FieldType.fromId(field.getType()).isEmpty()) {
                    sink.report("Unknown field type '" + field.getType() + "' for field '" + field.getName()
                            + "' in entity '" + entityName + "'.");
                }
            }

            if (entity.getFields().stream().noneMatch(FieldDefinition::isPrimaryKey)) {
                sink.report("Entity '" + entityName + "' does not have any field marked as primary_key.");
            }
        }
    }

    private EntityContext buildEntityContext(EntityDefinition entity) {
        List<FieldContext> fields = new ArrayList<>(entity.getFields().size());
        List<String> primaryKeys = new ArrayList<>();
        for (FieldDefinition field : entity.getFields()) {
            FieldContext fieldContext = buildFieldContext(field);
            fields.add(fieldContext);
            if (fieldContext.isPrimaryKey()) {
                primaryKeys.add(fieldContext.getNames().getSnake());
            }
        }

        return EntityContext.builder()
                .originalName(entity.getName())
                .names(NameVariants.of(entity.getName()))
                .fields(List.copyOf(fields))
                .primaryKeyFields(List.copyOf(primaryKeys))
                .build();
    }

    private FieldContext buildFieldContext(FieldDefinition field) {
        FieldType type = FieldType.fromId(field.getType())
                .orElseThrow(() -> new IllegalStateException("Unvalidated field type " + field.getType()));
        return FieldContext.builder()
                .originalName(field.getName())
                .names(NameVariants.of(field.getName()))
                .type(type)
                .primaryKey(field.isPrimaryKey())
                .unique(field.isUnique())
                .nullable(field.isNullable() && !field.isPrimaryKey())
                .defaultValue(field.getDefaultValue())
                .foreignKey(field.getForeignKey())
                .constraints(List.copyOf(field.getConstraints()))
                .build();
    }

    @FunctionalInterface
    private interface ViolationSink {
        void report(String message);
    }
}
