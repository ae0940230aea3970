package com.scaffold.generator.codegen.context;

import static org.assertj.core.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.scaffold.generator.codegen.exception.ValidationException;
import com.scaffold.generator.codegen.model.context.EntityContext;
import com.scaffold.generator.codegen.model.context.FieldContext;
import com.scaffold.generator.codegen.model.context.RenderContext;
import com.scaffold.generator.codegen.model.input.EntityDefinition;
import com.scaffold.generator.codegen.model.input.EntityInput;
import com.scaffold.generator.codegen.model.input.FieldDefinition;
import com.scaffold.generator.codegen.model.input.FieldType;

/**
 * Unit tests for ContextBuilder.
 */
class ContextBuilderTest {

    private final ContextBuilder builder = new ContextBuilder();

    private static EntityDefinition user() {
        return EntityDefinition.builder()
                .name("User")
                .field(FieldDefinition.of("id", FieldType.UUID).primaryKey(true).build())
                .field(FieldDefinition.of("email", FieldType.STRING).unique(true).build())
                .build();
    }

    private static Map<String, Object> field(String name, String type) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("type", type);
        return field;
    }

    private static Map<String, Object> entity(String name, List<Map<String, Object>> fields) {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("name", name);
        entity.put("fields", fields);
        return entity;
    }

    @Test
    void testBuildsUserContext() {
        RenderContext context = builder.buildContext(List.of(user()));

        assertThat(context.getEntityCount()).isEqualTo(1);
        EntityContext entity = context.getEntities().get(0);
        assertThat(entity.getOriginalName()).isEqualTo("User");
        assertThat(entity.getNames().getSnake()).isEqualTo("user");
        assertThat(entity.getNames().getPascal()).isEqualTo("User");
        assertThat(entity.getNames().getKebab()).isEqualTo("user");
        assertThat(entity.getPrimaryKeyField()).isEqualTo("id");
        assertThat(entity.getFieldCount()).isEqualTo(2);

        FieldContext id = entity.getFields().get(0);
        assertThat(id.isPrimaryKey()).isTrue();
        assertThat(id.isNullable()).isFalse();
        assertThat(id.getSqlType()).isEqualTo("UUID");

        FieldContext email = entity.getFields().get(1);
        assertThat(email.getNames().getSnake()).isEqualTo("email");
        assertThat(email.isUnique()).isTrue();
        assertThat(email.isNullable()).isTrue();
        assertThat(email.getPythonType()).isEqualTo("Optional[str]");
        assertThat(email.getTypescriptType()).isEqualTo("string | null");
        assertThat(email.getSqlType()).isEqualTo("VARCHAR");

        Map<String, Object> model = context.toTemplateModel();
        assertThat(model.get("entity_names")).isEqualTo(List.of("user"));
        assertThat(model.get("entity_classes")).isEqualTo(List.of("User"));
        assertThat(model.get("needs_uuid_import")).isEqualTo(true);
        assertThat(model.get("needs_datetime_import")).isEqualTo(false);
        assertThat(model.get("total_fields")).isEqualTo(2);
    }

    @Test
    void testPrimaryKeyIsNeverNullableEvenWhenDeclaredSo() {
        EntityDefinition order = EntityDefinition.builder()
                .name("Order")
                .field(FieldDefinition.of("number", FieldType.INTEGER).primaryKey(true).nullable(true).build())
                .build();

        FieldContext number = builder.buildContext(List.of(order)).getEntities().get(0).getFields().get(0);

        assertThat(number.isNullable()).isFalse();
        assertThat(number.isRequired()).isFalse();
        assertThat(number.getPythonType()).isEqualTo("int");
    }

    @Test
    void testNamesAreDerivedFromCamelCaseInput() {
        EntityDefinition profile = EntityDefinition.builder()
                .name("UserProfile")
                .field(FieldDefinition.of("profileId", FieldType.INTEGER).primaryKey(true).build())
                .field(FieldDefinition.of("createdAt", FieldType.DATETIME).nullable(false).build())
                .build();

        EntityContext entity = builder.buildContext(List.of(profile)).getEntities().get(0);

        assertThat(entity.getTableName()).isEqualTo("user_profile");
        assertThat(entity.getClassName()).isEqualTo("UserProfile");
        assertThat(entity.getNames().getKebab()).isEqualTo("user-profile");
        assertThat(entity.getPrimaryKeyField()).isEqualTo("profile_id");
        assertThat(entity.getRequiredFields()).extracting(FieldContext::getOriginalName).containsExactly("createdAt");
    }

    @Test
    void testCompositePrimaryKeyIsReportedAsList() {
        EntityDefinition membership = EntityDefinition.builder()
                .name("Membership")
                .field(FieldDefinition.of("user_id", FieldType.UUID).primaryKey(true).foreignKey("User.id").build())
                .field(FieldDefinition.of("group_id", FieldType.UUID).primaryKey(true).build())
                .build();

        RenderContext context = builder.buildContext(List.of(membership));
        EntityContext entity = context.getEntities().get(0);

        assertThat(entity.isCompositeKey()).isTrue();
        assertThat(entity.getPrimaryKeyField()).isEqualTo(List.of("user_id", "group_id"));
        assertThat(entity.hasRelationships()).isTrue();
        assertThat(context.getEntitiesWithRelationships()).containsExactly("membership");
    }

    @Test
    void testEntityOrderIsPreserved() {
        List<String> names = List.of("Zebra", "Apple", "Mango");
        List<EntityDefinition> entities = names.stream()
                .map(n -> EntityDefinition.builder()
                        .name(n)
                        .field(FieldDefinition.of("id", FieldType.INTEGER).primaryKey(true).build())
                        .build())
                .toList();

        RenderContext context = builder.buildContext(entities);

        assertThat(context.getEntities()).extracting(EntityContext::getOriginalName).containsExactlyElementsOf(names);
    }

    @Test
    void testRawRecordsAndTypedDefinitionsGiveTheSameContext() {
        Map<String, Object> id = field("id", "uuid");
        id.put("primary_key", true);
        Map<String, Object> email = field("email", "string");
        email.put("unique", true);
        List<Map<String, Object>> raw = List.of(entity("User", List.of(id, email)));

        RenderContext fromRaw = builder.buildContext(EntityInput.raw(raw));
        RenderContext fromTyped = builder.buildContext(List.of(user()));

        assertThat(fromRaw).isEqualTo(fromTyped);
        assertThat(fromRaw.toTemplateModel()).isEqualTo(fromTyped.toTemplateModel());
    }

    @Test
    void testRawNullableDefaultsToTrue() {
        Map<String, Object> id = field("id", "integer");
        id.put("primary_key", true);
        Map<String, Object> title = field("title", "string");
        Map<String, Object> body = field("body", "text");
        body.put("nullable", false);

        EntityContext entity = builder.buildContext(EntityInput.raw(List.of(entity("Post", List.of(id, title, body)))))
                .getEntities().get(0);

        assertThat(entity.getFields().get(1).isNullable()).isTrue();
        assertThat(entity.getFields().get(2).isNullable()).isFalse();
        assertThat(entity.getOptionalFields()).extracting(FieldContext::getOriginalName).containsExactly("title");
    }

    @Test
    void testInvalidEntityNameIsRejected() {
        EntityDefinition bad = user().toBuilder().name("1User").build();

        assertThatThrownBy(() -> builder.buildContext(List.of(bad)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("1User");
    }

    @Test
    void testInvalidFieldNameIsRejected() {
        EntityDefinition bad = EntityDefinition.builder()
                .name("User")
                .field(FieldDefinition.of("id", FieldType.UUID).primaryKey(true).build())
                .field(FieldDefinition.of("e-mail", FieldType.STRING).build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(bad)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("e-mail")
                .hasMessageContaining("User");
    }

    @Test
    void testUnknownFieldTypeIsRejected() {
        EntityDefinition bad = EntityDefinition.builder()
                .name("User")
                .field(FieldDefinition.of("id", FieldType.UUID).primaryKey(true).build())
                .field(FieldDefinition.builder().name("score").type("decimal").build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(bad)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unknown field type 'decimal' for field 'score' in entity 'User'.");
    }

    @Test
    void testDuplicateFieldIsRejected() {
        EntityDefinition bad = EntityDefinition.builder()
                .name("User")
                .field(FieldDefinition.of("id", FieldType.UUID).primaryKey(true).build())
                .field(FieldDefinition.of("email", FieldType.STRING).build())
                .field(FieldDefinition.of("email", FieldType.TEXT).build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(bad)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Duplicate field name 'email' in entity 'User'");
    }

    @Test
    void testMissingPrimaryKeyNamesTheEntity() {
        EntityDefinition noKey = EntityDefinition.builder()
                .name("AuditLog")
                .field(FieldDefinition.of("message", FieldType.TEXT).build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(noKey)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("AuditLog")
                .hasMessageContaining("primary_key");
    }

    @Test
    void testDuplicateEntityIsReportedBeforeFieldProblems() {
        EntityDefinition first = EntityDefinition.builder()
                .name("Order")
                .field(FieldDefinition.builder().name("id").type("bogus").primaryKey(true).build())
                .build();
        EntityDefinition second = EntityDefinition.builder()
                .name("Order")
                .field(FieldDefinition.of("id", FieldType.INTEGER).primaryKey(true).build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(first, second)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Duplicate entity name detected: 'Order'");
    }

    @Test
    void testEntitiesWithTheSameSnakeNameAreRejected() {
        EntityDefinition first = EntityDefinition.builder()
                .name("UserProfile")
                .field(FieldDefinition.of("id", FieldType.INTEGER).primaryKey(true).build())
                .field(FieldDefinition.of("first_entity", FieldType.STRING).build())
                .build();
        EntityDefinition second = EntityDefinition.builder()
                .name("User_Profile")
                .field(FieldDefinition.of("id", FieldType.INTEGER).primaryKey(true).build())
                .field(FieldDefinition.of("second_entity", FieldType.STRING).build())
                .build();

        assertThatThrownBy(() -> builder.buildContext(List.of(first, second)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'UserProfile'")
                .hasMessageContaining("'User_Profile'")
                .hasMessageContaining("'user_profile'");
        assertThat(builder.validateAll(EntityInput.typed(List.of(first, second)))).hasSize(1);
    }

    @Test
    void testValidateAllCollectsEveryProblem() {
        EntityDefinition noKey = EntityDefinition.builder()
                .name("Tag")
                .field(FieldDefinition.builder().name("label").type("varchar").build())
                .build();
        EntityDefinition badName = user().toBuilder().name("bad name").build();

        List<String> errors = builder.validateAll(EntityInput.typed(List.of(noKey, badName)));

        assertThat(errors).hasSize(3);
        assertThat(errors.get(0)).contains("varchar");
        assertThat(errors.get(1)).contains("Tag").contains("primary_key");
        assertThat(errors.get(2)).contains("bad name");
    }

    @Test
    void testValidateAllIsEmptyForValidInput() {
        assertThat(builder.validateAll(EntityInput.typed(List.of(user())))).isEmpty();
    }

    @Test
    void testMalformedRawRecordIsRejected() {
        Map<String, Object> broken = new HashMap<>();
        broken.put("name", "User");
        broken.put("fields", "id");

        assertThatThrownBy(() -> builder.buildContext(EntityInput.raw(List.of(broken))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'fields'")
                .hasMessageContaining("User");
    }

    @Test
    void testFastApiExtensionAddsSchemaNames() {
        RenderContext context = new ContextBuilder(new FastApiContextExtension()).buildContext(List.of(user()));

        Map<String, Object> model = context.toTemplateModel();
        assertThat(model.get("create_schemas")).isEqualTo(List.of("UserCreate"));
        assertThat(model.get("response_schemas")).isEqualTo(List.of("UserResponse"));
        assertThat(model.get("api_routes")).isEqualTo(List.of("/user"));
        assertThat(model.get("crud_classes")).isEqualTo(List.of("UserCRUD"));
    }

    @Test
    void testDjangoExtensionAddsAppName() {
        RenderContext context = new ContextBuilder(new DjangoContextExtension()).buildContext(List.of(user()));

        Map<String, Object> model = context.toTemplateModel();
        assertThat(model.get("app_name")).isEqualTo("core");
        assertThat(model.get("viewset_classes")).isEqualTo(List.of("UserViewSet"));
    }
}
