package com.scaffold.generator.codegen;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.scaffold.generator.codegen.context.ContextBuilder;
import com.scaffold.generator.codegen.context.FastApiContextExtension;
import com.scaffold.generator.codegen.exception.ConfigurationException;
import com.scaffold.generator.codegen.exception.TemplateNotFoundException;
import com.scaffold.generator.codegen.exception.TemplateRenderException;
import com.scaffold.generator.codegen.model.context.RenderContext;
import com.scaffold.generator.codegen.model.core.context.ProjectConfig;
import com.scaffold.generator.codegen.model.input.EntityDefinition;
import com.scaffold.generator.codegen.model.input.FieldDefinition;
import com.scaffold.generator.codegen.model.input.FieldType;
import com.scaffold.generator.codegen.region.ProtectedRegionMerger;
import com.scaffold.generator.codegen.template.TemplateDiscoveryService;
import com.scaffold.generator.codegen.template.TemplateResolver;

/**
 * Unit tests for GenerationOrchestrator.
 */
class GenerationOrchestratorTest {

    private static final String MODELS = "<#list entities as e>class ${e.class_name}: pass\n</#list>";
    private static final String CRUD = "from app import models\n\n\ndef get_${entity.names.snake}():\n"
            + "    return \"${project.name}\"\n";

    @TempDir
    Path tempDir;

    private Path coreRoot;
    private Path outputDir;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        coreRoot = tempDir.resolve("templates");
        outputDir = tempDir.resolve("out");
        context = new ContextBuilder(new FastApiContextExtension()).buildContext(List.of(
                entity("User"),
                entity("BlogPost")));
    }

    private static EntityDefinition entity(String name) {
        return EntityDefinition.builder()
                .name(name)
                .field(FieldDefinition.of("id", FieldType.INTEGER).primaryKey(true).build())
                .field(FieldDefinition.of("title", FieldType.STRING).build())
                .build();
    }

    private void template(String stack, String component, String body) throws IOException {
        Path dir = coreRoot.resolve("back").resolve(stack);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(component + TemplateDiscoveryService.TEMPLATE_SUFFIX), body);
    }

    private void manifest(String stack) throws IOException {
        Path dir = coreRoot.resolve("back").resolve(stack);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(TemplateDiscoveryService.MANIFEST_FILE), "name: " + stack + "\n");
    }

    private ProjectConfig.ProjectConfigBuilder config(String stack) {
        return ProjectConfig.builder().projectName("demo").stack(stack).outputDir(outputDir);
    }

    private GenerationOrchestrator orchestrator() {
        return new GenerationOrchestrator(new TemplateResolver(null, coreRoot), new ProtectedRegionMerger());
    }

    @Test
    void testWritesSingleAndPerEntityOutputs() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        template("fastapi", "crud", CRUD);

        GenerationResult result = orchestrator().generate(context, config("fastapi").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFileCount()).isEqualTo(3);
        assertThat(result.getWrittenFiles()).containsOnlyKeys("crud", "models");
        assertThat(result.filesFor("crud")).containsExactly(
                outputDir.resolve("app/crud/user_crud.py"),
                outputDir.resolve("app/crud/blog_post_crud.py"));
        assertThat(result.getSkippedComponents()).isEmpty();

        assertThat(Files.readString(outputDir.resolve("app/models.py")))
                .isEqualTo("class User: pass\nclass BlogPost: pass\n");
        assertThat(Files.readString(outputDir.resolve("app/crud/blog_post_crud.py")))
                .contains("def get_blog_post():")
                .contains("return \"demo\"");
        assertThat(Files.exists(outputDir.resolve("app/__init__.py"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("app/crud/__init__.py"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("app/routers/__init__.py"))).isFalse();
    }

    @Test
    void testMixedCaseStackNameFindsLowerCaseTemplates() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        template("fastapi", "crud", CRUD);

        GenerationResult result = orchestrator().generate(context, config("FastAPI").build());

        assertThat(result.getStack()).isEqualTo("fastapi");
        assertThat(result.getSkippedComponents()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getWrittenFiles()).containsOnlyKeys("crud", "models");
        assertThat(result.getFileCount()).isEqualTo(3);
    }

    @Test
    void testExistingPackageMarkerIsLeftAlone() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        Path marker = outputDir.resolve("app/__init__.py");
        Files.createDirectories(marker.getParent());
        Files.writeString(marker, "VERSION = '1'\n");

        orchestrator().generate(context, config("fastapi").build());

        assertThat(Files.readString(marker)).isEqualTo("VERSION = '1'\n");
    }

    @Test
    void testComponentWithoutLayoutIsSkipped() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        template("fastapi", "audit", "audit");

        GenerationResult result = orchestrator().generate(context, config("fastapi").build());

        assertThat(result.getSkippedComponents()).containsExactly("audit");
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("audit"));
        assertThat(result.getFileCount()).isEqualTo(1);
    }

    @Test
    void testUnknownStackFallsBackToDefaultComponents() throws IOException {
        // No manifest: discovery finds nothing, direct lookup still works
        template("flask", "models", MODELS);
        template("flask", "schemas", "schemas = ${entity_count}\n");

        GenerationResult result = orchestrator().generate(context, config("flask").build());

        assertThat(result.getWrittenFiles()).containsOnlyKeys("models", "schemas");
        assertThat(result.getSkippedComponents()).containsExactly("crud", "router");
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("falling back"));
        assertThat(Files.readString(outputDir.resolve("app/schemas.py"))).isEqualTo("schemas = 2\n");
    }

    @Test
    void testMissingSingleFileTemplateFailsBeforeWriting() throws IOException {
        template("flask", "models", MODELS);

        assertThatThrownBy(() -> orchestrator().generate(context, config("flask").build()))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("back/flask/schemas");
        assertThat(Files.exists(outputDir.resolve("app/models.py"))).isFalse();
    }

    @Test
    void testNoEntitiesIsAConfigurationError() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        RenderContext empty = new ContextBuilder().buildContext(List.of());

        assertThatThrownBy(() -> orchestrator().generate(empty, config("fastapi").build()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testRenderFailureStopsTheRun() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", "${no_such_variable}");

        assertThatThrownBy(() -> orchestrator().generate(context, config("fastapi").build()))
                .isInstanceOf(TemplateRenderException.class);
    }

    @Test
    void testProtectedRegionsSurviveRegeneration() throws IOException {
        manifest("fastapi");
        template("fastapi", "crud", CRUD);
        orchestrator().generate(context, config("fastapi").build());

        Path userCrud = outputDir.resolve("app/crud/user_crud.py");
        String edited = Files.readString(userCrud).replace("from app import models\n",
                "from app import models\n\n"
                        + ProtectedRegionMerger.startMarker("CUSTOM") + "\n"
                        + "def by_email(email):\n    return email\n"
                        + ProtectedRegionMerger.endMarker("CUSTOM") + "\n");
        Files.writeString(userCrud, edited);

        orchestrator().generate(context, config("fastapi").build());
        String afterFirst = Files.readString(userCrud);
        orchestrator().generate(context, config("fastapi").build());

        assertThat(afterFirst).contains("def by_email(email):").contains("def get_user():");
        assertThat(Files.readString(userCrud)).isEqualTo(afterFirst);
    }

    @Test
    void testProtectionCanBeTurnedOff() throws IOException {
        manifest("fastapi");
        template("fastapi", "crud", CRUD);
        Path userCrud = outputDir.resolve("app/crud/user_crud.py");
        Files.createDirectories(userCrud.getParent());
        Files.writeString(userCrud, ProtectedRegionMerger.startMarker("CUSTOM") + "\nx = 1\n"
                + ProtectedRegionMerger.endMarker("CUSTOM") + "\n");

        orchestrator().generate(context, config("fastapi").preserveProtectedRegions(false).build());

        assertThat(Files.readString(userCrud)).doesNotContain("CUSTOM");
    }

    @Test
    void testParallelRunMatchesSequentialRun() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        template("fastapi", "crud", CRUD);
        template("fastapi", "router", "router = \"/${entity.names.kebab}\"\n");

        GenerationResult sequential = orchestrator().generate(context, config("fastapi").build());
        String models = Files.readString(outputDir.resolve("app/models.py"));
        String router = Files.readString(outputDir.resolve("app/routers/blog_post_router.py"));

        GenerationResult parallel = orchestrator().generate(context, config("fastapi").parallelism(4).build());

        assertThat(parallel.getWrittenFiles()).isEqualTo(sequential.getWrittenFiles());
        assertThat(Files.readString(outputDir.resolve("app/models.py"))).isEqualTo(models);
        assertThat(Files.readString(outputDir.resolve("app/routers/blog_post_router.py")))
                .isEqualTo(router)
                .isEqualTo("router = \"/blog-post\"\n");
    }

    @Test
    void testParallelRunReportsFailure() throws IOException {
        manifest("fastapi");
        template("fastapi", "models", MODELS);
        template("fastapi", "crud", "${entity.no_such_key}");

        assertThatThrownBy(() -> orchestrator().generate(context, config("fastapi").parallelism(3).build()))
                .isInstanceOf(TemplateRenderException.class);
    }
}
