package com.scaffold.generator.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scaffold.generator.codegen.exception.ConfigurationException;

/**
 * Reads a YAML project file into a {@link ProjectDefinition}.
 *
 * <pre>{@code
 * project:
 *   name: blog
 * stack:
 *   back: fastapi
 * settings:
 *   database_url: sqlite:///./app.db
 * entities:
 *   - name: Post
 *     fields:
 *       - {name: id, type: uuid, primary_key: true}
 * }</pre>
 *
 * <p>Entities may instead live in a separate file named by {@code entities_file},
 * resolved against the project file's directory.
 */
public class ProjectFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectFileLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public ProjectDefinition load(Path projectFile) {
        JsonNode root = readYaml(projectFile);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Project file " + projectFile + " must contain a mapping at the top level.");
        }

        ProjectDefinition.ProjectDefinitionBuilder builder = ProjectDefinition.builder().source(projectFile);
        readProject(projectFile, root.path("project"), builder);
        readStack(projectFile, root.path("stack"), builder);

        JsonNode settings = root.path("settings");
        if (settings.isObject()) {
            builder.settings(YAML_MAPPER.convertValue(settings, MAP_TYPE));
        } else if (!settings.isMissingNode() && !settings.isNull()) {
            throw new ConfigurationException("'settings' in " + projectFile + " must be a mapping.");
        }

        JsonNode entities = entitiesNode(projectFile, root);
        for (JsonNode record : entities) {
            if (!record.isObject()) {
                throw new ConfigurationException("Each entity in " + projectFile + " must be a mapping, got: " + record);
            }
            builder.entityRecord(YAML_MAPPER.convertValue(record, MAP_TYPE));
        }

        ProjectDefinition definition = builder.build();
        log.info("Loaded project '{}' from {} ({} entities, stack {}/{})", definition.getProjectName(), projectFile,
                definition.getEntityRecords().size(), definition.getCategory(), definition.getStack());
        return definition;
    }

    private static JsonNode readYaml(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new ConfigurationException("Project file not found or not readable: " + file);
        }
        try {
            log.debug("Reading {}", file);
            return YAML_MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse " + file + ": " + e.getMessage(), e);
        }
    }

    private static void readProject(Path file, JsonNode project, ProjectDefinition.ProjectDefinitionBuilder builder) {
        String name = project.path("name").asText("").trim();
        if (name.isEmpty()) {
            throw new ConfigurationException("Project file " + file + " does not define project.name.");
        }
        builder.projectName(name);
        if (project.hasNonNull("description")) {
            builder.description(project.get("description").asText());
        }
        if (project.hasNonNull("version")) {
            builder.version(project.get("version").asText());
        }
    }

    private static void readStack(Path file, JsonNode stack, ProjectDefinition.ProjectDefinitionBuilder builder) {
        if (stack.isMissingNode() || stack.isNull()) {
            return;
        }
        if (stack.isTextual()) {
            builder.stack(stack.asText());
            return;
        }
        if (!stack.isObject() || stack.size() == 0) {
            throw new ConfigurationException("'stack' in " + file + " must be a stack name or a {category: stack} mapping.");
        }

        String category = stack.has("back") ? "back" : stack.fieldNames().next();
        if (stack.size() > 1) {
            log.warn("Project file {} lists several stacks; generating '{}' only", file, category);
        }
        builder.category(category).stack(stack.get(category).asText());
    }

    private static JsonNode entitiesNode(Path file, JsonNode root) {
        JsonNode entities = root.path("entities");
        if (entities.isMissingNode() && root.hasNonNull("entities_file")) {
            Path entitiesFile = file.toAbsolutePath().getParent().resolve(root.get("entities_file").asText());
            JsonNode external = readYaml(entitiesFile);
            entities = external != null && external.isObject() ? external.path("entities") : external;
            file = entitiesFile;
        }

        if (entities == null || entities.isMissingNode() || entities.isNull()) {
            return YAML_MAPPER.createArrayNode();
        }
        if (!entities.isArray()) {
            throw new ConfigurationException("'entities' in " + file + " must be a list.");
        }
        return entities;
    }
}
