package com.scaffold.generator.codegen.model.input;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of field types an entity definition may use, with the type
 * names each target language expects.
 */
public enum FieldType {
    UUID("uuid", "UUID", "UUID", "string"),
    STRING("string", "VARCHAR", "str", "string"),
    TEXT("text", "TEXT", "str", "string"),
    INTEGER("integer", "INTEGER", "int", "number"),
    FLOAT("float", "FLOAT", "float", "number"),
    BOOLEAN("boolean", "BOOLEAN", "bool", "boolean"),
    DATETIME("datetime", "TIMESTAMP", "datetime", "Date");

    private final String id;
    private final String sqlType;
    private final String pythonType;
    private final String typescriptType;

    FieldType(String id, String sqlType, String pythonType, String typescriptType) {
        this.id = id;
        this.sqlType = sqlType;
        this.pythonType = pythonType;
        this.typescriptType = typescriptType;
    }

    public String getId() {
        return id;
    }

    public String getSqlType() {
        return sqlType;
    }

    public String getPythonType() {
        return pythonType;
    }

    public String getTypescriptType() {
        return typescriptType;
    }

    /**
     * Looks a type up by its definition name ("uuid", "string", ...). Case sensitive.
     */
    public static Optional<FieldType> fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equals(id))
                .findFirst();
    }
}
