package com.scaffold.generator.codegen.exception;

import java.util.List;

/**
 * Raised when entity definitions break a structural rule (bad identifier,
 * duplicate name, missing primary key, unknown field type). No render context
 * is produced when this is thrown.
 */
public class ValidationException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
