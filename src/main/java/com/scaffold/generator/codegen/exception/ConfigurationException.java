package com.scaffold.generator.codegen.exception;

/**
 * Raised before anything is written when the run itself is misconfigured:
 * no entities, or a stack with no components to generate.
 */
public class ConfigurationException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
