package com.scaffold.generator.codegen.exception;

/**
 * Base type for every fatal error raised by the generation pipeline.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
