package com.scaffold.generator.codegen.exception;

import java.nio.file.Path;

/**
 * Raised when a template file cannot be parsed.
 */
public class TemplateSyntaxException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final transient Path templatePath;

    public TemplateSyntaxException(Path templatePath, Throwable cause) {
        super("Template syntax error in " + templatePath + ": " + cause.getMessage(), cause);
        this.templatePath = templatePath;
    }

    public Path getTemplatePath() {
        return templatePath;
    }
}
