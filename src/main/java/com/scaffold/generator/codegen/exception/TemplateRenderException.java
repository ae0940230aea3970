package com.scaffold.generator.codegen.exception;

import java.nio.file.Path;

/**
 * Raised when a syntactically valid template fails while being evaluated,
 * typically because it references a value the render context does not carry.
 */
public class TemplateRenderException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final transient Path templatePath;

    public TemplateRenderException(Path templatePath, Throwable cause) {
        super("Failed to render template " + templatePath + ": " + cause.getMessage(), cause);
        this.templatePath = templatePath;
    }

    public Path getTemplatePath() {
        return templatePath;
    }
}
