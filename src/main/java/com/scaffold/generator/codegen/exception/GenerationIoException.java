package com.scaffold.generator.codegen.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a directory or output file cannot be created or written.
 */
public class GenerationIoException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public GenerationIoException(Path path, IOException cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
