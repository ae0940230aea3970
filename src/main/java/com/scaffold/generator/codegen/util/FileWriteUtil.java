package com.scaffold.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Creates an empty file unless one already exists. Returns true when the file was created.
     */
    public static boolean createIfAbsent(Path filePath) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            createDirectories(parentDir);
        }
        try {
            Files.createFile(filePath);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Creates directories recursively. Safe to call from several threads for the same path.
     */
    public static void createDirectories(Path dir) throws IOException {
        try {
            Files.createDirectories(dir);
        } catch (FileAlreadyExistsException e) {
            // another writer won the race, or a regular file sits at the path
            if (!Files.isDirectory(dir)) {
                throw e;
            }
        }
    }
}
