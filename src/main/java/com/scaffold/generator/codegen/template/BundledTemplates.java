package com.scaffold.generator.codegen.template;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Map;

import com.scaffold.generator.codegen.exception.ConfigurationException;

/**
 * Locates the core template root shipped on the classpath under {@value #RESOURCE_ROOT},
 * whether the classes run from a directory or from a jar.
 */
public class BundledTemplates {

    public static final String RESOURCE_ROOT = "/integrations";

    private BundledTemplates() {
        // Utility class
    }

    public static Path coreRoot() {
        URL url = BundledTemplates.class.getResource(RESOURCE_ROOT);
        if (url == null) {
            throw new ConfigurationException("Bundled templates not found on the classpath at " + RESOURCE_ROOT);
        }
        try {
            URI uri = url.toURI();
            if ("jar".equals(uri.getScheme())) {
                openJarFileSystem(uri);
            }
            return Path.of(uri);
        } catch (URISyntaxException | IOException e) {
            throw new ConfigurationException("Cannot open bundled templates at " + url, e);
        }
    }

    private static synchronized void openJarFileSystem(URI uri) throws IOException {
        try {
            FileSystems.getFileSystem(uri);
        } catch (FileSystemNotFoundException e) {
            FileSystems.newFileSystem(uri, Map.of());
        }
    }
}
