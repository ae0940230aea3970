package com.scaffold.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.cli.GenerateCommand;
import com.scaffold.generator.cli.ListTemplatesCommand;
import com.scaffold.generator.cli.ValidateCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for the Entity Scaffold Generator.
 * Generates backend source files (FastAPI, Django, ...) from entity definitions
 * using FreeMarker templates, keeping hand-written protected regions intact.
 */
@Command(
        name = "scaffold-gen",
        mixinStandardHelpOptions = true,
        version = "entity-scaffold-gen 1.0.0",
        description = "Generates backend code from entity definitions.",
        subcommands = {
                GenerateCommand.class,
                ValidateCommand.class,
                ListTemplatesCommand.class
        }
)
public class GeneratorApplication implements Runnable {

    @Option(names = {"--verbose", "-v"}, description = "Enable DEBUG logging")
    void setVerbose(boolean verbose) {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GeneratorApplication())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
