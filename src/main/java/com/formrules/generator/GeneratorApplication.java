package com.formrules.generator;

import com.formrules.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Form Rules Generator.
 * This CLI tool compiles form definition documents into generated views and
 * the rule graphs driving their navigation, submit, clear and calculation behavior.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
