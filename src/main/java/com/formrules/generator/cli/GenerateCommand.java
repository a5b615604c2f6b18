package com.formrules.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.cli.exception.OptionsValidationException;
import com.formrules.generator.cli.model.GenerateOptions;
import com.formrules.generator.cli.model.ValidatedGenerateOptions;
import com.formrules.generator.cli.output.GenerateResultsPrinter;
import com.formrules.generator.cli.validation.GenerateOptionsValidator;
import com.formrules.generator.codegen.FormRulesGenerator;
import com.formrules.generator.codegen.GeneratorResult;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling a form definition document into views and rule graphs.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "form-rules-generator 1.0.0",
        description = "Generates item/list views and navigation, submit, clear and calculation rules from a form definition document."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .inputFile(validated.getInputFile())
                .outputDir(validated.getNormalizedOutputDir())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .nestingOverrides(validated.getNestingOverrides())
                .submitMessage(!options.isNoSubmitMessage())
                .build();

        GeneratorResult result = new FormRulesGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(options, validated, result);
        return 0;
    }
}
