package com.formrules.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.cli.model.GenerateOptions;
import com.formrules.generator.cli.model.ValidatedGenerateOptions;
import com.formrules.generator.codegen.GeneratorResult;
import com.formrules.generator.codegen.model.core.context.Diagnostic;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationStats;
import com.formrules.generator.codegen.model.output.FormSummary;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Form Rules Generator");
        log.info("=================================================");
        log.info("Input Document: {}", v.getInputFile());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Force: {}", o.isForce());
        log.info("Dry Run: {}", o.isDryRun());
        log.info("Submit Message: {}", !o.isNoSubmitMessage());
        if (!v.getNestingOverrides().isEmpty()) {
            log.info("-------------------------------------------------");
            log.info("Nesting Overrides:");
            v.getNestingOverrides().forEach((child, parent) -> log.info("  {} -> {}", child, parent));
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, ValidatedGenerateOptions v, GeneratorResult result) {
        GenerationStats stats = result.getStats();

        log.info("");
        log.info("=================================================");
        log.info(stats.getFormsFailed() == 0 ? "GENERATION SUCCESSFUL" : "GENERATION COMPLETED WITH FAILED FORMS");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Forms Processed: {}", stats.getFormCount());
        log.info("Forms Failed: {}", stats.getFormsFailed());
        log.info("Views Generated: {}", stats.getViewCount());
        log.info("Item/List View Pairs: {}", stats.getViewPairCount());
        log.info("Rule Events: {}", stats.getEventCount());
        log.info("Rule Handlers: {}", stats.getHandlerCount());
        log.info("Calculation Expressions: {}", stats.getExpressionCount());
        log.info(o.isDryRun() ? "Files (dry run, not written): {}" : "Files Written: {}", stats.getFileCount());
        log.info("Generation Time: {} ms", stats.getGenerationTimeMillis());

        log.info("");
        log.info("Forms:");
        for (FormSummary form : result.getForms()) {
            if (form.isGenerated()) {
                log.info("  {}: {} view(s), {} event(s), {} expression(s)",
                        form.getFormName(), form.getViewCount(), form.getEventCount(), form.getExpressionCount());
            } else {
                log.info("  {}: NOT GENERATED ({})", form.getFormName(), form.getFailureReason());
            }
        }

        log.info("");
        log.info("Diagnostics: {} error(s), {} warning(s)", result.errorCount(), result.warningCount());
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            if (diagnostic.getSeverity() == DiagnosticKind.Severity.INFO) {
                continue;
            }
            log.info("  {}", diagnostic);
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("=================================================");
        log.error("GENERATION FAILED");
        log.error("=================================================");
        log.error("{}", result.getErrorMessage());
    }
}
