package com.formrules.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.formrules.generator.codegen.model.core.context.Diagnostic;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationStats;
import com.formrules.generator.codegen.model.output.FormSummary;
import com.formrules.generator.codegen.model.output.GeneratedFile;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run. A run fails only on input or output errors; forms
 * aborted by a structural gap are reported in {@link #forms}.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private GenerationStats stats;

    @Builder.Default
    private List<FormSummary> forms = new ArrayList<>();

    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();

    @Builder.Default
    private List<GeneratedFile> files = new ArrayList<>();

    /** Rule graph per generated form name. */
    @Builder.Default
    private Map<String, RuleGraph> ruleGraphs = new LinkedHashMap<>();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public List<Diagnostic> diagnosticsOfKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).toList();
    }

    public long warningCount() {
        return diagnostics.stream().filter(d -> d.getSeverity() == DiagnosticKind.Severity.WARNING).count();
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.getSeverity() == DiagnosticKind.Severity.ERROR).count();
    }
}
