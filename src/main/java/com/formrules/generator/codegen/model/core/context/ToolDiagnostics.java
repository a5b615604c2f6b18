package com.formrules.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tool-wide diagnostics accumulated during a generation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class ToolDiagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(DiagnosticKind kind, String formName, String message) {
        if (message != null && !message.isBlank()) {
            entries.add(new Diagnostic(kind, formName, message));
        }
    }

    public void info(String formName, String message) {
        report(DiagnosticKind.INFO, formName, message);
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).toList();
    }

    public List<Diagnostic> getWarnings() {
        return withSeverity(DiagnosticKind.Severity.WARNING);
    }

    public List<Diagnostic> getInfos() {
        return withSeverity(DiagnosticKind.Severity.INFO);
    }

    private List<Diagnostic> withSeverity(DiagnosticKind.Severity severity) {
        return entries.stream().filter(d -> d.getSeverity() == severity).toList();
    }
}
