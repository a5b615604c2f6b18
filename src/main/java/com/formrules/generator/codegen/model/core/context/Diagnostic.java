package com.formrules.generator.codegen.model.core.context;

import lombok.NonNull;
import lombok.Value;

@Value
public class Diagnostic {

    @NonNull
    DiagnosticKind kind;

    /** Form the diagnostic belongs to, or {@code null} for run-level entries. */
    String formName;

    @NonNull
    String message;

    public DiagnosticKind.Severity getSeverity() {
        return kind.getSeverity();
    }

    @Override
    public String toString() {
        return formName == null
                ? kind + ": " + message
                : kind + " [" + formName + "]: " + message;
    }
}
