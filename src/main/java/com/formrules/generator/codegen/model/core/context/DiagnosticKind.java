package com.formrules.generator.codegen.model.core.context;

/**
 * Categories of problems reported during a generation run.
 */
public enum DiagnosticKind {

    /** A structural anchor is missing; aborts the current form. */
    STRUCTURAL_GAP(Severity.ERROR),
    /** Field present on one side of a view pair only, or a calculation source without instances. */
    MISSING_MAPPING(Severity.WARNING),
    /** Navigation or form button absent; the individual rule is skipped. */
    MISSING_BUTTON(Severity.WARNING),
    /** A nested group's parent could not be located; its submit handler is skipped. */
    UNRESOLVED_PARENT(Severity.WARNING),
    /** The deployment collaborator failed for one view. */
    DEPLOYMENT_FAILURE(Severity.ERROR),
    /** Two forms canonicalize to the same name; the later one is renamed. */
    NAME_COLLISION(Severity.WARNING),
    /** Trigger or target field of a visibility rule not found on any view; the rule is skipped. */
    UNRESOLVED_CONTROL(Severity.WARNING),
    /** Post-hoc rule graph consistency warning. */
    VALIDATION(Severity.WARNING),
    INFO(Severity.INFO);

    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
