package com.formrules.generator.codegen.rules;

/**
 * A structural anchor of the rule graph is missing and cannot be synthesized.
 * Aborts rule generation for the current form only.
 */
public class StructuralGapException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String formName;

    public StructuralGapException(String formName, String message) {
        super(message);
        this.formName = formName;
    }

    public String getFormName() {
        return formName;
    }
}
