package com.formrules.generator.codegen.parsing.exception;

/**
 * The input document is valid JSON but does not have the expected form
 * definition shape.
 */
public class FormDefinitionParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FormDefinitionParseException(String message) {
        super(message);
    }
}
