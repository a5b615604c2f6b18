package com.formrules.generator.codegen.model.form;

import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Form-level action buttons.
 */
@Value
@Builder
public class FormButtons {

    public static final String SUBMIT_NAME = "Submit";
    public static final String CLEAR_NAME = "Clear Form Button";

    String submitId;
    String submitName;
    String clearId;
    String clearName;

    public Optional<String> getSubmitId() {
        return Optional.ofNullable(submitId).filter(s -> !s.isBlank());
    }

    public Optional<String> getClearId() {
        return Optional.ofNullable(clearId).filter(s -> !s.isBlank());
    }
}
