package com.formrules.generator.codegen.model.form;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Show/hide dependency between a trigger field and the fields it controls,
 * by canonical field name. Resolved to controls per view when rules are emitted.
 */
@Value
@Builder
public class VisibilityRule {

    @NonNull
    VisibilityKind kind;

    @NonNull
    String triggerField;

    @Singular
    List<String> targetFields;

    /** Caption or mode of the originating section, for logs and diagnostics. */
    String description;
}
