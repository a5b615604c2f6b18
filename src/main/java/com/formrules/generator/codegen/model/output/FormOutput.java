package com.formrules.generator.codegen.model.output;

import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of processing one form. {@code graph} is {@code null} when the form
 * was aborted.
 */
@Value
public class FormOutput {

    @NonNull
    Form form;

    RuleGraph graph;

    @NonNull
    FormSummary summary;
}
