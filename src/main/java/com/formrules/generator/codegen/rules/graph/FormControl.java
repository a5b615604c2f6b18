package com.formrules.generator.codegen.rules.graph;

import lombok.NonNull;
import lombok.Value;

/**
 * Control owned by the form itself rather than by a view, e.g. the Submit button.
 */
@Value
public class FormControl {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    String type;
}
