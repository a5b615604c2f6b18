package com.formrules.generator.codegen.model.form;

import lombok.NonNull;
import lombok.Value;

/**
 * Field name to control assignment inside one view.
 */
@Value
public class ControlBinding {

    @NonNull
    String fieldName;

    @NonNull
    String controlId;

    @NonNull
    String controlName;

    @NonNull
    String type;
}
