package com.formrules.generator.codegen.model.form;

import lombok.NonNull;
import lombok.Value;

/**
 * Item control to list control correspondence for one field.
 */
@Value
public class FieldMapping {

    @NonNull
    String fieldName;

    @NonNull
    String itemControlId;

    @NonNull
    String itemControlName;

    @NonNull
    String listControlId;

    @NonNull
    String listControlName;
}
