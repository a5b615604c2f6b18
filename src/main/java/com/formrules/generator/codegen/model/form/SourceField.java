package com.formrules.generator.codegen.model.form;

import lombok.NonNull;
import lombok.Value;

@Value
public class SourceField {

    @NonNull
    String fieldName;

    @NonNull
    String groupName;
}
