package com.formrules.generator.codegen.rules.graph;

import lombok.NonNull;
import lombok.Value;

@Value
public class IterationItem {

    @NonNull
    BindingType sourceType;

    @NonNull
    String sourceId;

    @NonNull
    String dataType;
}
