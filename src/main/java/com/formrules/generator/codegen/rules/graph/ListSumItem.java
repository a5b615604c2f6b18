package com.formrules.generator.codegen.rules.graph;

import lombok.NonNull;
import lombok.Value;

@Value
public class ListSumItem {

    @NonNull
    BindingType sourceType;

    @NonNull
    String sourceInstanceId;

    @NonNull
    String sourceId;

    String sourceName;

    @NonNull
    String dataType;
}
