package com.formrules.generator.codegen.rules.graph;

import lombok.NonNull;
import lombok.Value;

@Value
public class FormParameter {

    public static final String ID = "ID";

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    String dataType;

    String defaultValue;
}
