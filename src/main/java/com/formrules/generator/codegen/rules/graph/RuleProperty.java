package com.formrules.generator.codegen.rules.graph;

import lombok.NonNull;
import lombok.Value;

@Value
public class RuleProperty {

    @NonNull
    String name;

    String value;

    String displayValue;

    String nameValue;

    public static RuleProperty of(String name, String value) {
        return new RuleProperty(name, value, value, value);
    }

    /** Property whose stored value differs from what the designer shows, e.g. a view id. */
    public static RuleProperty of(String name, String value, String displayValue) {
        return new RuleProperty(name, value, displayValue, displayValue);
    }
}
