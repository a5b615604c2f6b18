package com.formrules.generator.codegen.rules.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action types understood by the target runtime.
 */
public enum ActionKind {
    TRANSFER("Transfer"),
    LIST("List"),
    EXECUTE("Execute"),
    FOR_EACH("ForEach"),
    POPUP("Popup");

    private final String wireName;

    ActionKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
