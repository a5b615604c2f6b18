package com.formrules.generator.codegen.rules.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of the source or target of a parameter binding.
 */
public enum BindingType {
    VALUE("Value"),
    CONTROL("Control"),
    VIEW("View"),
    VIEW_PROPERTY("ViewProperty"),
    CONTROL_PROPERTY("ControlProperty"),
    OBJECT_PROPERTY("ObjectProperty"),
    FORM_PARAMETER("FormParameter"),
    ITEM_STATE("ItemState");

    private final String wireName;

    BindingType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
