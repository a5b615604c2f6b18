package com.formrules.generator.codegen.model.form;

public enum SegmentKind {
    REGULAR,
    REPEATING_GROUP
}
