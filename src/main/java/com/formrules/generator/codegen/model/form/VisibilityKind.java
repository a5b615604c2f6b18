package com.formrules.generator.codegen.model.form;

/**
 * How the trigger field of a visibility rule is tested.
 */
public enum VisibilityKind {
    /** Dynamic section: show on {@code True}, hide on {@code False}. */
    CHECKED,
    /** Conditional visibility: show while the trigger has a value, hide while it is empty. */
    NOT_EMPTY
}
