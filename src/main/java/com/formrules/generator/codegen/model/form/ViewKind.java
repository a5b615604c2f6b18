package com.formrules.generator.codegen.model.form;

/**
 * Role of a generated view.
 */
public enum ViewKind {
    /** Bound to the root entity, whole input view. */
    PRIMARY,
    /** Bound to the root entity, one regular segment of a split input view. */
    PART,
    /** Data entry for one repeating-group row. */
    DETAIL_ITEM,
    /** Browse/edit of the repeating-group rows. */
    DETAIL_LIST;

    public boolean isDetail() {
        return this == DETAIL_ITEM || this == DETAIL_LIST;
    }
}
