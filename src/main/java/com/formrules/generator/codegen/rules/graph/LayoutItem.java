package com.formrules.generator.codegen.rules.graph;

import com.formrules.generator.codegen.model.form.ViewKind;

import lombok.NonNull;
import lombok.Value;

/**
 * A view placed on the form, in display order.
 */
@Value
public class LayoutItem {

    @NonNull
    String viewName;

    @NonNull
    String viewId;

    @NonNull
    String instanceId;

    @NonNull
    ViewKind kind;

    String groupName;

    boolean visible;
}
