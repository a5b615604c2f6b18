package com.formrules.generator.codegen.model.form;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A control placed in a view. Immutable: detail views receive their own copy
 * with a fresh identifier via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Control {

    @NonNull
    String id;

    /** Canonical field name, used to match controls across views. */
    @NonNull
    String name;

    @NonNull
    String type;

    String label;

    /** Display name of the control inside its view, e.g. {@code Amount Text Box}. */
    @NonNull
    String controlName;

    @NonNull
    @Builder.Default
    GridPosition gridPosition = GridPosition.DEFAULT;

    String groupName;

    String declaredParentGroup;

    boolean structural;

    @Builder.Default
    boolean editable = true;

    public Optional<String> getGroupName() {
        return Optional.ofNullable(groupName);
    }

    public Optional<String> getDeclaredParentGroup() {
        return Optional.ofNullable(declaredParentGroup);
    }

    public boolean isInGroup() {
        return groupName != null;
    }

    public int getRow() {
        return gridPosition.getRow();
    }
}
