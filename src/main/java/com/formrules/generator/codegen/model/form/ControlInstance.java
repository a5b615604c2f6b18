package com.formrules.generator.codegen.model.form;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * One physical occurrence of a field's control in a deployed view.
 */
@Value
public class ControlInstance {

    @NonNull
    String fieldName;

    @NonNull
    String controlId;

    String controlName;

    @NonNull
    String viewInstanceId;

    String viewName;

    /** Repeating group owning the view, {@code null} for primary and part views. */
    String groupName;

    public Optional<String> getGroupName() {
        return Optional.ofNullable(groupName);
    }
}
