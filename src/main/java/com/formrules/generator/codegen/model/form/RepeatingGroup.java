package com.formrules.generator.codegen.model.form;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named one-to-many child record set. Depth and parent are filled in by the
 * nesting resolver; the root form is depth 0.
 */
@Value
@Builder(toBuilder = true)
public class RepeatingGroup {

    public static final String ROOT_PARENT = "MAIN_FORM";

    @NonNull
    String name;

    @NonNull
    String sourceViewName;

    @Singular
    List<Control> controls;

    /** Parent declared by the input document, before override resolution. */
    String declaredParent;

    int depth;

    String parentName;

    @Singular
    List<String> childNames;

    public Optional<String> getParentName() {
        return Optional.ofNullable(parentName);
    }

    public Optional<String> getDeclaredParent() {
        return Optional.ofNullable(declaredParent);
    }

    public boolean isChildOfRoot() {
        return ROOT_PARENT.equals(parentName);
    }

    public boolean hasGroupParent() {
        return parentName != null && !isChildOfRoot();
    }
}
