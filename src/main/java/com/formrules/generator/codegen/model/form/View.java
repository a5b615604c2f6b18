package com.formrules.generator.codegen.model.form;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A generated view: one per regular segment, two per repeating group.
 */
@Value
@Builder(toBuilder = true)
public class View {

    @NonNull
    String name;

    @NonNull
    String title;

    @NonNull
    ViewKind kind;

    @NonNull
    String sourceViewName;

    String groupName;

    @Singular
    List<Control> controls;

    ViewButtons buttons;

    public Optional<String> getGroupName() {
        return Optional.ofNullable(groupName);
    }

    public Optional<ViewButtons> getButtons() {
        return Optional.ofNullable(buttons);
    }

    public List<Control> getDataControls() {
        return controls.stream().filter(c -> !c.isStructural()).toList();
    }
}
