package com.formrules.generator.codegen.model.form;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structural model of one form: generated views in layout order, repeating
 * groups and their view pairs.
 */
@Value
@Builder(toBuilder = true)
public class Form {

    @NonNull
    String name;

    @NonNull
    String displayName;

    @Singular
    List<View> views;

    @Singular
    List<RepeatingGroup> groups;

    @Singular
    List<ViewPair> viewPairs;

    /** Data controls of primary and part views, i.e. the root entity fields. */
    @Singular
    List<Control> rootControls;

    FormButtons formButtons;

    @Singular
    List<VisibilityRule> visibilityRules;

    public Optional<FormButtons> getFormButtons() {
        return Optional.ofNullable(formButtons);
    }

    public Optional<RepeatingGroup> findGroup(String groupName) {
        return groups.stream().filter(g -> g.getName().equals(groupName)).findFirst();
    }

    public Optional<ViewPair> findViewPair(String groupName) {
        return viewPairs.stream().filter(p -> p.getGroupName().equals(groupName)).findFirst();
    }
}
