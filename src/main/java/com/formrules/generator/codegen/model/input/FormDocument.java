package com.formrules.generator.codegen.model.input;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One form entry of the input document, keyed by its display name.
 */
@Value
@Builder(toBuilder = true)
public class FormDocument {

    @NonNull
    String displayName;

    @Singular
    List<ViewDefinition> views;

    @Singular
    List<DataColumn> dataColumns;

    @Singular
    List<DynamicSection> dynamicSections;

    /** Trigger field name to the names of the fields shown while it has a value. */
    @Singular
    Map<String, List<String>> visibilityTriggers;
}
