package com.formrules.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A view as declared in the input, before segmentation.
 */
@Value
@Builder(toBuilder = true)
public class ViewDefinition {

    @NonNull
    String viewName;

    @Singular
    List<ControlDefinition> controls;
}
