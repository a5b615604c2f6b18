package com.formrules.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A section shown or hidden by a checkbox-like trigger. The trigger is the
 * control {@code ctrlId} when set, otherwise the field named by
 * {@code conditionField}.
 */
@Value
@Builder(toBuilder = true)
public class DynamicSection {

    String mode;
    String ctrlId;
    String caption;
    String conditionField;
    String conditionValue;

    /** Control ids toggled together. */
    @Singular
    List<String> controls;
}
