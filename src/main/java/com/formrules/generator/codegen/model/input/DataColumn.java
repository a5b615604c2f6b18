package com.formrules.generator.codegen.model.input;

import lombok.Builder;
import lombok.Value;

/**
 * Entry of the form's {@code Data} section.
 */
@Value
@Builder
public class DataColumn {

    String columnName;
    boolean repeating;
    String repeatingSectionName;
    String dataType;
}
