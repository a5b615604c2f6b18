package com.formrules.generator.codegen.model.input;

import lombok.Builder;
import lombok.Value;

/**
 * Raw control entry as read from the input document. Nothing is normalized here.
 */
@Value
@Builder(toBuilder = true)
public class ControlDefinition {

    String name;
    String ctrlId;
    String type;
    String label;
    String gridPosition;

    boolean inRepeatingSection;
    String repeatingSectionName;
    String parentRepeatingSectionName;

    boolean disableEditing;
}
