package com.formrules.generator.codegen.rules.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Source to target binding. Used for action parameters and action results, and
 * source side only for condition operands.
 */
@Value
@Builder(toBuilder = true)
public class ActionParameter {

    BindingType sourceType;
    String sourceId;
    String sourceName;
    String sourceDisplayName;
    String sourceInstanceId;
    String sourceValue;

    BindingType targetType;
    String targetId;
    String targetName;
    String targetDisplayName;
    String targetInstanceId;
}
