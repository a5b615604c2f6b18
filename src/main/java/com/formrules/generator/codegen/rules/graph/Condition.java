package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Guard of an {@code IfLogicalHandler}. Operands use the source side of a
 * binding only: the tested control first, then the compared value if any.
 */
@Getter
@Builder
public class Condition {

    public static final String EQUALS = "SimpleEqualControlCondition";
    public static final String NOT_EMPTY = "SimpleNotEmptyCondition";
    public static final String EMPTY = "SimpleEmptyCondition";

    @NonNull
    private final String id;

    @NonNull
    private final String definitionId;

    @Builder.Default
    private final List<RuleProperty> properties = new ArrayList<>();

    @Builder.Default
    private final List<ActionParameter> operands = new ArrayList<>();

    public Condition addProperty(RuleProperty property) {
        properties.add(property);
        return this;
    }

    public Condition addOperand(ActionParameter operand) {
        operands.add(operand);
        return this;
    }

    public Optional<String> propertyValue(String name) {
        return properties.stream()
                .filter(p -> p.getName().equals(name))
                .map(RuleProperty::getValue)
                .findFirst();
    }

    public String conditionName() {
        return propertyValue("Name").orElse(null);
    }
}
