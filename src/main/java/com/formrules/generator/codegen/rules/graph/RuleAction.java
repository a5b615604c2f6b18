package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * A single step of a handler. For-each actions carry an iteration function and
 * nested actions.
 */
@Getter
@Builder
public class RuleAction {

    @NonNull
    private final String id;

    @NonNull
    private final String definitionId;

    @NonNull
    private final ActionKind type;

    @NonNull
    private final ExecutionType executionType;

    private final String instanceId;

    @Builder.Default
    private final List<RuleProperty> properties = new ArrayList<>();

    @Builder.Default
    private final List<ActionParameter> parameters = new ArrayList<>();

    @Builder.Default
    private final List<ActionParameter> results = new ArrayList<>();

    private final IterationFunction function;

    @Builder.Default
    private final List<RuleAction> actions = new ArrayList<>();

    public RuleAction addProperty(RuleProperty property) {
        properties.add(property);
        return this;
    }

    public RuleAction addParameter(ActionParameter parameter) {
        parameters.add(parameter);
        return this;
    }

    public RuleAction addResult(ActionParameter result) {
        results.add(result);
        return this;
    }

    public RuleAction addAction(RuleAction action) {
        actions.add(action);
        return this;
    }

    public Optional<String> propertyValue(String name) {
        return properties.stream()
                .filter(p -> p.getName().equals(name))
                .map(RuleProperty::getValue)
                .findFirst();
    }
}
