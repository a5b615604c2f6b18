package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@Getter
@Builder
public class Handler {

    public static final String FOR_EACH = "ForEach";

    @NonNull
    private final String id;

    @NonNull
    private final String definitionId;

    /** {@code null} for plain handlers, {@link #FOR_EACH} for row iteration. */
    private final String type;

    @Builder.Default
    private final List<RuleProperty> properties = new ArrayList<>();

    private final IterationFunction function;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Builder.Default
    private final List<Condition> conditions = new ArrayList<>();

    @Builder.Default
    private final List<RuleAction> actions = new ArrayList<>();

    public Handler addProperty(RuleProperty property) {
        properties.add(property);
        return this;
    }

    public Handler addCondition(Condition condition) {
        conditions.add(condition);
        return this;
    }

    public Handler addAction(RuleAction action) {
        actions.add(action);
        return this;
    }

    public Optional<String> propertyValue(String name) {
        return properties.stream()
                .filter(p -> p.getName().equals(name))
                .map(RuleProperty::getValue)
                .findFirst();
    }

    public String handlerName() {
        return propertyValue("HandlerName").orElse(null);
    }
}
