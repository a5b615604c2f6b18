package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * A user-triggered event, e.g. a button click, with its handlers in execution order.
 */
@Getter
@Builder
public class RuleEvent {

    @NonNull
    private final String id;

    @NonNull
    private final String definitionId;

    @NonNull
    @Builder.Default
    private final String name = "OnClick";

    @NonNull
    @Builder.Default
    private final String type = "User";

    @NonNull
    private final String sourceId;

    @NonNull
    @Builder.Default
    private final String sourceType = "Control";

    private final String sourceName;

    private final String sourceDisplayName;

    private final String instanceId;

    @Builder.Default
    private final boolean extended = true;

    @Builder.Default
    private final List<RuleProperty> properties = new ArrayList<>();

    @Builder.Default
    private final List<Handler> handlers = new ArrayList<>();

    public RuleEvent addProperty(RuleProperty property) {
        properties.add(property);
        return this;
    }

    public RuleEvent addHandler(Handler handler) {
        handlers.add(handler);
        return this;
    }

    public Optional<String> propertyValue(String name) {
        return properties.stream()
                .filter(p -> p.getName().equals(name))
                .map(RuleProperty::getValue)
                .findFirst();
    }

    public boolean hasProperty(String name) {
        return propertyValue(name).filter(v -> !v.isBlank()).isPresent();
    }
}
