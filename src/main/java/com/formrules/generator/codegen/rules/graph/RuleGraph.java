package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Getter;
import lombok.NonNull;

/**
 * Root of the emitted rule graph of one form. Append-only: nodes are attached,
 * never replaced or removed.
 */
@Getter
@JsonPropertyOrder({ "formId", "formName", "displayName", "parameters", "controls", "expressions", "layout", "states" })
public class RuleGraph {

    private final String formId;

    @NonNull
    private final String formName;

    private final String displayName;

    private final List<FormParameter> parameters = new ArrayList<>();

    private final List<FormControl> controls = new ArrayList<>();

    private final List<LayoutItem> layout = new ArrayList<>();

    /** {@code null} until the first state is requested. */
    private List<State> states;

    /** {@code null} until the first expression is added. */
    private List<Expression> expressions;

    public RuleGraph(String formId, @NonNull String formName, String displayName) {
        this.formId = formId;
        this.formName = formName;
        this.displayName = displayName;
    }

    @JsonIgnore
    public List<State> getOrCreateStates() {
        if (states == null) {
            states = new ArrayList<>();
        }
        return states;
    }

    @JsonIgnore
    public List<Expression> getOrCreateExpressions() {
        if (expressions == null) {
            expressions = new ArrayList<>();
        }
        return expressions;
    }

    public Optional<LayoutItem> findLayoutItem(String viewName) {
        return layout.stream().filter(l -> l.getViewName().equals(viewName)).findFirst();
    }

    public Optional<FormParameter> findParameter(String name) {
        return parameters.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /** All events of all states, in document order. */
    public Stream<RuleEvent> events() {
        return states == null ? Stream.empty() : states.stream().flatMap(s -> s.getEvents().stream());
    }

    /** All actions, nested for-each actions included, in document order. */
    public Stream<RuleAction> actions() {
        return events()
                .flatMap(e -> e.getHandlers().stream())
                .flatMap(h -> h.getActions().stream())
                .flatMap(RuleGraph::withNested);
    }

    private static Stream<RuleAction> withNested(RuleAction action) {
        return Stream.concat(Stream.of(action), action.getActions().stream().flatMap(RuleGraph::withNested));
    }
}
