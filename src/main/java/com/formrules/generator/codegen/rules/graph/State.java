package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

@Getter
@Builder
public class State {

    @NonNull
    private final String id;

    private final String name;

    @JsonProperty("isBase")
    private final boolean base;

    @Builder.Default
    private final List<RuleEvent> events = new ArrayList<>();

    public State addEvent(RuleEvent event) {
        events.add(event);
        return this;
    }
}
