package com.formrules.generator.codegen.rules.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the runtime executes an action relative to its siblings. Metadata only,
 * the generator itself is single-threaded.
 */
public enum ExecutionType {
    SYNCHRONOUS("Synchronous"),
    PARALLEL("Parallel");

    private final String wireName;

    ExecutionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
